package com.example.ev_valuation.catalog;

import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;

/**
 * Catalog beans. The catalog is built synchronously while the context starts,
 * so no request can observe a partial catalog.
 */
@Configuration
public class CatalogConfig {

    @Bean
    public ReferenceCatalogBuilder referenceCatalogBuilder(
            @Value("${catalog.spreadsheet-path:data/ev_data.xlsx}") String spreadsheetPath,
            @Value("${catalog.csv-path:data/ev_data.csv}") String csvPath,
            @Value("${catalog.default-resource:data/sample_ev_data.csv}") String defaultResource) {
        return new ReferenceCatalogBuilder(List.of(
                new FileSystemResource(spreadsheetPath),
                new FileSystemResource(csvPath),
                new ClassPathResource(defaultResource)));
    }

    @Bean
    public CatalogBuildResult catalogBuildResult(ReferenceCatalogBuilder builder) {
        return builder.build();
    }

    @Bean
    public ReferenceCatalog referenceCatalog(CatalogBuildResult result) {
        return result.catalog();
    }
}
