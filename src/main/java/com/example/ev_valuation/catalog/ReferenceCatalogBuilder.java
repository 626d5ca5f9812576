package com.example.ev_valuation.catalog;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

/**
 * Builds the {@link ReferenceCatalog} from the first available input:
 * user spreadsheet, user CSV, then the bundled sample CSV.
 *
 * <p>Never throws for missing or malformed input; every degraded path ends in
 * the {@link FallbackCatalog} and is reported through
 * {@link CatalogBuildResult#schema()}.
 */
public class ReferenceCatalogBuilder {

    private static final Logger log = LoggerFactory.getLogger(ReferenceCatalogBuilder.class);

    private final List<Resource> candidates;
    private final List<CatalogSchemaStrategy> strategies;
    private final TableReader csvReader;
    private final TableReader spreadsheetReader;

    public ReferenceCatalogBuilder(List<Resource> candidates) {
        this(candidates,
                List.of(new CanonicalSchemaStrategy(), new TransactionalSchemaStrategy()),
                new CsvTableReader(),
                new SpreadsheetTableReader());
    }

    public ReferenceCatalogBuilder(List<Resource> candidates,
            List<CatalogSchemaStrategy> strategies,
            TableReader csvReader,
            TableReader spreadsheetReader) {
        this.candidates = List.copyOf(candidates);
        this.strategies = List.copyOf(strategies);
        this.csvReader = csvReader;
        this.spreadsheetReader = spreadsheetReader;
    }

    public CatalogBuildResult build() {
        Resource source = resolveSource();
        if (source == null) {
            log.warn("No catalog input found in {}, using built-in catalog", candidates);
            return fallback("built-in");
        }

        String name = source.getDescription();
        RawTable table;
        try (InputStream in = source.getInputStream()) {
            table = readerFor(source).read(in);
        } catch (IOException | RuntimeException e) {
            // POI reports corrupt workbooks with unchecked exceptions
            log.warn("Failed to read catalog input {}, using built-in catalog", name, e);
            return fallback(name);
        }

        for (CatalogSchemaStrategy strategy : strategies) {
            if (strategy.applies(table)) {
                ReferenceCatalog catalog = new ReferenceCatalog(strategy.build(table));
                log.info("Catalog built from {} ({} schema): {} rows",
                        name, strategy.schema(), catalog.size());
                return new CatalogBuildResult(catalog, strategy.schema(), name);
            }
        }

        log.warn("Unrecognized catalog columns {} in {}, using built-in catalog", table.columns(), name);
        return fallback(name);
    }

    /**
     * First candidate that exists, or null.
     */
    Resource resolveSource() {
        for (Resource r : candidates) {
            if (r != null && r.exists()) {
                return r;
            }
        }
        return null;
    }

    private TableReader readerFor(Resource source) {
        String filename = source.getFilename();
        if (filename != null && filename.toLowerCase(Locale.ROOT).endsWith(".xlsx")) {
            return spreadsheetReader;
        }
        return csvReader;
    }

    private static CatalogBuildResult fallback(String source) {
        ReferenceCatalog catalog = new ReferenceCatalog(FallbackCatalog.rows());
        log.info("Catalog built from built-in defaults: {} rows", catalog.size());
        return new CatalogBuildResult(catalog, CatalogSchema.FALLBACK, source);
    }
}
