package com.example.ev_valuation.catalog;

import static org.junit.jupiter.api.Assertions.*;

import java.io.OutputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;

class ReferenceCatalogBuilderTest {

    @TempDir
    Path dir;

    private ReferenceCatalogBuilder builder(Path xlsx, Path csv, String bundled) {
        return new ReferenceCatalogBuilder(List.<Resource>of(
                new FileSystemResource(xlsx),
                new FileSystemResource(csv),
                new ClassPathResource(bundled)));
    }

    private Path write(String name, String content) throws Exception {
        Path p = dir.resolve(name);
        Files.writeString(p, content, StandardCharsets.UTF_8);
        return p;
    }

    private Path writeWorkbook(String name, Object[]... rows) throws Exception {
        Path p = dir.resolve(name);
        try (XSSFWorkbook wb = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(p)) {
            Sheet sheet = wb.createSheet("data");
            for (int r = 0; r < rows.length; r++) {
                Row row = sheet.createRow(r);
                for (int c = 0; c < rows[r].length; c++) {
                    Object v = rows[r][c];
                    if (v instanceof Number n) {
                        row.createCell(c).setCellValue(n.doubleValue());
                    } else {
                        row.createCell(c).setCellValue(String.valueOf(v));
                    }
                }
            }
            wb.write(out);
        }
        return p;
    }

    @Test
    void noUserFiles_usesBundledSample() {
        CatalogBuildResult result = builder(dir.resolve("ev_data.xlsx"), dir.resolve("ev_data.csv"),
                "catalog/canonical.csv").build();

        assertEquals(CatalogSchema.CANONICAL, result.schema());
        assertEquals(3, result.catalog().size());
        assertTrue(result.source().contains("canonical.csv"));
    }

    @Test
    void userCsv_winsOverBundledSample() throws Exception {
        Path csv = write("ev_data.csv", "make,model,base_price,year0\nPolestar,2,38000,2021\n");

        CatalogBuildResult result = builder(dir.resolve("ev_data.xlsx"), csv, "catalog/canonical.csv").build();

        assertEquals(1, result.catalog().size());
        assertEquals(List.of("polestar"), result.catalog().makes());
    }

    @Test
    void userSpreadsheet_winsOverCsv() throws Exception {
        write("ev_data.csv", "make,model,base_price,year0\nPolestar,2,38000,2021\n");
        Path xlsx = writeWorkbook("ev_data.xlsx",
                new Object[] { " Make", "MODEL ", "Price", "Registration_Year" },
                new Object[] { "Tesla", "Model 3", 27000, 2019 },
                new Object[] { "tesla", "model 3", 29000, 2020 },
                new Object[] { "Hyundai", "Ioniq 5", 36000, 2022 });

        CatalogBuildResult result = builder(xlsx, dir.resolve("ev_data.csv"), "catalog/canonical.csv").build();

        assertEquals(CatalogSchema.TRANSACTIONAL, result.schema());
        ReferenceCatalog catalog = result.catalog();
        assertEquals(List.of("hyundai", "tesla"), catalog.makes());
        VehicleArchetype tesla = catalog.find("Tesla", "Model 3").orElseThrow();
        assertEquals(0, new BigDecimal("28000").compareTo(tesla.getBasePrice()));
        assertEquals(2019, tesla.getYear0());
    }

    @Test
    void canonicalSpreadsheet_passesThrough() throws Exception {
        Path xlsx = writeWorkbook("ev_data.xlsx",
                new Object[] { "make", "model", "base_price", "year0" },
                new Object[] { " Kia ", " EV6", 31000, 2022 });

        CatalogBuildResult result = builder(xlsx, dir.resolve("ev_data.csv"), "catalog/canonical.csv").build();

        assertEquals(CatalogSchema.CANONICAL, result.schema());
        VehicleArchetype kia = result.catalog().find("kia", "ev6").orElseThrow();
        assertEquals(0, new BigDecimal("31000").compareTo(kia.getBasePrice()));
        assertEquals(2022, kia.getYear0());
    }

    @Test
    void canonicalCsv_keepsNonPositivePrices_andSkipsUnparseableRows() throws Exception {
        Path csv = write("ev_data.csv", "make,model,base_price,year0\n"
                + "Fiat,500e,0,2021\n"
                + "Fiat,Panda,cheap,2021\n"
                + "Mini,Cooper SE,-5,2020\n");

        ReferenceCatalog catalog = builder(dir.resolve("none.xlsx"), csv, "catalog/canonical.csv").build().catalog();

        assertEquals(2, catalog.size());
        assertEquals(0, BigDecimal.ZERO.compareTo(catalog.find("fiat", "500e").orElseThrow().getBasePrice()));
        assertTrue(catalog.find("fiat", "panda").isEmpty());
    }

    @Test
    void unrecognizedColumns_fallBackToBuiltInCatalog() throws Exception {
        Path csv = write("ev_data.csv", "brand,type,cost\nTesla,Model 3,1\n");

        CatalogBuildResult result = builder(dir.resolve("none.xlsx"), csv, "catalog/canonical.csv").build();

        assertEquals(CatalogSchema.FALLBACK, result.schema());
        assertEquals(FallbackCatalog.rows(), result.catalog().rows());
    }

    @Test
    void corruptSpreadsheet_fallsBackToBuiltInCatalog() throws Exception {
        Path xlsx = write("ev_data.xlsx", "this is not a workbook");

        CatalogBuildResult result = builder(xlsx, dir.resolve("ev_data.csv"), "catalog/canonical.csv").build();

        assertEquals(CatalogSchema.FALLBACK, result.schema());
        assertEquals(5, result.catalog().size());
    }

    @Test
    void nothingAvailable_fallsBackToBuiltInCatalog() {
        CatalogBuildResult result = builder(dir.resolve("a.xlsx"), dir.resolve("b.csv"), "catalog/missing.csv")
                .build();

        assertEquals(CatalogSchema.FALLBACK, result.schema());
        assertEquals(List.of("nissan", "tesla", "volkswagen"), result.catalog().makes());
    }
}
