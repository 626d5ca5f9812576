package com.example.ev_valuation.catalog;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SpreadsheetTableReaderTest {

    private Locale previous;

    @BeforeEach
    void setUp() {
        previous = Locale.getDefault();
        // decimal comma host
        Locale.setDefault(Locale.GERMANY);
    }

    @AfterEach
    void tearDown() {
        Locale.setDefault(previous);
    }

    private static byte[] workbook() throws Exception {
        try (XSSFWorkbook wb = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = wb.createSheet("data");
            CellStyle grouped = wb.createCellStyle();
            grouped.setDataFormat(wb.createDataFormat().getFormat("#,##0"));

            Row header = sheet.createRow(0);
            String[] names = { "make", "model", "base_price", "year0" };
            for (int c = 0; c < names.length; c++) {
                header.createCell(c).setCellValue(names[c]);
            }

            Row general = sheet.createRow(1);
            general.createCell(0).setCellValue("Tesla");
            general.createCell(1).setCellValue("Model 3");
            general.createCell(2).setCellValue(28000.5);
            general.createCell(3).setCellValue(2019);

            Row formatted = sheet.createRow(2);
            formatted.createCell(0).setCellValue("Tesla");
            formatted.createCell(1).setCellValue("Model Y");
            formatted.createCell(2).setCellValue(27999.5);
            formatted.getCell(2).setCellStyle(grouped);
            formatted.createCell(3).setCellValue(2021);

            Row formula = sheet.createRow(3);
            formula.createCell(0).setCellValue("Nissan");
            formula.createCell(1).setCellValue("Leaf");
            formula.createCell(2).setCellFormula("10000+2000.25");
            formula.getCell(2).setCellStyle(grouped);
            formula.createCell(3).setCellValue(2018);

            wb.write(out);
            return out.toByteArray();
        }
    }

    @Test
    void read_numericCells_ignoreDefaultLocaleAndDisplayFormat() throws Exception {
        RawTable t = new SpreadsheetTableReader().read(new ByteArrayInputStream(workbook()));

        List<VehicleArchetype> rows = new CanonicalSchemaStrategy().build(t);

        assertEquals(3, rows.size());
        assertEquals(0, new BigDecimal("28000.5").compareTo(rows.get(0).getBasePrice()));
        assertEquals(0, new BigDecimal("27999.5").compareTo(rows.get(1).getBasePrice()));
        assertEquals(0, new BigDecimal("12000.25").compareTo(rows.get(2).getBasePrice()));
        assertEquals(2019, rows.get(0).getYear0());
    }
}
