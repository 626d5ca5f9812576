package com.example.ev_valuation.catalog;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.CellValue;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

/**
 * Reads the first sheet of an .xlsx workbook. Numeric cells (and formulas
 * evaluating to a number) come out as plain decimals regardless of the cell's
 * display format or the JVM locale; everything else as displayed text.
 */
public class SpreadsheetTableReader implements TableReader {

    @Override
    public RawTable read(InputStream in) throws IOException {
        try (Workbook workbook = WorkbookFactory.create(in)) {
            if (workbook.getNumberOfSheets() == 0) {
                return new RawTable(List.of(), List.of());
            }
            Sheet sheet = workbook.getSheetAt(0);
            DataFormatter formatter = new DataFormatter(Locale.ROOT);
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();

            Row headerRow = sheet.getRow(sheet.getFirstRowNum());
            if (headerRow == null) {
                return new RawTable(List.of(), List.of());
            }
            List<String> header = cells(headerRow, formatter, evaluator, headerRow.getLastCellNum());

            List<List<String>> rows = new ArrayList<>();
            for (int r = sheet.getFirstRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) {
                    continue;
                }
                List<String> values = cells(row, formatter, evaluator, header.size());
                if (values.stream().allMatch(String::isBlank)) {
                    continue;
                }
                rows.add(values);
            }
            return new RawTable(header, rows);
        }
    }

    private static List<String> cells(Row row, DataFormatter formatter, FormulaEvaluator evaluator, int width) {
        List<String> values = new ArrayList<>(Math.max(width, 0));
        for (int c = 0; c < width; c++) {
            Cell cell = row.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
            values.add(cell == null ? "" : text(cell, formatter, evaluator));
        }
        return values;
    }

    static String text(Cell cell, DataFormatter formatter, FormulaEvaluator evaluator) {
        CellType type = cell.getCellType();
        if (type == CellType.NUMERIC && !DateUtil.isCellDateFormatted(cell)) {
            return plain(cell.getNumericCellValue());
        }
        if (type == CellType.FORMULA) {
            CellValue v = evaluator.evaluate(cell);
            if (v != null && v.getCellType() == CellType.NUMERIC && !DateUtil.isCellDateFormatted(cell)) {
                return plain(v.getNumberValue());
            }
        }
        return formatter.formatCellValue(cell, evaluator);
    }

    private static String plain(double value) {
        return BigDecimal.valueOf(value).toPlainString();
    }
}
