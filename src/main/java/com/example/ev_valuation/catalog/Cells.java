package com.example.ev_valuation.catalog;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Pattern;

/**
 * Lenient numeric parsing for catalog cells. Failures return null.
 */
final class Cells {

    // 12,345 / 1,234,567.89; anything else with a comma (e.g. decimal comma 12,5) is rejected
    private static final Pattern GROUPED = Pattern.compile("[-+]?\\d{1,3}(,\\d{3})+(\\.\\d+)?");

    private Cells() {
    }

    static BigDecimal decimal(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            // currency symbols, spaces
            String cleaned = value.replace("\u20AC", "")
                    .replace("$", "")
                    .replace(" ", "")
                    .replace("\u00A0", "")
                    .trim();
            if (cleaned.indexOf(',') >= 0) {
                if (!GROUPED.matcher(cleaned).matches()) {
                    return null;
                }
                cleaned = cleaned.replace(",", "");
            }
            return new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Year cells may come back as "2019" or "2019.0" (spreadsheet numerics);
     * fractional values truncate.
     */
    static Integer year(String value) {
        BigDecimal d = decimal(value);
        if (d == null) {
            return null;
        }
        try {
            return d.setScale(0, RoundingMode.DOWN).intValueExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }
}
