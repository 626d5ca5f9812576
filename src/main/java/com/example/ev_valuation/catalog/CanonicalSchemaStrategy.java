package com.example.ev_valuation.catalog;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Columns make, model, base_price, year0: rows pass through in file order.
 */
public class CanonicalSchemaStrategy implements CatalogSchemaStrategy {

    private static final Logger log = LoggerFactory.getLogger(CanonicalSchemaStrategy.class);

    @Override
    public CatalogSchema schema() {
        return CatalogSchema.CANONICAL;
    }

    @Override
    public boolean applies(RawTable table) {
        return table.hasColumns("make", "model", "base_price", "year0");
    }

    @Override
    public List<VehicleArchetype> build(RawTable table) {
        List<VehicleArchetype> out = new ArrayList<>();
        int lineNumber = 1;

        for (List<String> row : table.rows()) {
            lineNumber++;

            String make = table.cell(row, "make");
            String model = table.cell(row, "model");
            if (make == null || model == null) {
                log.warn("Row {}: make/model missing, skipped", lineNumber);
                continue;
            }

            BigDecimal basePrice = Cells.decimal(table.cell(row, "base_price"));
            Integer year0 = Cells.year(table.cell(row, "year0"));
            if (basePrice == null || year0 == null) {
                log.warn("Row {}: invalid base_price/year0 ({}, {}), skipped", lineNumber,
                        table.cell(row, "base_price"), table.cell(row, "year0"));
                continue;
            }

            out.add(VehicleArchetype.of(make, model, basePrice, year0));
        }
        return out;
    }
}
