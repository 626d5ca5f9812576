package com.example.ev_valuation.catalog;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Columns make, model, price (one row per observed sale): aggregated to one
 * archetype per (make, model) using medians. Groups come out sorted by key.
 */
public class TransactionalSchemaStrategy implements CatalogSchemaStrategy {

    private static final Logger log = LoggerFactory.getLogger(TransactionalSchemaStrategy.class);

    /** year0 when the input carries no registration_year. */
    static final int DEFAULT_YEAR0 = 2020;

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    @Override
    public CatalogSchema schema() {
        return CatalogSchema.TRANSACTIONAL;
    }

    @Override
    public boolean applies(RawTable table) {
        return table.hasColumns("make", "model", "price");
    }

    @Override
    public List<VehicleArchetype> build(RawTable table) {
        boolean hasYear = table.hasColumns("registration_year");
        Map<Key, Group> groups = new TreeMap<>(
                Comparator.comparing(Key::make).thenComparing(Key::model));
        int lineNumber = 1;

        for (List<String> row : table.rows()) {
            lineNumber++;

            String make = VehicleArchetype.normalize(table.cell(row, "make"));
            String model = VehicleArchetype.normalize(table.cell(row, "model"));
            if (make.isEmpty() || model.isEmpty()) {
                log.warn("Row {}: make/model missing, skipped", lineNumber);
                continue;
            }

            BigDecimal price = Cells.decimal(table.cell(row, "price"));
            if (price == null) {
                log.warn("Row {}: invalid price '{}', skipped", lineNumber, table.cell(row, "price"));
                continue;
            }

            Group g = groups.computeIfAbsent(new Key(make, model), k -> new Group());
            g.prices.add(price);
            if (hasYear) {
                Integer year = Cells.year(table.cell(row, "registration_year"));
                if (year != null) {
                    g.years.add(BigDecimal.valueOf(year));
                }
            }
        }

        List<VehicleArchetype> out = new ArrayList<>(groups.size());
        groups.forEach((key, g) -> {
            int year0 = DEFAULT_YEAR0;
            if (hasYear) {
                if (g.years.isEmpty()) {
                    log.warn("{} / {}: no usable registration_year, year0={}", key.make(), key.model(),
                            DEFAULT_YEAR0);
                } else {
                    year0 = median(g.years).setScale(0, RoundingMode.DOWN).intValue();
                }
            }
            out.add(VehicleArchetype.of(key.make(), key.model(), median(g.prices), year0));
        });
        return out;
    }

    static BigDecimal median(List<BigDecimal> values) {
        List<BigDecimal> sorted = new ArrayList<>(values);
        sorted.sort(Comparator.naturalOrder());
        int n = sorted.size();
        if (n % 2 == 1) {
            return sorted.get(n / 2);
        }
        return sorted.get(n / 2 - 1).add(sorted.get(n / 2)).divide(TWO);
    }

    private record Key(String make, String model) {
    }

    private static final class Group {
        final List<BigDecimal> prices = new ArrayList<>();
        final List<BigDecimal> years = new ArrayList<>();
    }
}
