package com.example.ev_valuation.catalog;

import java.math.BigDecimal;
import java.util.Locale;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Value;

/**
 * One row of the reference catalog. make/model are stored normalized; build
 * through {@link #of}.
 */
@Value
@Builder(access = AccessLevel.PRIVATE)
public class VehicleArchetype {
    String make;
    String model;
    BigDecimal basePrice; // price at year0
    int year0;

    public static VehicleArchetype of(String make, String model, BigDecimal basePrice, int year0) {
        return VehicleArchetype.builder()
                .make(normalize(make))
                .model(normalize(model))
                .basePrice(basePrice)
                .year0(year0)
                .build();
    }

    /**
     * trim + lower-case. null becomes "".
     */
    public static String normalize(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }
}
