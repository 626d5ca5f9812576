package com.example.ev_valuation.catalog;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable catalog of vehicle archetypes, built once at startup and shared
 * across request threads.
 */
public final class ReferenceCatalog {

    private final List<VehicleArchetype> rows;
    private final Map<String, VehicleArchetype> byKey;
    private final List<String> makes;

    public ReferenceCatalog(List<VehicleArchetype> rows) {
        this.rows = List.copyOf(rows);

        Map<String, VehicleArchetype> index = new LinkedHashMap<>();
        for (VehicleArchetype a : this.rows) {
            // duplicates tolerated: first in build order wins
            index.putIfAbsent(key(a.getMake(), a.getModel()), a);
        }
        this.byKey = Map.copyOf(index);

        this.makes = this.rows.stream()
                .map(VehicleArchetype::getMake)
                .distinct()
                .sorted()
                .toList();
    }

    public int size() {
        return rows.size();
    }

    public List<VehicleArchetype> rows() {
        return rows;
    }

    public List<String> makes() {
        return makes;
    }

    public List<String> models(String make) {
        String m = VehicleArchetype.normalize(make);
        return rows.stream()
                .filter(a -> a.getMake().equals(m))
                .map(VehicleArchetype::getModel)
                .distinct()
                .sorted()
                .toList();
    }

    public Optional<VehicleArchetype> find(String make, String model) {
        return Optional.ofNullable(byKey.get(key(
                VehicleArchetype.normalize(make),
                VehicleArchetype.normalize(model))));
    }

    private static String key(String make, String model) {
        return make + '\u0000' + model;
    }
}
