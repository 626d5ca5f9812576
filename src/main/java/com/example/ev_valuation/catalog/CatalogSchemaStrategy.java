package com.example.ev_valuation.catalog;

import java.util.List;

/**
 * One recognizable input shape. Strategies are tried in priority order and
 * the first that {@link #applies(RawTable) applies} builds the catalog rows.
 */
public interface CatalogSchemaStrategy {

    CatalogSchema schema();

    boolean applies(RawTable table);

    List<VehicleArchetype> build(RawTable table);
}
