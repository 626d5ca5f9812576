package com.example.ev_valuation.catalog;

public record CatalogBuildResult(ReferenceCatalog catalog, CatalogSchema schema, String source) {
}
