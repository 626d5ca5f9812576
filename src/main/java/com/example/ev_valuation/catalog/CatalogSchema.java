package com.example.ev_valuation.catalog;

/**
 * Which input shape produced the catalog.
 */
public enum CatalogSchema {
    CANONICAL,
    TRANSACTIONAL,
    FALLBACK
}
