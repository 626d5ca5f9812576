package com.example.ev_valuation.valuation;

public enum ValuationPath {
    /** archetype found, depreciation model applied */
    MATCHED,
    /** no archetype for make/model, fixed default returned */
    DEFAULT
}
