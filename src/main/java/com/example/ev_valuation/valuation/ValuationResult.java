package com.example.ev_valuation.valuation;

import java.math.BigDecimal;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ValuationResult {
    BigDecimal estimate;
    BigDecimal confidence;

    ValuationPath path;
    boolean registrationParsed; // false: elapsed time treated as zero
    double years;
}
