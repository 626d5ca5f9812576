package com.example.ev_valuation.valuation;

import java.math.BigDecimal;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValuationResponse {
    BigDecimal estimate;
    String currency;
    BigDecimal confidence; // null when not computed

    public static ValuationResponse from(ValuationResult result) {
        return ValuationResponse.builder()
                .estimate(result.getEstimate())
                .currency(ValuationEngine.CURRENCY)
                .confidence(result.getConfidence())
                .build();
    }
}
