package com.example.ev_valuation.valuation;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ValuationRequest {

    @NotNull
    private String make; // case-insensitive; blank is just an unknown vehicle

    @NotNull
    private String model; // case-insensitive

    @NotNull
    @Min(0)
    private Integer mileageKm;

    @NotNull
    private String firstRegistration; // ISO date, e.g. 2020-06-01
}
