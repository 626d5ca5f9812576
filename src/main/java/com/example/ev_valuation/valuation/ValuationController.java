package com.example.ev_valuation.valuation;

import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/valuation")
@RequiredArgsConstructor
@Validated
public class ValuationController {

    private final ValuationEngine engine;

    @PostMapping
    public ResponseEntity<ValuationResponse> valuation(@Valid @RequestBody ValuationRequest req) {
        return ResponseEntity.ok(ValuationResponse.from(engine.evaluate(req)));
    }
}
