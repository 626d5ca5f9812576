package com.example.ev_valuation.catalog;

import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import lombok.RequiredArgsConstructor;

@RestController
@RequiredArgsConstructor
public class CatalogController {

    private final ReferenceCatalog catalog;

    @GetMapping("/makes")
    public ResponseEntity<?> makes() {
        return ResponseEntity.ok(Map.of("makes", catalog.makes()));
    }

    /**
     * Unknown make returns an empty list.
     */
    @GetMapping("/models/{make}")
    public ResponseEntity<?> models(@PathVariable String make) {
        return ResponseEntity.ok(Map.of("models", catalog.models(make)));
    }
}
