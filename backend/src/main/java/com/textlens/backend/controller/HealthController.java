package com.textlens.backend.controller;

import com.textlens.backend.config.OracleProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/health")
public class HealthController {

    private final OracleProperties oracle;

    public HealthController(OracleProperties oracle) {
        this.oracle = oracle;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "OK",
                "models", Map.of(
                        "classifier", oracle.getClassifierModel(),
                        "generator", oracle.getGeneratorModel(),
                        "summarizer", oracle.getSummarizerModel()
                )
        ));
    }
}
