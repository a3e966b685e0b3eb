package com.textlens.backend.controller;

import com.textlens.backend.entity.AnalysisKind;
import com.textlens.backend.entity.AnalysisRecord;
import com.textlens.backend.exception.ValidationException;
import com.textlens.backend.service.AnalysisLogService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/api/v1/results")
public class ResultsController {

    private final AnalysisLogService analysisLogService;

    public ResultsController(AnalysisLogService analysisLogService) {
        this.analysisLogService = analysisLogService;
    }

    // Most recent stored results, newest first
    @GetMapping("/recent")
    public ResponseEntity<List<AnalysisRecord>> recent(@RequestParam(name = "type", required = false) String type,
                                                       @RequestParam(name = "limit", defaultValue = "50") int limit) {
        int capped = Math.max(1, Math.min(100, limit));
        return ResponseEntity.ok(analysisLogService.recent(toKind(type), capped));
    }

    private AnalysisKind toKind(String type) {
        if (type == null || type.isBlank()) return null;
        try {
            return AnalysisKind.valueOf(type.trim().toLowerCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unsupported result type: " + type);
        }
    }
}
