package com.textlens.backend.request;

import com.textlens.backend.entity.AnalysisKind;
import com.textlens.backend.exception.ValidationException;

public record DetectionRequest(String text) implements AnalysisRequest {

    public static final int MIN_CHARS = 50;

    public DetectionRequest {
        text = text == null ? "" : text.trim();
        if (text.isEmpty()) {
            throw new ValidationException("No text provided");
        }
        if (text.length() < MIN_CHARS) {
            throw new ValidationException("Text must be at least " + MIN_CHARS + " characters");
        }
    }

    public static DetectionRequest of(String rawText) {
        return new DetectionRequest(rawText);
    }

    @Override
    public AnalysisKind kind() {
        return AnalysisKind.detection;
    }

    @Override
    public String input() {
        return text;
    }
}
