package com.textlens.backend.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Verdict of the detector. {@code confidence} alone decides {@code isAI}; perplexity and
 * burstiness are reported for the reader and never change the verdict.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DetectionResult(
        @JsonProperty("isAI") boolean isAI,
        double confidence,
        double perplexity,
        double burstiness,
        String error
) {

    public static final double NEUTRAL_CONFIDENCE = 50.0;

    public static DetectionResult of(double confidence, double threshold, double perplexity, double burstiness) {
        return new DetectionResult(confidence > threshold, confidence, perplexity, burstiness, null);
    }

    public static DetectionResult fallback(String error) {
        return new DetectionResult(false, NEUTRAL_CONFIDENCE, 0.0, 0.0, error);
    }
}
