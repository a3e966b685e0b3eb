package com.textlens.backend.response;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SummaryResult(String summary, int originalWords, int summaryWords, double compressionRatio, String error) {

    public static final String FALLBACK_TEXT = "Error generating summary. Please try again.";

    public static SummaryResult fallback(int originalWords, String error) {
        return new SummaryResult(FALLBACK_TEXT, originalWords, 0, 0.0, error);
    }
}
