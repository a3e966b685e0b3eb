package com.textlens.backend.response;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record GenerationResult(String generatedText, int wordCount, int tokensUsed, String error) {

    public static final String FALLBACK_TEXT = "Error generating text. Please try with a different prompt.";

    public static GenerationResult fallback(String error) {
        return new GenerationResult(FALLBACK_TEXT, 0, 0, error);
    }
}
