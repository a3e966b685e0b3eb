package com.textlens.backend.request;

import com.textlens.backend.entity.AnalysisKind;
import com.textlens.backend.exception.ValidationException;

public record GenerationRequest(String prompt, Tone tone, int maxLength, double temperature) implements AnalysisRequest {

    public static final int MIN_LENGTH = 100;
    public static final int MAX_LENGTH = 1000;
    public static final double MIN_TEMPERATURE = 0.1;
    public static final double MAX_TEMPERATURE = 1.0;

    public static final int DEFAULT_MAX_LENGTH = 500;
    public static final double DEFAULT_TEMPERATURE = 0.7;

    public GenerationRequest {
        prompt = prompt == null ? "" : prompt.trim();
        if (prompt.isEmpty()) {
            throw new ValidationException("No prompt provided");
        }
        if (maxLength < MIN_LENGTH || maxLength > MAX_LENGTH) {
            throw new ValidationException("maxLength must be between " + MIN_LENGTH + " and " + MAX_LENGTH);
        }
        if (Double.isNaN(temperature) || temperature < MIN_TEMPERATURE || temperature > MAX_TEMPERATURE) {
            throw new ValidationException("temperature must be between " + MIN_TEMPERATURE + " and " + MAX_TEMPERATURE);
        }
        if (tone == null) {
            tone = Tone.FORMAL;
        }
    }

    public static GenerationRequest of(String rawPrompt, String tone, Integer maxLength, Double temperature) {
        return new GenerationRequest(
                rawPrompt,
                Tone.parse(tone),
                maxLength == null ? DEFAULT_MAX_LENGTH : maxLength,
                temperature == null ? DEFAULT_TEMPERATURE : temperature);
    }

    @Override
    public AnalysisKind kind() {
        return AnalysisKind.generation;
    }

    @Override
    public String input() {
        return prompt;
    }
}
