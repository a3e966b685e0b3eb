package com.textlens.backend.request;

import com.textlens.backend.entity.AnalysisKind;
import com.textlens.backend.exception.ValidationException;

public record SummarizationRequest(String text, double ratio, SummaryFormat format) implements AnalysisRequest {

    public static final int MIN_CHARS = 100;
    public static final double DEFAULT_RATIO = 0.5;

    public SummarizationRequest {
        text = text == null ? "" : text.trim();
        if (text.isEmpty()) {
            throw new ValidationException("No text provided");
        }
        if (text.length() < MIN_CHARS) {
            throw new ValidationException("Text must be at least " + MIN_CHARS
                    + " characters for meaningful summarization");
        }
        if (!(ratio > 0.0 && ratio < 1.0)) {
            throw new ValidationException("Ratio must be between 0 and 1 (exclusive)");
        }
        if (format == null) {
            format = SummaryFormat.PARAGRAPH;
        }
    }

    public static SummarizationRequest of(String rawText, Double ratio, String format) {
        return new SummarizationRequest(rawText, ratio == null ? DEFAULT_RATIO : ratio, SummaryFormat.parse(format));
    }

    @Override
    public AnalysisKind kind() {
        return AnalysisKind.summary;
    }

    @Override
    public String input() {
        return text;
    }
}
