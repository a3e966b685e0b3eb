package com.textlens.backend.request;

import com.textlens.backend.exception.ValidationException;

import java.util.Locale;

public enum SummaryFormat {
    PARAGRAPH,
    BULLETS;

    public static SummaryFormat parse(String value) {
        if (value == null || value.isBlank()) return PARAGRAPH;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "paragraph" -> PARAGRAPH;
            case "bullets", "bullet" -> BULLETS;
            default -> throw new ValidationException("Unsupported format: " + value);
        };
    }
}
