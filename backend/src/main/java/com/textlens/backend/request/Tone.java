package com.textlens.backend.request;

import java.util.Locale;

public enum Tone {
    FORMAL,
    CASUAL,
    CREATIVE,
    TECHNICAL,
    /** Any value the API does not know; conditions with an empty prefix. */
    NONE;

    public static Tone parse(String value) {
        if (value == null) return FORMAL;
        String v = value.trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case "", "formal" -> FORMAL;
            case "casual" -> CASUAL;
            case "creative" -> CREATIVE;
            case "technical" -> TECHNICAL;
            default -> NONE;
        };
    }
}
