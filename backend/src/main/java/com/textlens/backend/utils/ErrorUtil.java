package com.textlens.backend.utils;

public final class ErrorUtil {
    private ErrorUtil() {}

    /** Message reported in a degraded result's {@code error} field. */
    public static String describe(Throwable e) {
        if (e == null) return "";
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
