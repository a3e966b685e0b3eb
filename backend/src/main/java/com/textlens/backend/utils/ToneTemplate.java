package com.textlens.backend.utils;

import com.textlens.backend.request.Tone;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Instruction prefixes prepended to a prompt to steer the writing style.
 */
public final class ToneTemplate {

    private static final Map<Tone, String> PREFIXES;

    static {
        Map<Tone, String> m = new EnumMap<>(Tone.class);
        m.put(Tone.FORMAL, "Write in a formal, professional manner: ");
        m.put(Tone.CASUAL, "Write in a casual, conversational style: ");
        m.put(Tone.CREATIVE, "Write creatively and imaginatively: ");
        m.put(Tone.TECHNICAL, "Write in a technical, precise manner: ");
        PREFIXES = Collections.unmodifiableMap(m);
    }

    private ToneTemplate() {}

    public static String prefixFor(Tone tone) {
        if (tone == null) return "";
        return PREFIXES.getOrDefault(tone, "");
    }

    public static String condition(String prompt, Tone tone) {
        return prefixFor(tone) + (prompt == null ? "" : prompt);
    }
}
