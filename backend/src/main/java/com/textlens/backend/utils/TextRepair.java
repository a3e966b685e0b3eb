package com.textlens.backend.utils;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * String-level clean-up applied to raw model continuations. Independent of any model call.
 */
public final class TextRepair {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private TextRepair() {}

    /**
     * Removes {@code prompt} when the model echoed it verbatim at the start of {@code text}.
     * A prompt that only comes back approximately (tokenizer round trips) is left in place.
     */
    public static String stripEchoedPrompt(String text, String prompt) {
        if (text == null) return "";
        if (prompt != null && !prompt.isEmpty() && text.startsWith(prompt)) {
            return text.substring(prompt.length()).trim();
        }
        return text;
    }

    public static String collapseWhitespace(String text) {
        if (text == null) return "";
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /**
     * Cuts a trailing incomplete clause back to the last {@code .}, {@code !} or {@code ?}.
     * Text already ending in one of them, or with no such mark after its first character, is kept.
     */
    public static String truncateToLastSentence(String text) {
        if (text == null || text.isEmpty()) return "";
        if (endsWithTerminal(text)) return text;
        int last = Math.max(text.lastIndexOf('.'), Math.max(text.lastIndexOf('!'), text.lastIndexOf('?')));
        return last > 0 ? text.substring(0, last + 1) : text;
    }

    public static String repair(String text) {
        return truncateToLastSentence(collapseWhitespace(text)).trim();
    }

    public static int wordCount(String text) {
        if (text == null) return 0;
        String t = collapseWhitespace(text);
        return t.isEmpty() ? 0 : WHITESPACE.split(t).length;
    }

    public static List<String> sentences(String text) {
        List<String> out = new ArrayList<>();
        if (text == null) return out;
        for (String s : SENTENCE_BREAK.split(collapseWhitespace(text))) {
            if (!s.isBlank()) out.add(s.trim());
        }
        return out;
    }

    public static String snippet(String text, int max) {
        if (text == null) return "";
        return text.length() <= max ? text : text.substring(0, max);
    }

    private static boolean endsWithTerminal(String text) {
        char c = text.charAt(text.length() - 1);
        return c == '.' || c == '!' || c == '?';
    }
}
