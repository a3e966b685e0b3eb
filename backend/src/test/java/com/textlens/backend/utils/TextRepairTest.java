package com.textlens.backend.utils;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextRepairTest {

    @Test
    void textWithoutAnyTerminalMarkIsKept() {
        assertThat(TextRepair.repair("The sky is blue and the grass"))
                .isEqualTo("The sky is blue and the grass");
    }

    @Test
    void trailingClauseIsCutAtLastTerminalMark() {
        assertThat(TextRepair.repair("First sentence. Second one is cut"))
                .isEqualTo("First sentence.");
        assertThat(TextRepair.repair("Hello!   World\n\tis big?  and then"))
                .isEqualTo("Hello! World is big?");
    }

    @Test
    void completeTextIsOnlyWhitespaceCollapsed() {
        assertThat(TextRepair.repair("  One.   Two!\n\nThree?  ")).isEqualTo("One. Two! Three?");
    }

    @Test
    void markAtVeryStartDoesNotTruncate() {
        assertThat(TextRepair.truncateToLastSentence("!abc def")).isEqualTo("!abc def");
    }

    @Test
    void echoedPromptIsStripped() {
        String prompt = "Write creatively and imaginatively: Tell me about oceans";
        String out = TextRepair.stripEchoedPrompt(prompt + "  The sea is deep.", prompt);

        assertThat(out).isEqualTo("The sea is deep.");
        assertThat(out).doesNotStartWith(prompt);
    }

    @Test
    void approximateEchoIsLeftAlone() {
        String prompt = "Tell me about oceans";
        assertThat(TextRepair.stripEchoedPrompt("Tell me about  oceans now.", prompt))
                .isEqualTo("Tell me about  oceans now.");
    }

    @Test
    void wordCountSplitsOnAnyWhitespace() {
        assertThat(TextRepair.wordCount("  a  b\nc\td ")).isEqualTo(4);
        assertThat(TextRepair.wordCount("   ")).isZero();
        assertThat(TextRepair.wordCount(null)).isZero();
    }

    @Test
    void unicodeSpacesCountAsWhitespace() {
        assertThat(TextRepair.wordCount("a\u00A0b\u2003c")).isEqualTo(3);
        assertThat(TextRepair.wordCount("\u00A0\u2003")).isZero();
        assertThat(TextRepair.collapseWhitespace("\u00A0one\u2003\u2003two\u00A0")).isEqualTo("one two");
        assertThat(TextRepair.sentences("One two.\u00A0Three four."))
                .containsExactly("One two.", "Three four.");
    }

    @Test
    void sentencesSplitAfterTerminalMarks() {
        assertThat(TextRepair.sentences("One two. Three four! Five?"))
                .containsExactly("One two.", "Three four!", "Five?");
    }

    @Test
    void snippetCapsLength() {
        assertThat(TextRepair.snippet("x".repeat(600), 500)).hasSize(500);
        assertThat(TextRepair.snippet("short", 500)).isEqualTo("short");
    }
}
