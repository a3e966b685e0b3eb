package com.textlens.backend.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables of the orchestration layer. The defaults reproduce the behaviour the
 * models were deployed with; the threshold and the words-to-tokens ratio have no
 * calibration behind them and are meant to be adjusted per deployed model.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "application.analysis")
public class AnalysisProperties {

    /** Confidence (0-100) above which a text is reported as AI written. */
    private double detectionThreshold = 50.0;

    /** Index of the "AI" label in the classifier output. */
    private int aiClassIndex = 1;

    /** Token window enforced by the oracle encoders. */
    private int maxInputTokens = 512;

    /** Expansion from requested words to decode tokens. */
    private double wordsToTokensRatio = 1.3;

    private final Sampling sampling = new Sampling();

    private final Summary summary = new Summary();

    /** Characters of the input kept in the result log. */
    private int inputSnippetChars = 500;

    @Getter
    @Setter
    public static class Sampling {
        private int topK = 50;
        private double topP = 0.95;
        private int noRepeatNgramSize = 3;
        private int minLength = 50;
        private int numReturnSequences = 1;
        /** Fixes the sampler seed when set; unset keeps decoding non-deterministic. */
        private Long seed;
    }

    @Getter
    @Setter
    public static class Summary {
        private int numBeams = 4;
        private int minLength = 10;
        private int noRepeatNgramSize = 3;
    }
}
