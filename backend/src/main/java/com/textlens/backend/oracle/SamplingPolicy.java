package com.textlens.backend.oracle;

/**
 * Decode configuration handed to a {@link GenerativeOracle}. Built once per call and never mutated.
 *
 * <p>{@code seed} is {@code null} unless a deployment pins it; with sampling enabled the same
 * prompt may then produce a different continuation on every call.</p>
 */
public record SamplingPolicy(
        int maxTokens,
        int minLength,
        double temperature,
        int topK,
        double topP,
        int numReturnSequences,
        int noRepeatNgramSize,
        boolean doSample,
        int numBeams,
        Long seed
) {

    public SamplingPolicy {
        if (maxTokens <= 0) throw new IllegalArgumentException("maxTokens must be positive");
        if (minLength < 0 || minLength > maxTokens) {
            throw new IllegalArgumentException("minLength must be within [0, maxTokens]");
        }
    }
}
