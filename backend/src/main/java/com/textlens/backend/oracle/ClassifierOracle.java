package com.textlens.backend.oracle;

/**
 * Human-vs-AI sequence classifier. Implementations must tolerate concurrent calls.
 */
public interface ClassifierOracle {

    EncodedInput encode(String text, int maxTokens, boolean truncate);

    ClassifierOutput classify(EncodedInput input);
}
