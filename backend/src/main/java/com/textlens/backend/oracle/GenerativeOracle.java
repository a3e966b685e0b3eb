package com.textlens.backend.oracle;

import java.util.List;

/**
 * Causal or sequence-to-sequence model that continues an encoded input under a {@link SamplingPolicy}.
 * Implementations must tolerate concurrent calls.
 */
public interface GenerativeOracle {

    EncodedInput encode(String text, int maxTokens, boolean truncate);

    DecodedSequence sampleDecode(EncodedInput input, SamplingPolicy policy);

    String decode(List<Integer> tokenIds);
}
