package com.textlens.backend.oracle;

import java.util.List;

/**
 * First returned sequence of a decode call. {@code totalTokenCount} covers prompt and continuation.
 */
public record DecodedSequence(List<Integer> tokenIds, int totalTokenCount) {

    public DecodedSequence {
        tokenIds = tokenIds == null ? List.of() : List.copyOf(tokenIds);
    }
}
