package com.textlens.backend.oracle;

import java.util.List;

/**
 * Token ids produced by an oracle encoder, already cut to the encoder window.
 */
public record EncodedInput(List<Integer> inputIds) {

    public EncodedInput {
        inputIds = inputIds == null ? List.of() : List.copyOf(inputIds);
    }

    public int length() {
        return inputIds.size();
    }

    public boolean isEmpty() {
        return inputIds.isEmpty();
    }
}
