package com.textlens.backend.oracle.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.textlens.backend.oracle.ClassifierOracle;
import com.textlens.backend.oracle.ClassifierOutput;
import com.textlens.backend.oracle.EncodedInput;
import com.textlens.backend.oracle.OracleException;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class RemoteClassifierOracle implements ClassifierOracle {

    private final RemoteModelClient client;

    @Override
    public EncodedInput encode(String text, int maxTokens, boolean truncate) {
        return client.tokenize(text, maxTokens, truncate);
    }

    @Override
    public ClassifierOutput classify(EncodedInput input) {
        if (input.isEmpty()) {
            throw new OracleException("Cannot classify an empty encoding");
        }
        ObjectNode body = client.newBody();
        body.set("inputIds", client.toArray(input.inputIds()));

        JsonNode logits = client.call("classify", body).path("logits");
        // batched servers answer [[h, ai]], single ones [h, ai]
        if (logits.isArray() && logits.size() > 0 && logits.get(0).isArray()) {
            logits = logits.get(0);
        }
        if (!logits.isArray() || logits.size() != 2) {
            throw new OracleException("Classifier " + client.model() + " did not return two logits");
        }
        if (!logits.get(0).isNumber() || !logits.get(1).isNumber()) {
            throw new OracleException("Classifier " + client.model() + " returned non numeric logits");
        }
        return new ClassifierOutput(new double[]{logits.get(0).doubleValue(), logits.get(1).doubleValue()});
    }
}
