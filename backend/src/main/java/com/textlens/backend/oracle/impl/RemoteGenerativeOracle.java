package com.textlens.backend.oracle.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.textlens.backend.oracle.DecodedSequence;
import com.textlens.backend.oracle.EncodedInput;
import com.textlens.backend.oracle.GenerativeOracle;
import com.textlens.backend.oracle.OracleException;
import com.textlens.backend.oracle.SamplingPolicy;
import lombok.RequiredArgsConstructor;

import java.util.List;

@RequiredArgsConstructor
public class RemoteGenerativeOracle implements GenerativeOracle {

    private final RemoteModelClient client;

    @Override
    public EncodedInput encode(String text, int maxTokens, boolean truncate) {
        return client.tokenize(text, maxTokens, truncate);
    }

    @Override
    public DecodedSequence sampleDecode(EncodedInput input, SamplingPolicy policy) {
        ObjectNode body = client.newBody()
                .put("maxLength", policy.maxTokens())
                .put("minLength", policy.minLength())
                .put("temperature", policy.temperature())
                .put("topK", policy.topK())
                .put("topP", policy.topP())
                .put("doSample", policy.doSample())
                .put("numBeams", policy.numBeams())
                .put("numReturnSequences", policy.numReturnSequences())
                .put("noRepeatNgramSize", policy.noRepeatNgramSize());
        if (policy.seed() != null) {
            body.put("seed", policy.seed());
        }
        body.set("inputIds", client.toArray(input.inputIds()));

        JsonNode sequences = client.call("generate", body).path("sequences");
        if (!sequences.isArray() || sequences.isEmpty()) {
            throw new OracleException("No sequences in generate response of " + client.model());
        }
        List<Integer> ids = RemoteModelClient.readIds(sequences.get(0), "sequences[0]");
        return new DecodedSequence(ids, ids.size());
    }

    @Override
    public String decode(List<Integer> tokenIds) {
        return client.detokenize(tokenIds);
    }
}
