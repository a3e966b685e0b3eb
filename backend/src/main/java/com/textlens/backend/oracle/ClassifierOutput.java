package com.textlens.backend.oracle;

/**
 * Raw logits of a two-label sequence classifier (index 0 human, index 1 AI by default).
 */
public record ClassifierOutput(double[] logits) {

    public ClassifierOutput {
        if (logits == null || logits.length != 2) {
            throw new OracleException("Classifier must return exactly 2 logits");
        }
        logits = logits.clone();
    }

    public double logit(int index) {
        return logits[index];
    }

    @Override
    public double[] logits() {
        return logits.clone();
    }
}
