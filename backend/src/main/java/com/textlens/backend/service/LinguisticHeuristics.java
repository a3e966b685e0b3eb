package com.textlens.backend.service;

import com.textlens.backend.oracle.ClassifierOutput;

/**
 * Advisory scores computed next to the classifier verdict. Implementations never throw;
 * any failure yields {@code 0.0}.
 */
public interface LinguisticHeuristics {

    /** Perplexity proxy in [0, 100]; runs its own classifier forward pass. */
    double perplexityProxy(String text);

    /** Same score from logits the caller already has. */
    double perplexityProxy(ClassifierOutput output);

    /** Coefficient of variation of sentence lengths, in [0, 1]. */
    double burstiness(String text);
}
