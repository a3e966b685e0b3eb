package com.textlens.backend.service.serviceImpl;

import com.textlens.backend.config.AnalysisProperties;
import com.textlens.backend.oracle.ClassifierOracle;
import com.textlens.backend.oracle.ClassifierOutput;
import com.textlens.backend.oracle.EncodedInput;
import com.textlens.backend.service.LinguisticHeuristics;
import com.textlens.backend.utils.Scores;
import com.textlens.backend.utils.TextRepair;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Perplexity here is not a language-model perplexity. It is the exponentiated cross-entropy of the
 * already loaded classifier against the "human" label, so no second model has to be served.
 * Swapping in a causal-LM perplexity changes the magnitude of the score.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LinguisticHeuristicsImpl implements LinguisticHeuristics {

    static final double MAX_PERPLEXITY = 100.0;
    static final int REFERENCE_LABEL = 0;

    private final ClassifierOracle classifierOracle;
    private final AnalysisProperties props;

    @Override
    public double perplexityProxy(String text) {
        if (text == null || text.isBlank()) return 0.0;
        try {
            EncodedInput input = classifierOracle.encode(text, props.getMaxInputTokens(), true);
            return perplexityProxy(classifierOracle.classify(input));
        } catch (Exception e) {
            log.warn("Perplexity proxy unavailable: {}", e.getMessage());
            return 0.0;
        }
    }

    @Override
    public double perplexityProxy(ClassifierOutput output) {
        try {
            double loss = Scores.crossEntropy(output.logits(), REFERENCE_LABEL);
            double perplexity = Math.exp(loss);
            if (Double.isNaN(perplexity)) return 0.0;
            return Scores.clip(perplexity, 0.0, MAX_PERPLEXITY);
        } catch (Exception e) {
            log.warn("Perplexity proxy failed: {}", e.getMessage());
            return 0.0;
        }
    }

    @Override
    public double burstiness(String text) {
        try {
            return burstinessOf(text);
        } catch (Exception e) {
            log.warn("Burstiness failed: {}", e.getMessage());
            return 0.0;
        }
    }

    static double burstinessOf(String text) {
        if (text == null) return 0.0;
        List<Integer> lengths = new ArrayList<>();
        for (String sentence : text.split("\\.")) {
            int words = TextRepair.wordCount(sentence);
            if (words > 0) {
                lengths.add(words);
            }
        }
        if (lengths.size() < 2) return 0.0;

        double mean = lengths.stream().mapToInt(Integer::intValue).average().orElse(0.0);
        if (mean == 0.0) return 0.0;
        double variance = 0.0;
        for (int len : lengths) {
            variance += (len - mean) * (len - mean);
        }
        // population standard deviation
        double std = Math.sqrt(variance / lengths.size());
        return Scores.clip(std / mean, 0.0, 1.0);
    }
}
