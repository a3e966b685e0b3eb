package com.textlens.backend.service.serviceImpl;

import com.textlens.backend.config.AnalysisProperties;
import com.textlens.backend.oracle.ClassifierOracle;
import com.textlens.backend.oracle.ClassifierOutput;
import com.textlens.backend.oracle.EncodedInput;
import com.textlens.backend.request.DetectionRequest;
import com.textlens.backend.response.DetectionResult;
import com.textlens.backend.service.DetectionService;
import com.textlens.backend.service.LinguisticHeuristics;
import com.textlens.backend.utils.ErrorUtil;
import com.textlens.backend.utils.Scores;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class DetectionServiceImpl implements DetectionService {

    private final ClassifierOracle classifierOracle;
    private final LinguisticHeuristics heuristics;
    private final AnalysisProperties props;

    @Override
    public DetectionResult detect(DetectionRequest request) {
        String text = request.text();
        try {
            EncodedInput input = classifierOracle.encode(text, props.getMaxInputTokens(), true);
            ClassifierOutput output = classifierOracle.classify(input);

            double[] probabilities = Scores.softmax(output.logits());
            double confidence = Scores.round2(probabilities[props.getAiClassIndex()] * 100.0);

            // the forward pass above already carries the logits the proxy needs
            double perplexity = Scores.round2(heuristics.perplexityProxy(output));
            double burstiness = Scores.round2(heuristics.burstiness(text));

            // verdict taken on the rounded confidence so the reported pair always agrees
            DetectionResult result = DetectionResult.of(confidence, props.getDetectionThreshold(), perplexity, burstiness);
            log.info("Detection on {} chars ({} tokens): isAI={} confidence={}",
                    text.length(), input.length(), result.isAI(), result.confidence());
            return result;
        } catch (Exception e) {
            log.warn("Detection degraded to neutral verdict: {}", e.getMessage(), e);
            return DetectionResult.fallback(ErrorUtil.describe(e));
        }
    }
}
