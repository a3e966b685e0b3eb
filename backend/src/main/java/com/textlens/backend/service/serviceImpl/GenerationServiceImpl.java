package com.textlens.backend.service.serviceImpl;

import com.textlens.backend.config.AnalysisProperties;
import com.textlens.backend.oracle.DecodedSequence;
import com.textlens.backend.oracle.EncodedInput;
import com.textlens.backend.oracle.GenerativeOracle;
import com.textlens.backend.oracle.SamplingPolicy;
import com.textlens.backend.request.GenerationRequest;
import com.textlens.backend.response.GenerationResult;
import com.textlens.backend.service.GenerationService;
import com.textlens.backend.utils.ErrorUtil;
import com.textlens.backend.utils.TextRepair;
import com.textlens.backend.utils.ToneTemplate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class GenerationServiceImpl implements GenerationService {

    private final GenerativeOracle generatorOracle;
    private final AnalysisProperties props;

    public GenerationServiceImpl(@Qualifier("generatorOracle") GenerativeOracle generatorOracle,
                                 AnalysisProperties props) {
        this.generatorOracle = generatorOracle;
        this.props = props;
    }

    @Override
    public GenerationResult generate(GenerationRequest request) {
        try {
            String fullPrompt = ToneTemplate.condition(request.prompt(), request.tone());
            SamplingPolicy policy = policyFor(maxTokens(request.maxLength()), request.temperature());

            EncodedInput input = generatorOracle.encode(fullPrompt, props.getMaxInputTokens(), true);
            DecodedSequence sequence = generatorOracle.sampleDecode(input, policy);
            String raw = generatorOracle.decode(sequence.tokenIds());

            String text = TextRepair.repair(TextRepair.stripEchoedPrompt(raw, fullPrompt));
            int words = TextRepair.wordCount(text);
            log.info("Generated {} words ({} tokens), tone={}", words, sequence.totalTokenCount(), request.tone());
            return new GenerationResult(text, words, sequence.totalTokenCount(), null);
        } catch (Exception e) {
            log.warn("Generation failed: {}", e.getMessage(), e);
            return GenerationResult.fallback(ErrorUtil.describe(e));
        }
    }

    // stochastic top-k / nucleus sampling; unseeded unless the deployment pins one
    SamplingPolicy policyFor(int maxTokens, double temperature) {
        AnalysisProperties.Sampling s = props.getSampling();
        return new SamplingPolicy(
                maxTokens,
                Math.min(s.getMinLength(), maxTokens),
                temperature,
                s.getTopK(),
                s.getTopP(),
                s.getNumReturnSequences(),
                s.getNoRepeatNgramSize(),
                true,
                1,
                s.getSeed()
        );
    }

    int maxTokens(int maxLengthWords) {
        return (int) Math.round(maxLengthWords * props.getWordsToTokensRatio());
    }
}
