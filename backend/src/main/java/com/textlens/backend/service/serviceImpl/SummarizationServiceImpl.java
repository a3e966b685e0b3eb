package com.textlens.backend.service.serviceImpl;

import com.textlens.backend.config.AnalysisProperties;
import com.textlens.backend.oracle.DecodedSequence;
import com.textlens.backend.oracle.EncodedInput;
import com.textlens.backend.oracle.GenerativeOracle;
import com.textlens.backend.oracle.SamplingPolicy;
import com.textlens.backend.request.SummarizationRequest;
import com.textlens.backend.request.SummaryFormat;
import com.textlens.backend.response.SummaryResult;
import com.textlens.backend.service.SummarizationService;
import com.textlens.backend.utils.ErrorUtil;
import com.textlens.backend.utils.Scores;
import com.textlens.backend.utils.TextRepair;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.stream.Collectors;

@Slf4j
@Service
public class SummarizationServiceImpl implements SummarizationService {

    static final String BULLET = "• ";

    private final GenerativeOracle summarizerOracle;
    private final AnalysisProperties props;

    public SummarizationServiceImpl(@Qualifier("summarizerOracle") GenerativeOracle summarizerOracle,
                                    AnalysisProperties props) {
        this.summarizerOracle = summarizerOracle;
        this.props = props;
    }

    @Override
    public SummaryResult summarize(SummarizationRequest request) {
        int originalWords = TextRepair.wordCount(request.text());
        try {
            SamplingPolicy policy = policyFor(originalWords, request.ratio());
            EncodedInput input = summarizerOracle.encode(request.text(), props.getMaxInputTokens(), true);
            DecodedSequence sequence = summarizerOracle.sampleDecode(input, policy);
            String summary = TextRepair.repair(summarizerOracle.decode(sequence.tokenIds()));

            int summaryWords = TextRepair.wordCount(summary);
            double compression = originalWords == 0 ? 0.0 : Scores.round2((double) summaryWords / originalWords);
            log.info("Summarized {} words into {} (ratio {}, {})",
                    originalWords, summaryWords, request.ratio(), request.format());
            return new SummaryResult(format(summary, request.format()), originalWords, summaryWords, compression, null);
        } catch (Exception e) {
            log.warn("Summarization failed: {}", e.getMessage(), e);
            return SummaryResult.fallback(originalWords, ErrorUtil.describe(e));
        }
    }

    SamplingPolicy policyFor(int originalWords, double ratio) {
        AnalysisProperties.Summary s = props.getSummary();
        int targetWords = Math.max(1, (int) Math.round(originalWords * ratio));
        int maxTokens = Math.max(s.getMinLength() + 1, (int) Math.round(targetWords * props.getWordsToTokensRatio()));
        int minTokens = (int) Math.round(maxTokens / 2.0);
        // deterministic beam search
        return new SamplingPolicy(maxTokens, minTokens, 1.0, 0, 1.0, 1,
                s.getNoRepeatNgramSize(), false, s.getNumBeams(), null);
    }

    static String format(String summary, SummaryFormat format) {
        if (format != SummaryFormat.BULLETS) return summary;
        return TextRepair.sentences(summary).stream()
                .map(s -> BULLET + s)
                .collect(Collectors.joining("\n"));
    }
}
