package com.textlens.backend.service.serviceImpl;


import com.fasterxml.jackson.databind.ObjectMapper;
import com.textlens.backend.config.AnalysisProperties;
import com.textlens.backend.config.AsyncConfig;
import com.textlens.backend.entity.AnalysisKind;
import com.textlens.backend.entity.AnalysisRecord;
import com.textlens.backend.repository.AnalysisRecordRepository;
import com.textlens.backend.service.AnalysisLogService;
import com.textlens.backend.utils.TextRepair;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisLogServiceImpl implements AnalysisLogService {

    private final AnalysisRecordRepository repository;
    private final AnalysisProperties props;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Async(AsyncConfig.PERSISTENCE_EXECUTOR)
    @Override
    public void append(AnalysisKind kind, String input, Object output) {
        try {
            AnalysisRecord record = AnalysisRecord.builder()
                    .type(kind)
                    .inputSnippet(TextRepair.snippet(input, props.getInputSnippetChars()))
                    .inputLength(input == null ? 0 : input.length())
                    .outputJson(toJsonSafe(output))
                    .build();
            repository.save(record);
        } catch (Exception e) {
            // the caller already has its response; a lost log entry is only reported
            log.warn("Could not store {} result: {}", kind, e.getMessage());
        }
    }

    @Override
    public List<AnalysisRecord> recent(AnalysisKind kind, int limit) {
        List<AnalysisRecord> all = kind == null
                ? repository.findTop100ByOrderByCreatedAtDesc()
                : repository.findTop100ByTypeOrderByCreatedAtDesc(kind);
        return all.size() > limit ? all.subList(0, limit) : all;
    }

    private String toJsonSafe(Object o) {
        try {
            return objectMapper.writeValueAsString(o);
        } catch (Exception e) {
            return String.valueOf(o);
        }
    }
}
