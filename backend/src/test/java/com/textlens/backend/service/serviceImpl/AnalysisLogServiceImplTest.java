package com.textlens.backend.service.serviceImpl;

import com.textlens.backend.config.AnalysisProperties;
import com.textlens.backend.entity.AnalysisKind;
import com.textlens.backend.entity.AnalysisRecord;
import com.textlens.backend.repository.AnalysisRecordRepository;
import com.textlens.backend.response.DetectionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AnalysisLogServiceImplTest {

    private AnalysisRecordRepository repository;
    private AnalysisLogServiceImpl service;

    @BeforeEach
    void setUp() {
        repository = mock(AnalysisRecordRepository.class);
        service = new AnalysisLogServiceImpl(repository, new AnalysisProperties());
    }

    @Test
    void appendStoresSnippetAndResultJson() {
        String input = "y".repeat(1200);
        ArgumentCaptor<AnalysisRecord> saved = ArgumentCaptor.forClass(AnalysisRecord.class);

        service.append(AnalysisKind.detection, input, DetectionResult.of(75.0, 50.0, 4.0, 0.21));

        verify(repository).save(saved.capture());
        AnalysisRecord record = saved.getValue();
        assertThat(record.getType()).isEqualTo(AnalysisKind.detection);
        assertThat(record.getInputSnippet()).hasSize(500);
        assertThat(record.getInputLength()).isEqualTo(1200);
        assertThat(record.getOutputJson())
                .contains("\"isAI\":true")
                .contains("\"confidence\":75.0")
                .doesNotContain("error");
    }

    @Test
    void storeFailureIsSwallowedAndLogged() {
        when(repository.save(any())).thenThrow(new DataAccessResourceFailureException("db offline"));

        assertThatCode(() -> service.append(AnalysisKind.generation, "prompt", "out"))
                .doesNotThrowAnyException();
    }

    @Test
    void recentIsTrimmedToLimit() {
        List<AnalysisRecord> rows = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            rows.add(AnalysisRecord.builder().id((long) i).type(AnalysisKind.summary).build());
        }
        when(repository.findTop100ByTypeOrderByCreatedAtDesc(AnalysisKind.summary)).thenReturn(rows);

        assertThat(service.recent(AnalysisKind.summary, 3)).hasSize(3);
        verify(repository, never()).findTop100ByOrderByCreatedAtDesc();
    }

    @Test
    void recentWithoutKindReadsAllTypes() {
        when(repository.findTop100ByOrderByCreatedAtDesc()).thenReturn(List.of());

        assertThat(service.recent(null, 50)).isEmpty();
        verify(repository).findTop100ByOrderByCreatedAtDesc();
    }
}
