package com.textlens.backend.repository;


import com.textlens.backend.entity.AnalysisKind;
import com.textlens.backend.entity.AnalysisRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AnalysisRecordRepository extends JpaRepository<AnalysisRecord, Long> {
    List<AnalysisRecord> findTop100ByOrderByCreatedAtDesc();

    List<AnalysisRecord> findTop100ByTypeOrderByCreatedAtDesc(AnalysisKind type);
}
