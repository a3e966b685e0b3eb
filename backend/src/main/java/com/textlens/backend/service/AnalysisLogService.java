package com.textlens.backend.service;

import com.textlens.backend.entity.AnalysisKind;
import com.textlens.backend.entity.AnalysisRecord;

import java.util.List;

public interface AnalysisLogService {

    /** Fire-and-forget append of one request/result pair. Never throws to the caller. */
    void append(AnalysisKind kind, String input, Object output);

    List<AnalysisRecord> recent(AnalysisKind kind, int limit);
}
