package com.textlens.backend.request;

import com.textlens.backend.entity.AnalysisKind;

/**
 * Validated input of one analysis call. Instances only exist for well-formed requests.
 */
public interface AnalysisRequest {

    AnalysisKind kind();

    /** The text or prompt the analysis runs on, already trimmed. */
    String input();
}
