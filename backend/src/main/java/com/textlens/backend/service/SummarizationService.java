package com.textlens.backend.service;

import com.textlens.backend.request.SummarizationRequest;
import com.textlens.backend.response.SummaryResult;

public interface SummarizationService {
    SummaryResult summarize(SummarizationRequest request);
}
