package com.textlens.backend.service;

import com.textlens.backend.request.GenerationRequest;
import com.textlens.backend.response.GenerationResult;

public interface GenerationService {
    GenerationResult generate(GenerationRequest request);
}
