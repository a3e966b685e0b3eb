package com.textlens.backend.service;

import com.textlens.backend.request.DetectionRequest;
import com.textlens.backend.response.DetectionResult;

public interface DetectionService {
    DetectionResult detect(DetectionRequest request);
}
