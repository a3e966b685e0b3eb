package com.textlens.backend.controller;

import com.textlens.backend.request.DetectionRequest;
import com.textlens.backend.request.GenerationRequest;
import com.textlens.backend.request.SummarizationRequest;
import com.textlens.backend.response.DetectionResult;
import com.textlens.backend.response.GenerationResult;
import com.textlens.backend.response.SummaryResult;
import com.textlens.backend.service.AnalysisLogService;
import com.textlens.backend.service.DetectionService;
import com.textlens.backend.service.GenerationService;
import com.textlens.backend.service.SummarizationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1")
public class AnalysisController {

    private final DetectionService detectionService;
    private final SummarizationService summarizationService;
    private final GenerationService generationService;
    private final AnalysisLogService analysisLogService;

    @PostMapping({"/detect", "/detectAIText"})
    public ResponseEntity<DetectionResult> detect(@RequestBody DetectBody body) {
        DetectionRequest request = DetectionRequest.of(body.text());
        log.info("Processing detection for {} characters", request.text().length());

        DetectionResult result = detectionService.detect(request);
        analysisLogService.append(request.kind(), request.input(), result);
        return ResponseEntity.ok(result);
    }

    @PostMapping({"/summarize", "/summarizeText"})
    public ResponseEntity<SummaryResult> summarize(@RequestBody SummarizeBody body) {
        SummarizationRequest request = SummarizationRequest.of(body.text(), body.ratio(), body.format());
        log.info("Processing summarization with ratio {}", request.ratio());

        SummaryResult result = summarizationService.summarize(request);
        analysisLogService.append(request.kind(), request.input(), result);
        return ResponseEntity.ok(result);
    }

    @PostMapping({"/generate", "/generateText"})
    public ResponseEntity<GenerationResult> generate(@RequestBody GenerateBody body) {
        GenerationRequest request = GenerationRequest.of(
                body.prompt(), body.tone(), body.maxLength(), body.temperature());
        log.info("Generating text, tone={} maxLength={} temperature={}",
                request.tone(), request.maxLength(), request.temperature());

        GenerationResult result = generationService.generate(request);
        analysisLogService.append(request.kind(), request.input(), result);
        return ResponseEntity.ok(result);
    }

    public record DetectBody(String text) {}
    public record SummarizeBody(String text, Double ratio, String format) {}
    public record GenerateBody(String prompt, String tone, Integer maxLength, Double temperature) {}
}
