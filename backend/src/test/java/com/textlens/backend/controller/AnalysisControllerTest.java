package com.textlens.backend.controller;

import com.textlens.backend.config.SecurityConfig;
import com.textlens.backend.config.WebCorsConfig;
import com.textlens.backend.entity.AnalysisKind;
import com.textlens.backend.request.GenerationRequest;
import com.textlens.backend.request.SummarizationRequest;
import com.textlens.backend.request.SummaryFormat;
import com.textlens.backend.request.Tone;
import com.textlens.backend.response.DetectionResult;
import com.textlens.backend.response.GenerationResult;
import com.textlens.backend.response.SummaryResult;
import com.textlens.backend.service.AnalysisLogService;
import com.textlens.backend.service.DetectionService;
import com.textlens.backend.service.GenerationService;
import com.textlens.backend.service.SummarizationService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AnalysisController.class)
@Import({SecurityConfig.class, WebCorsConfig.class})
class AnalysisControllerTest {

    private static final String LONG_TEXT = "Artificial intelligence has revolutionized the way we interact with technology.";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DetectionService detectionService;
    @MockBean
    private SummarizationService summarizationService;
    @MockBean
    private GenerationService generationService;
    @MockBean
    private AnalysisLogService analysisLogService;

    @Test
    void detectReturnsVerdictAndLogsIt() throws Exception {
        DetectionResult result = DetectionResult.of(87.5, 50.0, 12.3, 0.42);
        when(detectionService.detect(any())).thenReturn(result);

        mockMvc.perform(post("/api/v1/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"" + LONG_TEXT + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.isAI").value(true))
                .andExpect(jsonPath("$.confidence").value(87.5))
                .andExpect(jsonPath("$.perplexity").value(12.3))
                .andExpect(jsonPath("$.burstiness").value(0.42))
                .andExpect(jsonPath("$.error").doesNotExist());

        verify(analysisLogService).append(eq(AnalysisKind.detection), eq(LONG_TEXT), eq(result));
    }

    @Test
    void shortTextIsRejectedBeforeDetection() throws Exception {
        mockMvc.perform(post("/api/v1/detectAIText")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"   too short   \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("bad_request"))
                .andExpect(jsonPath("$.message").value("Text must be at least 50 characters"));

        verifyNoInteractions(detectionService, analysisLogService);
    }

    @Test
    void degradedDetectionIsStillOk() throws Exception {
        when(detectionService.detect(any())).thenReturn(DetectionResult.fallback("classifier unavailable"));

        mockMvc.perform(post("/api/v1/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"" + LONG_TEXT + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.isAI").value(false))
                .andExpect(jsonPath("$.confidence").value(50.0))
                .andExpect(jsonPath("$.error").value("classifier unavailable"));
    }

    @Test
    void generateAppliesDefaults() throws Exception {
        when(generationService.generate(any())).thenReturn(new GenerationResult("Oceans are deep.", 3, 40, null));
        ArgumentCaptor<GenerationRequest> captor = ArgumentCaptor.forClass(GenerationRequest.class);

        mockMvc.perform(post("/api/v1/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\":\"Tell me about oceans\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.generatedText").value("Oceans are deep."))
                .andExpect(jsonPath("$.wordCount").value(3))
                .andExpect(jsonPath("$.tokensUsed").value(40));

        verify(generationService).generate(captor.capture());
        assertThat(captor.getValue()).isEqualTo(new GenerationRequest("Tell me about oceans", Tone.FORMAL, 500, 0.7));
        verify(analysisLogService).append(eq(AnalysisKind.generation), eq("Tell me about oceans"), any());
    }

    @Test
    void generateRejectsOutOfRangeLength() throws Exception {
        mockMvc.perform(post("/api/v1/generateText")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\":\"Hi\",\"maxLength\":50,\"temperature\":0.5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("bad_request"));

        verifyNoInteractions(generationService);
    }

    @Test
    void summarizeParsesRatioAndFormat() throws Exception {
        String text = "word ".repeat(40).trim();
        when(summarizationService.summarize(any())).thenReturn(new SummaryResult("Short.", 40, 1, 0.03, null));
        ArgumentCaptor<SummarizationRequest> captor = ArgumentCaptor.forClass(SummarizationRequest.class);

        mockMvc.perform(post("/api/v1/summarize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"" + text + "\",\"ratio\":0.25,\"format\":\"bullets\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary").value("Short."))
                .andExpect(jsonPath("$.originalWords").value(40))
                .andExpect(jsonPath("$.compressionRatio").value(0.03));

        verify(summarizationService).summarize(captor.capture());
        assertThat(captor.getValue().ratio()).isEqualTo(0.25);
        assertThat(captor.getValue().format()).isEqualTo(SummaryFormat.BULLETS);
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\":"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void getIsNotAllowed() throws Exception {
        mockMvc.perform(get("/api/v1/detect"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.message").value("Method not allowed"));
    }

    @Test
    void preflightIsAnswered() throws Exception {
        mockMvc.perform(options("/api/v1/detect")
                        .header("Origin", "https://textlens.example")
                        .header("Access-Control-Request-Method", "POST"))
                .andExpect(status().isOk())
                .andExpect(header().exists("Access-Control-Allow-Origin"));

        verify(detectionService, never()).detect(any());
        verify(analysisLogService, never()).append(any(), anyString(), any());
    }
}
