package com.textlens.backend.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "application.oracle")
public class OracleProperties {

    /** Base URL of the model serving endpoint. */
    private String baseUrl = "http://localhost:8000";

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration readTimeout = Duration.ofSeconds(120);

    private String classifierModel = "roberta-base";

    private String generatorModel = "gpt2";

    private String summarizerModel = "facebook/bart-large-cnn";
}
