package com.textlens.backend.config;

import com.textlens.backend.oracle.ClassifierOracle;
import com.textlens.backend.oracle.GenerativeOracle;
import com.textlens.backend.oracle.impl.RemoteClassifierOracle;
import com.textlens.backend.oracle.impl.RemoteGenerativeOracle;
import com.textlens.backend.oracle.impl.RemoteModelClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * One oracle instance per model, created once at startup and shared by all requests.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({OracleProperties.class, AnalysisProperties.class})
public class OracleConfig {

    @Bean
    public RestTemplate oracleRestTemplate(RestTemplateBuilder builder, OracleProperties props) {
        return builder
                .setConnectTimeout(props.getConnectTimeout())
                .setReadTimeout(props.getReadTimeout())
                .build();
    }

    @Bean
    public ClassifierOracle classifierOracle(RestTemplate oracleRestTemplate, OracleProperties props) {
        log.info("Classifier oracle: {} at {}", props.getClassifierModel(), props.getBaseUrl());
        return new RemoteClassifierOracle(
                new RemoteModelClient(oracleRestTemplate, props.getBaseUrl(), props.getClassifierModel()));
    }

    @Bean
    public GenerativeOracle generatorOracle(RestTemplate oracleRestTemplate, OracleProperties props) {
        log.info("Generator oracle: {} at {}", props.getGeneratorModel(), props.getBaseUrl());
        return new RemoteGenerativeOracle(
                new RemoteModelClient(oracleRestTemplate, props.getBaseUrl(), props.getGeneratorModel()));
    }

    @Bean
    public GenerativeOracle summarizerOracle(RestTemplate oracleRestTemplate, OracleProperties props) {
        log.info("Summarizer oracle: {} at {}", props.getSummarizerModel(), props.getBaseUrl());
        return new RemoteGenerativeOracle(
                new RemoteModelClient(oracleRestTemplate, props.getBaseUrl(), props.getSummarizerModel()));
    }
}
