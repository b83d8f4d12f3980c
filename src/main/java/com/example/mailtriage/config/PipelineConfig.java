package com.example.mailtriage.config;

import com.example.mailtriage.service.gateway.ClassificationGateway;
import com.example.mailtriage.service.gateway.GeminiClassificationGateway;
import com.example.mailtriage.service.gateway.LocalClassificationGateway;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

@Configuration
@Slf4j
public class PipelineConfig {

    @Bean
    public PipelineSettings pipelineSettings(TriageProperties properties) {
        return PipelineSettings.from(properties);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ClassificationGateway classificationGateway(TriageProperties properties,
                                                       @Qualifier("googleGenerativeClient") WebClient googleGenerativeClient,
                                                       ObjectMapper objectMapper) {
        TriageProperties.Llm llm = properties.getLlm();
        String provider = llm.getProvider() == null ? "" : llm.getProvider().trim().toLowerCase();
        switch (provider) {
            case "gemini":
                if (llm.getApiKey() == null || llm.getApiKey().isBlank()) {
                    log.warn("triage.llm.api-key is empty; Gemini calls will fail and return fallback output");
                }
                log.info("Classification provider: gemini model={}", llm.getModel());
                return new GeminiClassificationGateway(googleGenerativeClient, llm, objectMapper);
            case "local":
                log.info("Classification provider: local");
                return new LocalClassificationGateway();
            default:
                throw new IllegalStateException("Unsupported triage.llm.provider: " + llm.getProvider());
        }
    }
}
