package com.example.mailtriage.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Immutable snapshot of the triage configuration handed to the pipeline at construction.
 */
@Value
@Builder
public class PipelineSettings {
    @Builder.Default
    int maxBodyChars = 12000;
    @Builder.Default
    int maxSignals = 10;
    @Builder.Default
    double defaultConfidence = 0.5;
    @Builder.Default
    double fallbackConfidence = 0.0;
    @Builder.Default
    String fallbackModelVersion = "fallback";
    @Builder.Default
    String modelVersion = "unknown";
    @Builder.Default
    String promptVersion = "triage-v3-2026-02";
    @Builder.Default
    ZoneId defaultZone = ZoneId.of("UTC");
    @Builder.Default
    Duration classificationTimeout = Duration.ofSeconds(30);

    public static PipelineSettings from(TriageProperties properties) {
        TriageProperties.Llm llm = properties.getLlm();
        return PipelineSettings.builder()
                .maxBodyChars(properties.getMaxBodyChars())
                .maxSignals(properties.getMaxSignals())
                .defaultConfidence(properties.getDefaultConfidence())
                .fallbackConfidence(properties.getFallbackConfidence())
                .fallbackModelVersion(properties.getFallbackModelVersion())
                .modelVersion(llm.getProvider() + "/" + llm.getModel())
                .promptVersion(properties.getPromptVersion())
                .defaultZone(ZoneId.of(properties.getDefaultTimezone()))
                .classificationTimeout(llm.getTimeout())
                .build();
    }
}
