package com.example.mailtriage.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Mail triage configuration properties
 */
@Data
@Component
@ConfigurationProperties(prefix = "triage")
public class TriageProperties {

    private String apiVersion = "3.0.0";
    private String schemaVersion = "triage-output.v3";
    private String contractReference = "mailtriage.gmail_insights.v1";
    private String promptVersion = "triage-v3-2026-02";

    private int maxBodyChars = 12000;
    private int maxSignals = 10;
    private double defaultConfidence = 0.5;
    private double fallbackConfidence = 0.0;
    private String fallbackModelVersion = "fallback";
    private String defaultTimezone = "UTC";
    private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:5173"));

    private Llm llm = new Llm();

    @Data
    public static class Llm {
        private String provider = "gemini"; // gemini | local
        private String baseUrl = "https://generativelanguage.googleapis.com";
        private String model = "gemini-2.5-flash-lite";
        private String apiKey;
        private double temperature = 0.2;
        private Duration timeout = Duration.ofSeconds(30);
        private int maxInMemorySize = 4 * 1024 * 1024;
    }
}
