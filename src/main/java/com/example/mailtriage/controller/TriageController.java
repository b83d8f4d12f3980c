package com.example.mailtriage.controller;

import com.example.mailtriage.config.TriageProperties;
import com.example.mailtriage.dto.request.mail.Message;
import com.example.mailtriage.dto.response.TriageResponse;
import com.example.mailtriage.model.MajorCategory;
import com.example.mailtriage.service.PipelineOrchestrator;
import com.example.mailtriage.service.PipelineStats;
import com.example.mailtriage.service.gateway.ClassificationGateway;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping(TriageController.BASE_PATH)
@RequiredArgsConstructor
@FieldDefaults(level = lombok.AccessLevel.PRIVATE, makeFinal = true)
@Slf4j
public class TriageController {
    public static final String BASE_PATH = "/rd/api/v1";
    public static final String TRIAGE_PATH = "/ai/triage";
    public static final String API_DATA_PATH = "/apidata";
    public static final String HEALTH_PATH = "/health";
    public static final String MODEL_INFO_PATH = "/ai";

    static final int HEALTH_RECENT_ERRORS = 10;

    PipelineOrchestrator pipelineOrchestrator;
    PipelineStats pipelineStats;
    ClassificationGateway classificationGateway;
    TriageProperties properties;

    @PostMapping(TRIAGE_PATH)
    public Mono<ResponseEntity<Object>> triage(@RequestBody(required = false) Message message) {
        if (message == null || message.getPayload() == null) {
            log.warn("triage: rejected request without payload, messageId={}", message != null ? message.getId() : null);
            return Mono.just(ResponseEntity.badRequest()
                    .<Object>body(Map.of("error", "Request body must contain a message payload")));
        }
        return pipelineOrchestrator.run(message)
                .map(output -> ResponseEntity.<Object>ok(new TriageResponse(output)));
    }

    @GetMapping(API_DATA_PATH)
    public Map<String, Object> apiData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", "mailtriage");
        data.put("version", properties.getApiVersion());
        data.put("schema_version", properties.getSchemaVersion());
        data.put("contract_reference", properties.getContractReference());
        data.put("endpoints", List.of(
                "POST " + BASE_PATH + TRIAGE_PATH,
                "GET " + BASE_PATH + API_DATA_PATH,
                "GET " + BASE_PATH + HEALTH_PATH,
                "GET " + BASE_PATH + MODEL_INFO_PATH));
        data.put("categories", Arrays.stream(MajorCategory.values())
                .map(MajorCategory::getValue)
                .collect(Collectors.toList()));
        return data;
    }

    @GetMapping(HEALTH_PATH)
    public Map<String, Object> health() {
        Map<String, Object> counters = new LinkedHashMap<>();
        counters.put("requests", pipelineStats.getRequests());
        counters.put("completed", pipelineStats.getCompleted());
        counters.put("fallbacks", pipelineStats.getFallbacks());
        counters.put("errors", pipelineStats.getErrors());

        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", pipelineStats.isDegraded() ? "degraded" : "ok");
        health.put("uptime_seconds", pipelineStats.uptime().getSeconds());
        health.put("counters", counters);
        health.put("recent_errors", pipelineStats.recentErrors(HEALTH_RECENT_ERRORS).stream()
                .map(error -> {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("at", error.getAt().toString());
                    entry.put("message_id", error.getMessageId());
                    entry.put("stage", error.getStage());
                    entry.put("error", error.getError());
                    return entry;
                })
                .collect(Collectors.toList()));
        return health;
    }

    @GetMapping(MODEL_INFO_PATH)
    public Map<String, Object> modelInfo() {
        TriageProperties.Llm llm = properties.getLlm();
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("provider", llm.getProvider());
        info.put("gateway", classificationGateway.name());
        info.put("model", llm.getModel());
        info.put("temperature", llm.getTemperature());
        info.put("timeout_seconds", llm.getTimeout().toSeconds());
        info.put("max_body_chars", properties.getMaxBodyChars());
        info.put("max_signals", properties.getMaxSignals());
        info.put("prompt_version", properties.getPromptVersion());
        info.put("schema_version", properties.getSchemaVersion());
        info.put("default_timezone", properties.getDefaultTimezone());
        return info;
    }
}
