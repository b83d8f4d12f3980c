package com.example.mailtriage.service.gateway;

import com.example.mailtriage.config.TriageProperties;
import com.example.mailtriage.dto.response.GeminiResponse;
import com.example.mailtriage.model.CandidateOutput;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Classifies through Gemini {@code generateContent}, asking for a JSON-only response.
 */
@RequiredArgsConstructor
@Slf4j
public class GeminiClassificationGateway implements ClassificationGateway {

    private static final Pattern LEADING_FENCE = Pattern.compile("^```[a-zA-Z]*\\s*");
    private static final Pattern TRAILING_FENCE = Pattern.compile("\\s*```$");

    private final WebClient googleGenerativeClient;
    private final TriageProperties.Llm llm;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<CandidateOutput> classify(ClassificationRequest request) {
        Map<String, Object> body = Map.of(
                "systemInstruction", Map.of("parts", List.of(
                        Map.of("text", request.getSystemPrompt())
                )),
                "contents", List.of(
                        Map.of("role", "user", "parts", List.of(
                                Map.of("text", request.getUserContent())
                        ))
                ),
                "generationConfig", Map.of(
                        "temperature", llm.getTemperature(),
                        "responseMimeType", "application/json"
                )
        );

        log.info("classify: calling Gemini model={} messageId={} promptLen={}",
                llm.getModel(), request.getMessageId(), request.getUserContent().length());

        return googleGenerativeClient.post()
                .uri(uriBuilder -> uriBuilder
                        .path("/v1beta/models/{model}:generateContent")
                        .queryParamIfPresent("key", Optional.ofNullable(llm.getApiKey()).filter(key -> !key.isBlank()))
                        .build(llm.getModel()))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(GeminiResponse.class)
                .onErrorMap(WebClientResponseException.class, e -> new ClassificationException(
                        "Gemini returned HTTP " + e.getStatusCode().value(), e))
                .flatMap(response -> toCandidate(response, request.getMessageId()));
    }

    @Override
    public String name() {
        return "gemini/" + llm.getModel();
    }

    private Mono<CandidateOutput> toCandidate(GeminiResponse response, String messageId) {
        String text = response.getText();
        if (text == null || text.isBlank()) {
            String finishReason = response.getCandidates() != null && !response.getCandidates().isEmpty()
                    && response.getCandidates().get(0) != null
                    ? response.getCandidates().get(0).getFinishReason() : null;
            return Mono.error(new ClassificationException("Gemini returned no text (finishReason=" + finishReason + ")"));
        }
        if (response.getUsageMetadata() != null) {
            log.debug("classify: messageId={} tokens prompt={} output={}", messageId,
                    response.getUsageMetadata().getPromptTokenCount(),
                    response.getUsageMetadata().getCandidatesTokenCount());
        }

        String json = stripCodeFence(text.trim());
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root == null || !root.isObject()) {
                return Mono.error(new ClassificationException("Gemini output is not a JSON object"));
            }
            return Mono.just(CandidateOutput.of(root));
        } catch (JsonProcessingException e) {
            return Mono.error(new ClassificationException("Gemini output is not valid JSON", e));
        }
    }

    static String stripCodeFence(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        String stripped = LEADING_FENCE.matcher(text).replaceFirst("");
        return TRAILING_FENCE.matcher(stripped).replaceFirst("");
    }
}
