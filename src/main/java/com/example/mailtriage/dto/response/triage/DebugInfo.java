package com.example.mailtriage.dto.response.triage;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Server-injected metadata. Never taken from the classification step.
 */
@Value
@Builder
public class DebugInfo {
    public static final String FLAG_CLASSIFICATION_FALLBACK = "CLASSIFICATION_FALLBACK";
    public static final String FLAG_EVIDENCE_BELOW_MINIMUM = "EVIDENCE_BELOW_MINIMUM";

    String timestamp;
    @JsonProperty("model_version")
    String modelVersion;
    @JsonProperty("prompt_version")
    String promptVersion;
    List<String> flags;
}
