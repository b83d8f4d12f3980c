package com.example.mailtriage.dto.response.triage;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ExtractedSummary {
    String ask;
    @JsonProperty("success_criteria")
    String successCriteria;
    @JsonProperty("missing_info")
    List<String> missingInfo;
}
