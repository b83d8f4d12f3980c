package com.example.mailtriage.dto.response.triage;

import com.example.mailtriage.model.UrgencyLevel;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class UrgencySignals {
    UrgencyLevel urgency;
    @JsonProperty("deadline_detected")
    boolean deadlineDetected;
    @JsonProperty("deadline_text")
    String deadlineText;
    @JsonProperty("reply_by")
    String replyBy;   // ISO-8601 with offset, or null
    String reason;
}
