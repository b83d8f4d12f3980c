package com.example.mailtriage.dto.response.triage;

import com.example.mailtriage.model.UrgencyLevel;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TaskProposal {
    String type;
    String title;
    String description;
    UrgencyLevel priority;
    String status;
    @JsonProperty("scheduled_for")
    String scheduledFor;
    @JsonProperty("due_at")
    String dueAt;
    @JsonProperty("waiting_on")
    String waitingOn;
}
