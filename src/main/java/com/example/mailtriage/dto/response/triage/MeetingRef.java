package com.example.mailtriage.dto.response.triage;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class MeetingRef {
    String topic;
    @JsonProperty("start_at")
    String startAt;
    String tz;
}
