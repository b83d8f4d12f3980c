package com.example.mailtriage.service.gateway;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ClassificationRequest {
    String messageId;
    String systemPrompt;
    String userContent;
}
