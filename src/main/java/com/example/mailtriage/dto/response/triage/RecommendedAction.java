package com.example.mailtriage.dto.response.triage;

import com.example.mailtriage.model.ActionKind;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RecommendedAction {
    String key;
    String label;
    ActionKind kind;
    int rank;
}
