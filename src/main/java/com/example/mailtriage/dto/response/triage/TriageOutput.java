package com.example.mailtriage.dto.response.triage;

import com.example.mailtriage.model.MajorCategory;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Finalized triage result. Only {@code ResultNormalizer} builds it, and every
 * instance satisfies the response contract.
 */
@Value
@Builder
public class TriageOutput {
    @JsonProperty("major_category")
    MajorCategory majorCategory;

    @JsonProperty("sub_action_key")
    String subActionKey;

    @JsonProperty("explicit_task")
    boolean explicitTask;

    double confidence;

    @JsonProperty("suggested_reply_action")
    List<String> suggestedReplyAction;

    @JsonProperty("task_proposal")
    TaskProposal taskProposal;

    @JsonProperty("recommended_actions")
    List<RecommendedAction> recommendedActions;

    @JsonProperty("urgency_signals")
    UrgencySignals urgencySignals;

    @JsonProperty("extracted_summary")
    ExtractedSummary extractedSummary;

    Entities entities;

    List<String> evidence;

    DebugInfo debug;
}
