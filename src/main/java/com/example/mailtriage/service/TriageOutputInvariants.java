package com.example.mailtriage.service;

import com.example.mailtriage.dto.response.triage.DebugInfo;
import com.example.mailtriage.dto.response.triage.PersonRef;
import com.example.mailtriage.dto.response.triage.RecommendedAction;
import com.example.mailtriage.dto.response.triage.TriageOutput;
import com.example.mailtriage.model.NormalizedMessage;
import com.example.mailtriage.model.TriageTaxonomy;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Contract checks run on every built {@link TriageOutput}. A failure is a programming defect
 * in the normalizer, never a property of the input.
 */
final class TriageOutputInvariants {

    private TriageOutputInvariants() {}

    static void verify(TriageOutput output, NormalizedMessage message) {
        check(Double.isFinite(output.getConfidence())
                && output.getConfidence() >= 0.0 && output.getConfidence() <= 1.0,
                "confidence out of range: " + output.getConfidence());
        check(output.getMajorCategory() != null, "major_category missing");
        check(TriageTaxonomy.isKnownActionKey(output.getSubActionKey()),
                "unknown sub_action_key: " + output.getSubActionKey());

        check(output.getSuggestedReplyAction().size() <= ResultNormalizer.MAX_REPLY_ACTIONS,
                "too many suggested replies");

        List<RecommendedAction> actions = output.getRecommendedActions();
        check(actions.size() <= ResultNormalizer.MAX_RECOMMENDED_ACTIONS, "too many recommended actions");
        for (int i = 0; i < actions.size(); i++) {
            check(actions.get(i).getRank() == i + 1, "recommended action ranks not sequential");
        }

        List<String> evidence = output.getEvidence();
        check(evidence.size() <= ResultNormalizer.MAX_EVIDENCE, "too many evidence snippets");
        for (String snippet : evidence) {
            check(!snippet.isBlank() && snippet.length() <= ResultNormalizer.MAX_EVIDENCE_CHARS,
                    "evidence snippet out of bounds");
        }

        DebugInfo debug = output.getDebug();
        check(debug != null && debug.getTimestamp() != null && debug.getModelVersion() != null
                && debug.getPromptVersion() != null, "debug metadata incomplete");
        if (evidence.size() < ResultNormalizer.MIN_EVIDENCE) {
            check(debug.getFlags().contains(DebugInfo.FLAG_EVIDENCE_BELOW_MINIMUM), "missing evidence flag");
        }

        String senderEmail = message.getSenderEmail();
        if (senderEmail != null && !senderEmail.isBlank()) {
            boolean senderPresent = output.getEntities().getPeople().stream()
                    .anyMatch(person -> senderEmail.equalsIgnoreCase(person.getEmail())
                            && PersonRef.ROLE_SENDER.equals(person.getRole()));
            check(senderPresent, "sender with role 'sender' missing from entities.people");
        }

        String replyBy = output.getUrgencySignals().getReplyBy();
        if (replyBy != null) {
            try {
                OffsetDateTime.parse(replyBy);
            } catch (DateTimeParseException e) {
                throw new IllegalStateException("reply_by is not an offset timestamp: " + replyBy, e);
            }
        }
    }

    private static void check(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException("Triage output invariant violated: " + message);
        }
    }
}
