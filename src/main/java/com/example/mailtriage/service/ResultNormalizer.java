package com.example.mailtriage.service;

import com.example.mailtriage.config.PipelineSettings;
import com.example.mailtriage.dto.response.triage.DateRef;
import com.example.mailtriage.dto.response.triage.DebugInfo;
import com.example.mailtriage.dto.response.triage.DocRef;
import com.example.mailtriage.dto.response.triage.Entities;
import com.example.mailtriage.dto.response.triage.ExtractedSummary;
import com.example.mailtriage.dto.response.triage.MeetingRef;
import com.example.mailtriage.dto.response.triage.MoneyRef;
import com.example.mailtriage.dto.response.triage.PersonRef;
import com.example.mailtriage.dto.response.triage.RecommendedAction;
import com.example.mailtriage.dto.response.triage.TaskProposal;
import com.example.mailtriage.dto.response.triage.TriageOutput;
import com.example.mailtriage.dto.response.triage.UrgencySignals;
import com.example.mailtriage.helper.JsonCoercion;
import com.example.mailtriage.model.ActionKind;
import com.example.mailtriage.model.CandidateOutput;
import com.example.mailtriage.model.MajorCategory;
import com.example.mailtriage.model.NormalizedMessage;
import com.example.mailtriage.model.SignalsBundle;
import com.example.mailtriage.model.TimePhrase;
import com.example.mailtriage.model.TimePhraseType;
import com.example.mailtriage.model.TriageTaxonomy;
import com.example.mailtriage.model.UrgencyLevel;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns untrusted classification output into a contract-conforming {@link TriageOutput}.
 * Deterministic for a fixed clock, and idempotent: feeding an output back in yields the same output.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResultNormalizer {

    static final int MAX_REPLY_ACTIONS = 3;
    static final int MAX_RECOMMENDED_ACTIONS = 4;
    static final int MIN_EVIDENCE = 1;
    static final int MAX_EVIDENCE = 3;
    static final int MAX_EVIDENCE_CHARS = 240;
    static final int MAX_MISSING_INFO = 3;

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^A-Za-z0-9]+");
    private static final Pattern UNDERSCORES = Pattern.compile("_+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern REPLY_PREFIX = Pattern.compile("^\\s*(?:re|fwd|fw)\\s*:\\s*", Pattern.CASE_INSENSITIVE);

    private final PipelineSettings settings;
    private final Clock clock;
    private final DeadlineResolver deadlineResolver;

    public TriageOutput normalize(CandidateOutput candidate,
                                  NormalizedMessage message,
                                  SignalsBundle signals,
                                  OffsetDateTime referenceTimestamp) {
        CandidateOutput raw = candidate != null ? candidate : CandidateOutput.empty();
        ZonedDateTime reference = referenceTimestamp.toZonedDateTime();
        List<String> flags = new ArrayList<>();

        // 1. confidence
        Double rawConfidence = JsonCoercion.number(raw.path("confidence"));
        double confidence = clamp01(rawConfidence == null ? settings.getDefaultConfidence() : rawConfidence);

        // 2. taxonomy
        String rawCategory = JsonCoercion.trimmedOrNull(raw.path("major_category"));
        MajorCategory category = MajorCategory.fromValue(rawCategory).orElse(TriageTaxonomy.FALLBACK_CATEGORY);
        String subActionKey = toActionKey(JsonCoercion.text(raw.path("sub_action_key")));
        if (!TriageTaxonomy.isKnownActionKey(subActionKey)) {
            log.debug("Unknown sub_action_key '{}' for message {}, using {}",
                    subActionKey, message.getMessageId(), TriageTaxonomy.FALLBACK_ACTION_KEY);
            subActionKey = TriageTaxonomy.FALLBACK_ACTION_KEY;
        }

        // 3. deadlines
        UrgencySignals urgencySignals = normalizeUrgency(raw.path("urgency_signals"), signals, reference);
        TaskProposal taskProposal = normalizeTaskProposal(raw.path("task_proposal"), urgencySignals.getReplyBy());

        // 4. entities
        Entities entities = normalizeEntities(raw.path("entities"), message, category, subActionKey, reference);

        // 5. bounds
        List<String> replies = limit(JsonCoercion.stringList(raw.path("suggested_reply_action")), MAX_REPLY_ACTIONS);
        List<RecommendedAction> actions = normalizeActions(raw.path("recommended_actions"));
        List<String> evidence = cleanEvidence(raw.path("evidence"));
        if (evidence.size() < MIN_EVIDENCE) {
            flags.add(DebugInfo.FLAG_EVIDENCE_BELOW_MINIMUM);
        }

        JsonNode summaryNode = raw.path("extracted_summary");
        ExtractedSummary summary = ExtractedSummary.builder()
                .ask(JsonCoercion.trimmed(summaryNode.path("ask")))
                .successCriteria(JsonCoercion.trimmed(summaryNode.path("success_criteria")))
                .missingInfo(limit(JsonCoercion.stringList(summaryNode.path("missing_info")), MAX_MISSING_INFO))
                .build();

        // 6. debug
        TriageOutput output = TriageOutput.builder()
                .majorCategory(category)
                .subActionKey(subActionKey)
                .explicitTask(JsonCoercion.bool(raw.path("explicit_task")))
                .confidence(confidence)
                .suggestedReplyAction(replies)
                .taskProposal(taskProposal)
                .recommendedActions(actions)
                .urgencySignals(urgencySignals)
                .extractedSummary(summary)
                .entities(entities)
                .evidence(evidence)
                .debug(debug(settings.getModelVersion(), flags))
                .build();

        TriageOutputInvariants.verify(output, message);
        return output;
    }

    /**
     * Safe low-confidence result used when classification failed, timed out or returned nothing usable.
     */
    public TriageOutput fallback(NormalizedMessage message,
                                 SignalsBundle signals,
                                 OffsetDateTime referenceTimestamp,
                                 String reason) {
        log.info("Building fallback output for message {}: {}", message.getMessageId(), reason);
        List<String> flags = new ArrayList<>();
        flags.add(DebugInfo.FLAG_CLASSIFICATION_FALLBACK);
        flags.add(DebugInfo.FLAG_EVIDENCE_BELOW_MINIMUM);

        TriageOutput output = TriageOutput.builder()
                .majorCategory(TriageTaxonomy.FALLBACK_CATEGORY)
                .subActionKey(TriageTaxonomy.FALLBACK_ACTION_KEY)
                .explicitTask(false)
                .confidence(clamp01(settings.getFallbackConfidence()))
                .suggestedReplyAction(List.of())
                .taskProposal(null)
                .recommendedActions(List.of())
                .urgencySignals(UrgencySignals.builder()
                        .urgency(UrgencyLevel.LOW)
                        .deadlineDetected(false)
                        .reason("")
                        .build())
                .extractedSummary(ExtractedSummary.builder()
                        .ask("")
                        .successCriteria("")
                        .missingInfo(List.of())
                        .build())
                .entities(Entities.builder()
                        .people(withSender(new ArrayList<>(), message))
                        .dates(List.of())
                        .money(List.of())
                        .docs(List.of())
                        .build())
                .evidence(List.of())
                .debug(debug(settings.getFallbackModelVersion(), flags))
                .build();

        TriageOutputInvariants.verify(output, message);
        return output;
    }

    private UrgencySignals normalizeUrgency(JsonNode node, SignalsBundle signals, ZonedDateTime reference) {
        boolean deadlineDetected = JsonCoercion.bool(node.path("deadline_detected"));
        String deadlineText = JsonCoercion.trimmedOrNull(node.path("deadline_text"));
        String replyByRaw = JsonCoercion.trimmedOrNull(node.path("reply_by"));

        if (deadlineDetected && deadlineText == null && signals != null) {
            deadlineText = signals.getTimePhrases().stream()
                    .filter(phrase -> phrase.getType() != TimePhraseType.RECURRING)
                    .map(TimePhrase::getRawText)
                    .findFirst()
                    .orElse(null);
        }

        String replyBy = null;
        if (replyByRaw != null) {
            replyBy = deadlineResolver.parseIso(replyByRaw, settings.getDefaultZone())
                    .map(dateTime -> dateTime.format(DeadlineResolver.DATE_TIME_FORMAT))
                    .orElseGet(() -> resolveTimestamp(replyByRaw, reference));
        }
        if (replyBy == null && deadlineText != null) {
            replyBy = resolveTimestamp(deadlineText, reference);
        }

        return UrgencySignals.builder()
                .urgency(UrgencyLevel.fromValue(JsonCoercion.text(node.path("urgency")), UrgencyLevel.MEDIUM))
                .deadlineDetected(deadlineDetected)
                .deadlineText(deadlineText)
                .replyBy(replyBy)
                .reason(JsonCoercion.trimmed(node.path("reason")))
                .build();
    }

    private String resolveTimestamp(String text, ZonedDateTime reference) {
        return deadlineResolver.resolve(text, reference, settings.getDefaultZone())
                .map(DeadlineResolver.ResolvedDeadline::timestamp)
                .orElse(null);
    }

    private TaskProposal normalizeTaskProposal(JsonNode node, String replyBy) {
        if (!node.isObject()) {
            return null;
        }
        String dueAt = JsonCoercion.trimmedOrNull(node.path("due_at"));
        return TaskProposal.builder()
                .type(JsonCoercion.trimmedOrNull(node.path("type")))
                .title(JsonCoercion.trimmed(node.path("title")))
                .description(JsonCoercion.trimmed(node.path("description")))
                .priority(UrgencyLevel.fromValue(JsonCoercion.text(node.path("priority")), UrgencyLevel.MEDIUM))
                .status("open")
                .scheduledFor(JsonCoercion.trimmedOrNull(node.path("scheduled_for")))
                .dueAt(dueAt != null ? dueAt : replyBy)
                .waitingOn(JsonCoercion.trimmedOrNull(node.path("waiting_on")))
                .build();
    }

    private List<RecommendedAction> normalizeActions(JsonNode node) {
        List<RankedAction> ranked = new ArrayList<>();
        for (JsonNode element : JsonCoercion.elements(node)) {
            String label = JsonCoercion.trimmed(element.path("label"));
            String key = JsonCoercion.trimmed(element.path("key"));
            if (key.isEmpty()) {
                key = toActionKey(label);
            }
            if (key.isEmpty() && label.isEmpty()) {
                continue;
            }
            Integer rank = JsonCoercion.integer(element.path("rank"));
            ranked.add(new RankedAction(rank != null ? rank : Integer.MAX_VALUE, key, label,
                    ActionKind.fromValue(JsonCoercion.text(element.path("kind")))));
        }
        // List.sort is stable, so equal ranks keep their original order
        ranked.sort(Comparator.comparingInt(action -> action.rank));

        List<RecommendedAction> out = new ArrayList<>();
        for (RankedAction action : limit(ranked, MAX_RECOMMENDED_ACTIONS)) {
            out.add(RecommendedAction.builder()
                    .key(action.key)
                    .label(action.label)
                    .kind(action.kind)
                    .rank(out.size() + 1)
                    .build());
        }
        return out;
    }

    private Entities normalizeEntities(JsonNode node,
                                       NormalizedMessage message,
                                       MajorCategory category,
                                       String subActionKey,
                                       ZonedDateTime reference) {
        List<PersonRef> people = new ArrayList<>();
        for (JsonNode element : JsonCoercion.elements(node.path("people"))) {
            String email = element.isTextual() ? JsonCoercion.trimmedOrNull(element)
                    : JsonCoercion.trimmedOrNull(element.path("email"));
            if (email != null) {
                people.add(new PersonRef(email, JsonCoercion.trimmedOrNull(element.path("role"))));
            }
        }
        withSender(people, message);

        List<DateRef> dates = new ArrayList<>();
        ZonedDateTime firstTimed = null;
        String firstTimedZone = null;
        for (JsonNode element : JsonCoercion.elements(node.path("dates"))) {
            String text = element.isTextual() ? JsonCoercion.trimmedOrNull(element)
                    : JsonCoercion.trimmedOrNull(element.path("text"));
            String iso = JsonCoercion.trimmedOrNull(element.path("iso"));
            String type = JsonCoercion.trimmedOrNull(element.path("type"));

            Optional<ZonedDateTime> given = deadlineResolver.parseIso(iso, settings.getDefaultZone());
            if (given.isPresent()) {
                if (firstTimed == null && iso.contains("T")) {
                    firstTimed = given.get();
                }
            } else {
                Optional<DeadlineResolver.ResolvedDeadline> resolved =
                        deadlineResolver.resolve(text, reference, settings.getDefaultZone());
                iso = resolved.map(DeadlineResolver.ResolvedDeadline::iso).orElse(null);
                if (firstTimed == null && resolved.isPresent() && resolved.get().isTimeOfDay()) {
                    firstTimed = resolved.get().getDateTime();
                    firstTimedZone = resolved.get().getZoneName();
                }
            }
            if (text != null || iso != null) {
                dates.add(new DateRef(text, iso, type));
            }
        }

        List<MoneyRef> money = new ArrayList<>();
        for (JsonNode element : JsonCoercion.elements(node.path("money"))) {
            String text = JsonCoercion.trimmedOrNull(element.path("text"));
            Double amount = JsonCoercion.number(element.path("amount"));
            if (text != null || amount != null) {
                money.add(new MoneyRef(text, amount, JsonCoercion.trimmedOrNull(element.path("currency"))));
            }
        }

        List<DocRef> docs = new ArrayList<>();
        for (JsonNode element : JsonCoercion.elements(node.path("docs"))) {
            String title = JsonCoercion.trimmedOrNull(element.path("title"));
            String url = JsonCoercion.trimmedOrNull(element.path("url"));
            if (title != null || url != null) {
                docs.add(new DocRef(title, url, JsonCoercion.trimmedOrNull(element.path("type"))));
            }
        }

        JsonNode meetingNode = node.path("meeting");
        String topic = JsonCoercion.trimmedOrNull(meetingNode.path("topic"));
        String startAt = JsonCoercion.trimmedOrNull(meetingNode.path("start_at"));
        String tz = JsonCoercion.trimmedOrNull(meetingNode.path("tz"));
        boolean wantsMeeting = category == MajorCategory.SCHEDULE_AND_TIME || subActionKey.startsWith("SCHEDULE_");
        if (wantsMeeting) {
            if (topic == null) {
                topic = subjectToTopic(message.getSubject());
            }
            if (startAt == null && firstTimed != null) {
                startAt = firstTimed.format(DeadlineResolver.DATE_TIME_FORMAT);
            }
            if (tz == null) {
                tz = firstTimedZone;
            }
        }
        MeetingRef meeting = wantsMeeting || meetingNode.isObject() ? new MeetingRef(topic, startAt, tz) : null;

        return Entities.builder()
                .people(people)
                .dates(dates)
                .money(money)
                .docs(docs)
                .meeting(meeting)
                .build();
    }

    /**
     * Puts the sender at the head of {@code people} unless listed; a listed sender always ends up with the sender role.
     */
    private static List<PersonRef> withSender(List<PersonRef> people, NormalizedMessage message) {
        String senderEmail = message.getSenderEmail();
        if (senderEmail == null || senderEmail.isBlank()) {
            return people;
        }
        for (int i = 0; i < people.size(); i++) {
            PersonRef person = people.get(i);
            if (senderEmail.equalsIgnoreCase(person.getEmail())) {
                if (!PersonRef.ROLE_SENDER.equals(person.getRole())) {
                    people.set(i, new PersonRef(person.getEmail(), PersonRef.ROLE_SENDER));
                }
                return people;
            }
        }
        people.add(0, new PersonRef(senderEmail, PersonRef.ROLE_SENDER));
        return people;
    }

    private static List<String> cleanEvidence(JsonNode node) {
        List<String> cleaned = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String snippet : JsonCoercion.stringList(node)) {
            String collapsed = WHITESPACE.matcher(snippet).replaceAll(" ").trim();
            if (collapsed.length() > MAX_EVIDENCE_CHARS) {
                int end = MAX_EVIDENCE_CHARS;
                if (Character.isHighSurrogate(collapsed.charAt(end - 1))) {
                    end--;
                }
                collapsed = collapsed.substring(0, end).trim();
            }
            if (collapsed.isEmpty() || !seen.add(collapsed.toLowerCase(Locale.ROOT))) {
                continue;
            }
            cleaned.add(collapsed);
            if (cleaned.size() >= MAX_EVIDENCE) {
                break;
            }
        }
        return cleaned;
    }

    private DebugInfo debug(String modelVersion, List<String> flags) {
        return DebugInfo.builder()
                .timestamp(OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC)
                        .format(DeadlineResolver.DATE_TIME_FORMAT))
                .modelVersion(modelVersion)
                .promptVersion(settings.getPromptVersion())
                .flags(List.copyOf(flags))
                .build();
    }

    static String toActionKey(String raw) {
        if (raw == null) {
            return "";
        }
        String key = NON_ALPHANUMERIC.matcher(raw.trim()).replaceAll("_");
        key = UNDERSCORES.matcher(key).replaceAll("_");
        key = key.replaceAll("^_+|_+$", "");
        return key.toUpperCase(Locale.ROOT);
    }

    static String subjectToTopic(String subject) {
        String topic = subject == null ? "" : subject.trim();
        String stripped = REPLY_PREFIX.matcher(topic).replaceFirst("");
        while (!stripped.equals(topic)) {
            topic = stripped;
            stripped = REPLY_PREFIX.matcher(topic).replaceFirst("");
        }
        topic = topic.trim();
        return topic.isEmpty() ? null : topic;
    }

    private static double clamp01(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static <T> List<T> limit(List<T> values, int max) {
        return values.size() <= max ? values : new ArrayList<>(values.subList(0, max));
    }

    private static final class RankedAction {
        final int rank;
        final String key;
        final String label;
        final ActionKind kind;

        RankedAction(int rank, String key, String label, ActionKind kind) {
            this.rank = rank;
            this.key = key;
            this.label = label;
            this.kind = kind;
        }
    }
}
