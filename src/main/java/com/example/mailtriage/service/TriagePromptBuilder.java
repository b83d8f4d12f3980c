package com.example.mailtriage.service;

import com.example.mailtriage.config.PipelineSettings;
import com.example.mailtriage.model.MajorCategory;
import com.example.mailtriage.model.MoneyMention;
import com.example.mailtriage.model.NormalizedMessage;
import com.example.mailtriage.model.SignalsBundle;
import com.example.mailtriage.model.TimePhrase;
import com.example.mailtriage.model.TriageTaxonomy;
import com.example.mailtriage.service.gateway.ClassificationRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.Map;

/**
 * Builds the classification request: a fixed system prompt listing the taxonomy and
 * a compact JSON rendering of the message and its signals.
 */
@Component
@Slf4j
public class TriagePromptBuilder {

    private static final Map<MajorCategory, String> CATEGORY_HINTS = new EnumMap<>(MajorCategory.class);

    static {
        CATEGORY_HINTS.put(MajorCategory.CORE_COMMUNICATION, "a person writes to you and expects a reply, acknowledgement or clarification");
        CATEGORY_HINTS.put(MajorCategory.DECISIONS_AND_APPROVALS, "you have to approve, reject, choose or confirm something");
        CATEGORY_HINTS.put(MajorCategory.SCHEDULE_AND_TIME, "agreeing on a time: meetings, reschedules, RSVPs, deadlines to confirm");
        CATEGORY_HINTS.put(MajorCategory.DOCUMENTS_AND_REVIEW, "the main job is to read, comment on or sign off a document");
        CATEGORY_HINTS.put(MajorCategory.FINANCIAL_AND_ADMIN, "invoices, payments, billing, subscriptions, expense and admin records");
        CATEGORY_HINTS.put(MajorCategory.PEOPLE_AND_PROCESS, "handoffs, ownership or role changes, workflow updates");
        CATEGORY_HINTS.put(MajorCategory.INFORMATION_AND_ORG, "FYI notes, announcements and status reports that need no reply");
        CATEGORY_HINTS.put(MajorCategory.LEARNING_AND_AWARENESS, "articles, webinars, courses and other read-later material");
        CATEGORY_HINTS.put(MajorCategory.SOCIAL_AND_PEOPLE, "introductions, invitations, congratulations");
        CATEGORY_HINTS.put(MajorCategory.META_AND_SYSTEMS, "automated alerts, security notices and system notifications");
        CATEGORY_HINTS.put(MajorCategory.OTHER, "nothing above fits");
    }

    private static final String OUTPUT_RULES = """
            Reply with a single JSON object and nothing else (no Markdown). Fields:
            - major_category: one value from the category list.
            - sub_action_key: one key from the list under the chosen category, SCREAMING_SNAKE_CASE, or OTHER.
            - explicit_task: true when the message implies trackable work beyond reading it.
            - confidence: number between 0.0 and 1.0.
            - suggested_reply_action: up to 3 short quick-reply phrases, empty when no reply is expected.
            - task_proposal: null, or {type, title, description, priority, status, scheduled_for, due_at, waiting_on};
              priority is low|medium|high|critical and status is "open".
            - recommended_actions: 1 to 4 items {key, label, kind, rank}; kind is PRIMARY|SECONDARY|DANGER,
              rank starts at 1 for the most natural next step.
            - urgency_signals: {urgency, deadline_detected, deadline_text, reply_by, reason}; urgency is
              low|medium|high|critical, reply_by is an ISO-8601 timestamp with offset or null.
            - extracted_summary: {ask, success_criteria, missing_info (0 to 3 strings)}.
            - entities: {people: [{email, role}], dates: [{text, iso, type}], money: [{text, amount, currency}],
              docs: [{title, url, type}], meeting: {topic, start_at, tz} or null}.
            - evidence: 1 to 3 snippets copied verbatim from the message body. Never invent evidence.
            Pick the category of the action that blocks progress: confirming a meeting time is
            schedule_and_time, signing off a contract is decisions_and_approvals even when a date is mentioned.
            """;

    private final ObjectMapper objectMapper;
    private final PipelineSettings settings;
    private final String systemPrompt;

    public TriagePromptBuilder(ObjectMapper objectMapper, PipelineSettings settings) {
        this.objectMapper = objectMapper;
        this.settings = settings;
        this.systemPrompt = buildSystemPrompt();
    }

    public ClassificationRequest build(NormalizedMessage message, SignalsBundle signals) {
        return ClassificationRequest.builder()
                .messageId(message.getMessageId())
                .systemPrompt(systemPrompt)
                .userContent(userContent(message, signals))
                .build();
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    String userContent(NormalizedMessage message, SignalsBundle signals) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("provider", message.getProvider());
        payload.put("messageId", message.getMessageId());
        payload.put("threadId", message.getThreadId());
        payload.put("subject", message.getSubject());
        ObjectNode from = payload.putObject("from");
        from.put("name", message.getSenderName());
        from.put("email", message.getSenderEmail());
        ArrayNode to = payload.putArray("to");
        message.getTo().forEach(to::add);
        ArrayNode cc = payload.putArray("cc");
        message.getCc().forEach(cc::add);
        payload.put("sentAt", message.getSentAt() != null
                ? message.getSentAt().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME) : null);
        payload.put("snippet", message.getSnippet());
        payload.put("bodyText", message.getBodyText());
        ArrayNode attachments = payload.putArray("attachments");
        message.getAttachments().forEach(attachment -> attachments.add(attachment.getFilename()));

        int limit = settings.getMaxSignals();
        ObjectNode signalNode = payload.putObject("signals");
        ArrayNode timePhrases = signalNode.putArray("timePhrases");
        signals.getTimePhrases().stream().limit(limit).map(TimePhrase::getRawText).forEach(timePhrases::add);
        ArrayNode links = signalNode.putArray("links");
        signals.getUrls().stream().limit(limit).forEach(links::add);
        ArrayNode money = signalNode.putArray("moneyStrings");
        signals.getMoneyMentions().stream().limit(limit).map(MoneyMention::getRawText).forEach(money::add);

        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize classification payload", e);
        }
    }

    private static String buildSystemPrompt() {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You triage a single email for a busy reader. The user message is a JSON object ")
                .append("describing the email; signals in it were detected mechanically and may be incomplete.\n\n");
        prompt.append("Categories (major_category: when to use it):\n");
        for (MajorCategory category : MajorCategory.values()) {
            prompt.append("- ").append(category.getValue()).append(": ")
                    .append(CATEGORY_HINTS.get(category)).append('\n');
        }
        prompt.append("\nAction keys per category (sub_action_key):\n");
        for (MajorCategory category : MajorCategory.values()) {
            prompt.append("- ").append(category.getValue()).append(": ")
                    .append(String.join(", ", TriageTaxonomy.actionKeysFor(category))).append('\n');
        }
        prompt.append('\n').append(OUTPUT_RULES);
        return prompt.toString();
    }
}
