package com.example.mailtriage.service;

import com.example.mailtriage.config.PipelineSettings;
import com.example.mailtriage.dto.response.triage.DebugInfo;
import com.example.mailtriage.dto.response.triage.PersonRef;
import com.example.mailtriage.dto.response.triage.RecommendedAction;
import com.example.mailtriage.dto.response.triage.TriageOutput;
import com.example.mailtriage.model.ActionKind;
import com.example.mailtriage.model.CandidateOutput;
import com.example.mailtriage.model.MajorCategory;
import com.example.mailtriage.model.NormalizedMessage;
import com.example.mailtriage.model.SignalsBundle;
import com.example.mailtriage.model.TimePhrase;
import com.example.mailtriage.model.TimePhraseType;
import com.example.mailtriage.model.UrgencyLevel;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ResultNormalizer unit tests
 */
class ResultNormalizerTest {

    private static final OffsetDateTime REFERENCE = OffsetDateTime.of(2026, 2, 10, 12, 0, 0, 0, ZoneOffset.UTC);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-10T12:00:05Z"), ZoneOffset.UTC);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final PipelineSettings settings = PipelineSettings.builder()
            .modelVersion("gemini/test-model")
            .defaultZone(ZoneId.of("UTC-8"))
            .build();
    private final ResultNormalizer normalizer = new ResultNormalizer(settings, CLOCK, new DeadlineResolver());

    private final NormalizedMessage message = NormalizedMessage.builder()
            .messageId("msg-1")
            .senderName("Alice")
            .senderEmail("alice@example.com")
            .subject("Re: Fwd: Quarterly planning sync")
            .bodyText("Can we meet tomorrow 3pm to go over the plan?")
            .build();

    private CandidateOutput candidate(String json) throws Exception {
        return CandidateOutput.of(objectMapper.readTree(json));
    }

    private TriageOutput normalize(String json) throws Exception {
        return normalizer.normalize(candidate(json), message, SignalsBundle.empty(), REFERENCE);
    }

    @ParameterizedTest(name = "confidence {0} -> {1}")
    @CsvSource({
            "0.8, 0.8",
            "-0.4, 0.0",
            "1.7, 1.0",
            "'\"0.25\"', 0.25",
            "'\"NaN\"', 0.5",
            "'\"high\"', 0.5",
            "null, 0.5"
    })
    @DisplayName("Confidence is clamped to [0,1], unusable values take the default")
    void testConfidence(String raw, double expected) throws Exception {
        TriageOutput output = normalize("{\"confidence\": " + raw + "}");

        assertThat(output.getConfidence()).isEqualTo(expected);
    }

    @Test
    @DisplayName("Missing confidence takes the default")
    void testMissingConfidence() throws Exception {
        assertThat(normalize("{}").getConfidence()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Unknown category becomes other, unknown key becomes OTHER, keys are upper snake case")
    void testTaxonomy() throws Exception {
        TriageOutput unknown = normalize("{\"major_category\": \"urgent_stuff\", \"sub_action_key\": \"do it now\"}");
        assertThat(unknown.getMajorCategory()).isEqualTo(MajorCategory.OTHER);
        assertThat(unknown.getSubActionKey()).isEqualTo("OTHER");

        TriageOutput known = normalize("{\"major_category\": \"Schedule_And_Time\", \"sub_action_key\": \"schedule-confirm time\"}");
        assertThat(known.getMajorCategory()).isEqualTo(MajorCategory.SCHEDULE_AND_TIME);
        assertThat(known.getSubActionKey()).isEqualTo("SCHEDULE_CONFIRM_TIME");
    }

    @Test
    @DisplayName("Sender is added at the head of people, or gets the sender role when listed without one")
    void testSenderBackfill() throws Exception {
        TriageOutput absent = normalize("{\"entities\": {\"people\": [{\"email\": \"bob@example.com\", \"role\": \"recipient\"}]}}");
        assertThat(absent.getEntities().getPeople()).containsExactly(
                new PersonRef("alice@example.com", PersonRef.ROLE_SENDER),
                new PersonRef("bob@example.com", "recipient"));

        TriageOutput listed = normalize("{\"entities\": {\"people\": [{\"email\": \"ALICE@example.com\"}]}}");
        assertThat(listed.getEntities().getPeople()).containsExactly(
                new PersonRef("ALICE@example.com", PersonRef.ROLE_SENDER));

        TriageOutput noEntities = normalize("{\"entities\": \"garbage\"}");
        assertThat(noEntities.getEntities().getPeople()).extracting(PersonRef::getEmail)
                .containsExactly("alice@example.com");
    }

    @Test
    @DisplayName("Sender listed under another role is given the sender role")
    void testSenderRoleOverridden() throws Exception {
        TriageOutput output = normalize("{\"entities\": {\"people\": [{\"email\": \"bob@example.com\"},"
                + " {\"email\": \"alice@example.com\", \"role\": \"requester\"}]}}");

        assertThat(output.getEntities().getPeople()).containsExactly(
                new PersonRef("bob@example.com", null),
                new PersonRef("alice@example.com", PersonRef.ROLE_SENDER));
    }

    @Test
    @DisplayName("Out of range default confidence is clamped")
    void testDefaultConfidenceClamped() throws Exception {
        ResultNormalizer misconfigured = new ResultNormalizer(
                PipelineSettings.builder().defaultConfidence(1.5).build(), CLOCK, new DeadlineResolver());

        TriageOutput output = misconfigured.normalize(candidate("{}"), message, SignalsBundle.empty(), REFERENCE);

        assertThat(output.getConfidence()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Recommended actions: at most four, stable by rank, re-ranked from 1")
    void testActions() throws Exception {
        TriageOutput output = normalize("{\"recommended_actions\": ["
                + "{\"key\": \"c\", \"label\": \"C\", \"rank\": 3},"
                + "{\"key\": \"a\", \"label\": \"A\", \"rank\": 1, \"kind\": \"primary\"},"
                + "{\"key\": \"b1\", \"label\": \"B1\", \"rank\": 2, \"kind\": \"DANGER\"},"
                + "{\"key\": \"b2\", \"label\": \"B2\", \"rank\": 2},"
                + "{\"key\": \"\", \"label\": \"Open the invoice\", \"rank\": 5},"
                + "{\"key\": \"\", \"label\": \"\", \"rank\": 0},"
                + "{\"key\": \"z\", \"label\": \"Z\", \"kind\": \"weird\"}"
                + "]}");

        assertThat(output.getRecommendedActions()).extracting(RecommendedAction::getKey)
                .containsExactly("a", "b1", "b2", "c");
        assertThat(output.getRecommendedActions()).extracting(RecommendedAction::getRank)
                .containsExactly(1, 2, 3, 4);
        assertThat(output.getRecommendedActions()).extracting(RecommendedAction::getKind)
                .containsExactly(ActionKind.PRIMARY, ActionKind.DANGER, ActionKind.SECONDARY, ActionKind.SECONDARY);
    }

    @Test
    @DisplayName("Action key is derived from the label when blank")
    void testDerivedActionKey() throws Exception {
        TriageOutput output = normalize("{\"recommended_actions\": [{\"label\": \"Open the invoice\", \"rank\": 1}]}");

        assertThat(output.getRecommendedActions().get(0).getKey()).isEqualTo("OPEN_THE_INVOICE");
    }

    @Test
    @DisplayName("Evidence trimmed, collapsed, cut to 240 chars, de-duplicated and capped at three")
    void testEvidence() throws Exception {
        String longSnippet = "x".repeat(300);
        TriageOutput output = normalize("{\"evidence\": [\"  Please   confirm \", \"please confirm\", \"\", \""
                + longSnippet + "\", \"third\", \"fourth\"]}");

        assertThat(output.getEvidence()).containsExactly("Please confirm", "x".repeat(240), "third");
        assertThat(output.getDebug().getFlags()).doesNotContain(DebugInfo.FLAG_EVIDENCE_BELOW_MINIMUM);
    }

    @Test
    @DisplayName("Missing evidence is flagged, never invented")
    void testEvidenceFlag() throws Exception {
        TriageOutput output = normalize("{\"evidence\": []}");

        assertThat(output.getEvidence()).isEmpty();
        assertThat(output.getDebug().getFlags()).containsExactly(DebugInfo.FLAG_EVIDENCE_BELOW_MINIMUM);
    }

    @Test
    @DisplayName("Deadline text resolves to reply_by and feeds the task due date")
    void testDeadline() throws Exception {
        TriageOutput output = normalize("{\"urgency_signals\": {\"urgency\": \"HIGH\", \"deadline_detected\": true,"
                + " \"deadline_text\": \"tomorrow 3pm\", \"reply_by\": \"not a date\"},"
                + " \"task_proposal\": {\"title\": \" Prepare plan \", \"priority\": \"urgent\", \"status\": \"done\"}}");

        assertThat(output.getUrgencySignals().getUrgency()).isEqualTo(UrgencyLevel.HIGH);
        assertThat(output.getUrgencySignals().getReplyBy()).isEqualTo("2026-02-11T15:00:00-08:00");
        assertThat(output.getUrgencySignals().getDeadlineText()).isEqualTo("tomorrow 3pm");
        assertThat(output.getTaskProposal().getTitle()).isEqualTo("Prepare plan");
        assertThat(output.getTaskProposal().getPriority()).isEqualTo(UrgencyLevel.MEDIUM);
        assertThat(output.getTaskProposal().getStatus()).isEqualTo("open");
        assertThat(output.getTaskProposal().getDueAt()).isEqualTo("2026-02-11T15:00:00-08:00");
    }

    @Test
    @DisplayName("Detected deadline without text borrows the first non-recurring time phrase")
    void testDeadlineFromSignals() throws Exception {
        SignalsBundle signals = SignalsBundle.builder()
                .timePhrase(new TimePhrase("every Monday", TimePhraseType.RECURRING))
                .timePhrase(new TimePhrase("tomorrow 3pm", TimePhraseType.RELATIVE))
                .build();

        TriageOutput output = normalizer.normalize(
                candidate("{\"urgency_signals\": {\"deadline_detected\": true}}"), message, signals, REFERENCE);

        assertThat(output.getUrgencySignals().getDeadlineText()).isEqualTo("tomorrow 3pm");
        assertThat(output.getUrgencySignals().getReplyBy()).isEqualTo("2026-02-11T15:00:00-08:00");
    }

    @Test
    @DisplayName("Unresolvable deadline keeps the text and leaves reply_by empty")
    void testUnresolvableDeadline() throws Exception {
        TriageOutput output = normalize("{\"urgency_signals\": {\"deadline_text\": \"whenever you can\"}}");

        assertThat(output.getUrgencySignals().getDeadlineText()).isEqualTo("whenever you can");
        assertThat(output.getUrgencySignals().getReplyBy()).isNull();
        assertThat(output.getUrgencySignals().getUrgency()).isEqualTo(UrgencyLevel.MEDIUM);
    }

    @Test
    @DisplayName("Scheduling output gets a meeting built from subject and first timed date")
    void testMeetingBackfill() throws Exception {
        TriageOutput output = normalize("{\"major_category\": \"schedule_and_time\","
                + " \"sub_action_key\": \"SCHEDULE_CONFIRM_TIME\","
                + " \"entities\": {\"dates\": [{\"text\": \"next week\"}, {\"text\": \"tomorrow 3pm\", \"type\": \"meeting_time\"}]}}");

        assertThat(output.getEntities().getDates()).extracting("iso")
                .containsExactly("2026-02-16", "2026-02-11T15:00:00-08:00");
        assertThat(output.getEntities().getMeeting().getTopic()).isEqualTo("Quarterly planning sync");
        assertThat(output.getEntities().getMeeting().getStartAt()).isEqualTo("2026-02-11T15:00:00-08:00");
        assertThat(output.getEntities().getMeeting().getTz()).isEqualTo("UTC-08:00");
    }

    @Test
    @DisplayName("Bounded lists and debug metadata from configuration")
    void testBoundsAndDebug() throws Exception {
        TriageOutput output = normalize("{\"suggested_reply_action\": [\"Yes\", \"No\", \"Maybe\", \"Later\"],"
                + " \"extracted_summary\": {\"ask\": \" Confirm \", \"missing_info\": [\"a\", \" \", \"b\", \"c\", \"d\"]},"
                + " \"debug\": {\"model_version\": \"spoofed\"}}");

        assertThat(output.getSuggestedReplyAction()).containsExactly("Yes", "No", "Maybe");
        assertThat(output.getExtractedSummary().getAsk()).isEqualTo("Confirm");
        assertThat(output.getExtractedSummary().getMissingInfo()).containsExactly("a", "b", "c");
        assertThat(output.getDebug().getModelVersion()).isEqualTo("gemini/test-model");
        assertThat(output.getDebug().getPromptVersion()).isEqualTo(settings.getPromptVersion());
        assertThat(output.getDebug().getTimestamp()).isEqualTo("2026-02-10T12:00:05+00:00");
    }

    @Test
    @DisplayName("Normalizing a normalized output gives the same output")
    void testIdempotent() throws Exception {
        TriageOutput first = normalize("{\"major_category\": \"schedule_and_time\", \"sub_action_key\": \"schedule confirm time\","
                + " \"explicit_task\": \"yes\", \"confidence\": 1.4,"
                + " \"suggested_reply_action\": [\"Confirm\", \"Decline\", \"Propose another time\", \"Ignore\"],"
                + " \"task_proposal\": {\"type\": \"schedule_meeting\", \"title\": \"Plan sync\", \"priority\": \"high\"},"
                + " \"recommended_actions\": [{\"label\": \"Accept\", \"rank\": 2}, {\"key\": \"decline\", \"label\": \"Decline\", \"rank\": 1, \"kind\": \"danger\"}],"
                + " \"urgency_signals\": {\"urgency\": \"high\", \"deadline_detected\": true, \"deadline_text\": \"tomorrow 3pm\", \"reason\": \" soon \"},"
                + " \"extracted_summary\": {\"ask\": \"Meet\", \"success_criteria\": \"Time agreed\", \"missing_info\": [\"room\"]},"
                + " \"entities\": {\"people\": [{\"email\": \"bob@example.com\"}],"
                + "   \"dates\": [{\"text\": \"tomorrow 3pm\", \"type\": \"meeting_time\"}, {\"text\": \"March 3\"}],"
                + "   \"money\": [{\"text\": \"$40\", \"amount\": \"40\", \"currency\": \"USD\"}],"
                + "   \"docs\": [{\"title\": \"Plan\", \"url\": \"https://example.com/plan\"}]},"
                + " \"evidence\": [\"Can we meet  tomorrow 3pm\", \"CAN WE MEET TOMORROW 3PM\"]}");

        JsonNode serialized = objectMapper.valueToTree(first);
        TriageOutput second = normalizer.normalize(CandidateOutput.of(serialized), message, SignalsBundle.empty(), REFERENCE);

        assertThat(second).isEqualTo(first);
        assertThat(first.getConfidence()).isEqualTo(1.0);
        assertThat(first.isExplicitTask()).isTrue();
        assertThat(first.getRecommendedActions()).extracting(RecommendedAction::getKey).containsExactly("decline", "ACCEPT");
    }

    @Test
    @DisplayName("Fallback output is minimal, low confidence and flagged")
    void testFallback() {
        TriageOutput output = normalizer.fallback(message, SignalsBundle.empty(), REFERENCE, "timeout");

        assertThat(output.getMajorCategory()).isEqualTo(MajorCategory.OTHER);
        assertThat(output.getSubActionKey()).isEqualTo("OTHER");
        assertThat(output.getConfidence()).isEqualTo(0.0);
        assertThat(output.getUrgencySignals().getUrgency()).isEqualTo(UrgencyLevel.LOW);
        assertThat(output.getRecommendedActions()).isEmpty();
        assertThat(output.getEvidence()).isEmpty();
        assertThat(output.getTaskProposal()).isNull();
        assertThat(output.getEntities().getPeople()).containsExactly(new PersonRef("alice@example.com", PersonRef.ROLE_SENDER));
        assertThat(output.getDebug().getModelVersion()).isEqualTo("fallback");
        assertThat(output.getDebug().getFlags()).contains(DebugInfo.FLAG_CLASSIFICATION_FALLBACK);
    }

    @Test
    @DisplayName("Non-object candidate is treated as empty")
    void testNonObjectCandidate() throws Exception {
        TriageOutput output = normalize("[1, 2, 3]");

        assertThat(output.getMajorCategory()).isEqualTo(MajorCategory.OTHER);
        assertThat(output.getConfidence()).isEqualTo(0.5);
        assertThat(output.getEntities().getPeople()).hasSize(1);
    }
}
