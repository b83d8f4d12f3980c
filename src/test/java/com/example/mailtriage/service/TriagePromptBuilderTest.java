package com.example.mailtriage.service;

import com.example.mailtriage.config.PipelineSettings;
import com.example.mailtriage.model.MajorCategory;
import com.example.mailtriage.model.MoneyMention;
import com.example.mailtriage.model.NormalizedMessage;
import com.example.mailtriage.model.SignalsBundle;
import com.example.mailtriage.model.TimePhrase;
import com.example.mailtriage.model.TimePhraseType;
import com.example.mailtriage.model.TriageTaxonomy;
import com.example.mailtriage.service.gateway.ClassificationRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class TriagePromptBuilderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final TriagePromptBuilder builder =
            new TriagePromptBuilder(objectMapper, PipelineSettings.builder().maxSignals(2).build());

    @Test
    @DisplayName("System prompt lists every category and action key")
    void testSystemPrompt() {
        String prompt = builder.getSystemPrompt();

        for (MajorCategory category : MajorCategory.values()) {
            assertThat(prompt).contains(category.getValue());
        }
        assertThat(prompt).contains(TriageTaxonomy.allActionKeys());
    }

    @Test
    @DisplayName("User content is JSON with the message fields and capped signals")
    void testUserContent() throws Exception {
        NormalizedMessage message = NormalizedMessage.builder()
                .provider("gmail")
                .messageId("msg-1")
                .subject("Invoice")
                .senderName("Alice")
                .senderEmail("alice@example.com")
                .to("bob@example.com")
                .bodyText("Pay $40 by tomorrow")
                .build();
        SignalsBundle signals = SignalsBundle.builder()
                .url("https://a.example").url("https://b.example").url("https://c.example")
                .moneyMention(MoneyMention.builder().rawText("$40").currency("USD").amount(new BigDecimal("40")).build())
                .timePhrase(new TimePhrase("by tomorrow", TimePhraseType.RELATIVE))
                .build();

        ClassificationRequest request = builder.build(message, signals);
        JsonNode content = objectMapper.readTree(request.getUserContent());

        assertThat(request.getMessageId()).isEqualTo("msg-1");
        assertThat(content.path("subject").asText()).isEqualTo("Invoice");
        assertThat(content.at("/from/email").asText()).isEqualTo("alice@example.com");
        assertThat(content.at("/to/0").asText()).isEqualTo("bob@example.com");
        assertThat(content.path("sentAt").isNull()).isTrue();
        assertThat(content.at("/signals/links")).hasSize(2);
        assertThat(content.at("/signals/moneyStrings/0").asText()).isEqualTo("$40");
        assertThat(content.at("/signals/timePhrases/0").asText()).isEqualTo("by tomorrow");
    }
}
