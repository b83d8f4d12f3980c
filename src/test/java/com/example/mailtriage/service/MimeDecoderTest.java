package com.example.mailtriage.service;

import com.example.mailtriage.config.PipelineSettings;
import com.example.mailtriage.dto.request.mail.Message;
import com.example.mailtriage.dto.request.mail.MessagePart;
import com.example.mailtriage.dto.request.mail.MessagePartBody;
import com.example.mailtriage.model.NormalizedMessage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import static com.example.mailtriage.MailFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

/**
 * MimeDecoder unit tests
 */
class MimeDecoderTest {

    private final MimeDecoder decoder = new MimeDecoder(PipelineSettings.builder().build());

    @Test
    @DisplayName("multipart/alternative prefers the text/plain child")
    void testAlternativePrefersPlain() {
        Message message = message("m1",
                multipart("alternative",
                        textPart("text/plain", "Plain version of the mail"),
                        textPart("text/html", "<p>HTML version</p>")),
                header("From", "Alice <alice@example.com>"),
                header("Subject", "Hello"));

        NormalizedMessage decoded = decoder.decode(message);

        assertThat(decoded.getBodyText()).isEqualTo("Plain version of the mail");
        assertThat(decoded.isBodyHtmlPresent()).isTrue();
        assertThat(decoded.isBodyTruncated()).isFalse();
    }

    @Test
    @DisplayName("HTML-only message is reduced to visible text")
    void testHtmlOnly() {
        Message message = message("m2",
                multipart("alternative",
                        textPart("text/html", "<html><head><style>p{}</style></head>"
                                + "<body><p>Hello</p><script>alert(1)</script><p>World &amp; co</p></body></html>")));

        NormalizedMessage decoded = decoder.decode(message);

        assertThat(decoded.getBodyText()).isEqualTo("Hello\nWorld & co");
        assertThat(decoded.isBodyHtmlPresent()).isTrue();
    }

    @Test
    @DisplayName("Invalid base64url leaf decodes to an empty body without failing")
    void testInvalidBase64() {
        Message message = message("m3",
                multipart("mixed",
                        rawPart("text/plain", "@@@ not base64 @@@"),
                        textPart("text/plain", "Readable part")));

        NormalizedMessage decoded = decoder.decode(message);

        assertThat(decoded.getBodyText()).isEqualTo("Readable part");
    }

    @Test
    @DisplayName("Single corrupt leaf gives an empty body")
    void testOnlyCorruptLeaf() {
        Message message = message("m4", rawPart("text/plain", "abcde"));

        assertThat(decoder.decode(message).getBodyText()).isEmpty();
    }

    @Test
    @DisplayName("Missing payload and empty message never throw")
    void testMissingPayload() {
        assertThatCode(() -> decoder.decode(new Message())).doesNotThrowAnyException();
        assertThatCode(() -> decoder.decode(null)).doesNotThrowAnyException();

        NormalizedMessage decoded = decoder.decode(new Message());
        assertThat(decoded.getBodyText()).isEmpty();
        assertThat(decoded.getSubject()).isEmpty();
        assertThat(decoded.getProvider()).isEqualTo("gmail");
        assertThat(decoded.getSenderEmail()).isNull();
    }

    @Test
    @DisplayName("Encoded-word subject and address headers are decoded")
    void testHeaders() {
        String encodedSubject = "=?UTF-8?B?" + Base64.getEncoder()
                .encodeToString("Café meeting".getBytes(StandardCharsets.UTF_8)) + "?=";
        Message message = message("m5", textPart("text/plain", "body"),
                header("FROM", "\"Example, Alice\" <Alice@Example.com>"),
                header("To", "bob@example.com, Carol <carol@example.com>"),
                header("Cc", "dave@example.com"),
                header("Subject", encodedSubject),
                header("Subject", "ignored duplicate"),
                header("Date", "Tue, 10 Feb 2026 12:00:00 +0000 (UTC)"));

        NormalizedMessage decoded = decoder.decode(message);

        assertThat(decoded.getSubject()).isEqualTo("Café meeting");
        assertThat(decoded.getSenderName()).isEqualTo("Example, Alice");
        assertThat(decoded.getSenderEmail()).isEqualTo("Alice@Example.com");
        assertThat(decoded.getTo()).containsExactly("bob@example.com", "carol@example.com");
        assertThat(decoded.getCc()).containsExactly("dave@example.com");
        assertThat(decoded.getSentAt()).isEqualTo(OffsetDateTime.of(2026, 2, 10, 12, 0, 0, 0, ZoneOffset.UTC));
        assertThat(decoded.getInternalDate()).isEqualTo(Instant.ofEpochMilli(1770724800000L));
        assertThat(decoded.getHeadersOfInterest()).containsKeys("From", "Subject", "Date");
    }

    @Test
    @DisplayName("Unparseable Date header leaves sentAt empty")
    void testBadDate() {
        Message message = message("m6", textPart("text/plain", "body"), header("Date", "sometime soon"));

        assertThat(decoder.decode(message).getSentAt()).isNull();
    }

    @Test
    @DisplayName("Lenient Date header keeps the sender's offset")
    void testLenientDateKeepsOffset() {
        Message message = message("m6b", textPart("text/plain", "body"),
                header("Date", "Tue, 10 Feb 2026 9:30:00 -0500"));

        assertThat(decoder.decode(message).getSentAt())
                .isEqualTo(OffsetDateTime.of(2026, 2, 10, 9, 30, 0, 0, ZoneOffset.ofHours(-5)));
    }

    @Test
    @DisplayName("Malformed encoded-word subject keeps the raw header text")
    void testMalformedEncodedSubject() {
        Message message = message("m6c", textPart("text/plain", "body"), header("Subject", "=?utf-8?B?@@@?="));

        assertThat(decoder.decode(message).getSubject()).isEqualTo("=?utf-8?B?@@@?=");
    }

    @Test
    @DisplayName("Attachments are listed and excluded from the body")
    void testAttachments() {
        Message message = message("m7",
                multipart("mixed",
                        textPart("text/plain", "Invoice attached"),
                        attachment("invoice.pdf", "application/pdf", "att-1", 2048)));

        NormalizedMessage decoded = decoder.decode(message);

        assertThat(decoded.getBodyText()).isEqualTo("Invoice attached");
        assertThat(decoded.getAttachments()).hasSize(1);
        assertThat(decoded.getAttachments().get(0).getFilename()).isEqualTo("invoice.pdf");
        assertThat(decoded.getAttachments().get(0).getAttachmentId()).isEqualTo("att-1");
        assertThat(decoded.getAttachments().get(0).getSize()).isEqualTo(2048);
    }

    @Test
    @DisplayName("Quoted-printable body with a declared charset")
    void testQuotedPrintable() {
        MessagePart part = MessagePart.builder()
                .mimeType("text/plain")
                .headers(new ArrayList<>(List.of(header("Content-Type", "text/plain; charset=\"utf-8\""))))
                .body(MessagePartBody.builder().encoding("quoted-printable").data("Caf=C3=A9 =\r\nrocks").build())
                .build();

        assertThat(decoder.decode(message("m8", part)).getBodyText()).isEqualTo("Café rocks");
    }

    @Test
    @DisplayName("Nested multiparts are walked depth-first")
    void testNested() {
        Message message = message("m9",
                multipart("mixed",
                        multipart("related",
                                multipart("alternative",
                                        textPart("text/plain", "First"),
                                        textPart("text/html", "<b>First</b>"))),
                        textPart("text/plain", "Second")));

        assertThat(decoder.decode(message).getBodyText()).isEqualTo("First\n\nSecond");
    }

    @Test
    @DisplayName("Body cap counts the marker and never splits a surrogate pair")
    void testTruncationAtSurrogate() {
        MimeDecoder capped = new MimeDecoder(PipelineSettings.builder().maxBodyChars(30).build());
        String body = "a".repeat(16) + "😀" + "b".repeat(50);

        NormalizedMessage decoded = capped.decode(message("m10", textPart("text/plain", body)));

        assertThat(decoded.getBodyText().length()).isLessThanOrEqualTo(30);
        assertThat(decoded.getBodyText()).endsWith("[TRUNCATED]");
        assertThat(decoded.getBodyText().codePoints()).noneMatch(cp -> cp >= 0xD800 && cp <= 0xDFFF);
        assertThat(decoded.isBodyTruncated()).isTrue();
    }

    @Test
    @DisplayName("Truncate helper")
    void testTruncate() {
        assertThat(MimeDecoder.truncate("short", 100)).isEqualTo("short");
        assertThat(MimeDecoder.truncate("x".repeat(200), 50)).hasSize(50).endsWith(MimeDecoder.TRUNCATION_MARKER);
        assertThat(MimeDecoder.truncate("x".repeat(200), 5)).isEqualTo("xxxxx");
        assertThat(MimeDecoder.truncate("x".repeat(200), 0)).isEmpty();
    }
}
