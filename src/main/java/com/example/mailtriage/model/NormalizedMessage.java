package com.example.mailtriage.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * Decoded view of a provider message. {@code bodyText} never exceeds the configured cap.
 */
@Value
@Builder
public class NormalizedMessage {
    String provider;
    String messageId;
    String threadId;
    @Singular
    List<String> labelIds;

    String senderName;
    String senderEmail;
    @Singular("to")
    List<String> to;
    @Singular("cc")
    List<String> cc;

    String subject;
    String bodyText;
    boolean bodyHtmlPresent;
    boolean bodyTruncated;
    String snippet;

    OffsetDateTime sentAt;
    Instant internalDate;

    @Singular("headerOfInterest")
    Map<String, String> headersOfInterest;
    @Singular
    List<AttachmentInfo> attachments;
}
