package com.example.mailtriage.service;

import com.example.mailtriage.config.PipelineSettings;
import com.example.mailtriage.dto.request.mail.Message;
import com.example.mailtriage.dto.request.mail.MessagePart;
import com.example.mailtriage.dto.request.mail.MessagePartBody;
import com.example.mailtriage.dto.request.mail.MessagePartHeader;
import com.example.mailtriage.helper.HtmlTextReducer;
import com.example.mailtriage.model.AttachmentInfo;
import com.example.mailtriage.model.NormalizedMessage;
import com.example.mailtriage.model.mime.ContainerNode;
import com.example.mailtriage.model.mime.LeafNode;
import com.example.mailtriage.model.mime.MimeNode;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MailDateFormat;
import jakarta.mail.internet.MimeUtility;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a provider message (nested MIME payload, base64url bodies) into a {@link NormalizedMessage}.
 * Never throws: corrupt parts degrade to empty bodies.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MimeDecoder {

    static final String TRUNCATION_MARKER = "\n\n[TRUNCATED]";

    private static final int MAX_DEPTH = 256;
    private static final List<String> HEADERS_OF_INTEREST = List.of(
            "From", "To", "Cc", "Subject", "Date", "Reply-To", "Message-ID", "In-Reply-To", "List-Unsubscribe");

    private static final Pattern CHARSET = Pattern.compile("(?i)charset\\s*=\\s*\"?([^\";\\s]+)\"?");
    private static final Pattern FOLDED_LINE = Pattern.compile("\\r?\\n[ \\t]+");
    private static final Pattern DATE_COMMENT = Pattern.compile("\\s*\\([^)]*\\)\\s*$");
    private static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+'-]+@[A-Za-z0-9-]+(?:\\.[A-Za-z0-9-]+)+");
    private static final Pattern NUMERIC_ZONE = Pattern.compile("(?<![\\d:])([+-])(\\d{2})(\\d{2})\\b");
    private static final Pattern BASE64_WHITESPACE = Pattern.compile("\\s+");

    private final PipelineSettings settings;

    public NormalizedMessage decode(Message raw) {
        String messageId = raw != null ? raw.getId() : null;
        MimeNode root = toNode(raw != null ? raw.getPayload() : null, 0);

        List<AttachmentInfo> attachments = new ArrayList<>();
        BodyContribution body = root.accept(new BodyCollector(messageId, attachments));

        String bodyText;
        if (!body.plain.isEmpty()) {
            bodyText = String.join("\n\n", body.plain).strip();
        } else if (!body.html.isEmpty()) {
            bodyText = HtmlTextReducer.reduce(String.join("\n", body.html));
        } else {
            bodyText = "";
        }
        int cap = Math.max(0, settings.getMaxBodyChars());
        String cappedBody = truncate(bodyText, cap);

        NormalizedMessage.NormalizedMessageBuilder builder = NormalizedMessage.builder()
                .provider(raw != null && raw.getProvider() != null ? raw.getProvider() : "gmail")
                .messageId(messageId)
                .threadId(raw != null ? raw.getThreadId() : null)
                .subject(decodeHeaderText(root.header("Subject")))
                .bodyText(cappedBody)
                .bodyHtmlPresent(!body.html.isEmpty())
                .bodyTruncated(cappedBody.length() < bodyText.length())
                .snippet(raw != null && raw.getSnippet() != null ? HtmlUtils.htmlUnescape(raw.getSnippet()).strip() : "")
                .sentAt(parseDateHeader(root.header("Date")))
                .internalDate(parseInternalDate(raw != null ? raw.getInternalDate() : null))
                .attachments(attachments);

        if (raw != null && raw.getLabelIds() != null) {
            raw.getLabelIds().stream().filter(label -> label != null).forEach(builder::labelId);
        }

        List<InternetAddress> from = parseAddresses(root.header("From"));
        if (!from.isEmpty()) {
            InternetAddress sender = from.get(0);
            builder.senderEmail(sender.getAddress());
            builder.senderName(blankToNull(sender.getPersonal()));
        }
        parseAddresses(root.header("To")).forEach(address -> builder.to(address.getAddress()));
        parseAddresses(root.header("Cc")).forEach(address -> builder.cc(address.getAddress()));

        for (String name : HEADERS_OF_INTEREST) {
            String value = root.header(name);
            if (value != null) {
                builder.headerOfInterest(name, unfold(value));
            }
        }

        NormalizedMessage message = builder.build();
        log.debug("Decoded message {}: bodyChars={} html={} truncated={} attachments={}",
                messageId, cappedBody.length(), message.isBodyHtmlPresent(), message.isBodyTruncated(),
                attachments.size());
        return message;
    }

    /**
     * Cuts {@code text} to at most {@code cap} chars, marker included, without splitting a surrogate pair.
     */
    static String truncate(String text, int cap) {
        if (text.length() <= cap) {
            return text;
        }
        String marker = TRUNCATION_MARKER;
        int keep = cap - marker.length();
        if (keep <= 0) {
            marker = "";
            keep = cap;
        }
        if (keep > 0 && Character.isHighSurrogate(text.charAt(keep - 1))) {
            keep--;
        }
        return text.substring(0, keep).stripTrailing() + marker;
    }

    private MimeNode toNode(MessagePart part, int depth) {
        if (part == null) {
            return new LeafNode("text/plain", Collections.emptyMap(), null, null, null, null, null);
        }
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (part.getHeaders() != null) {
            for (MessagePartHeader header : part.getHeaders()) {
                if (header != null && header.getName() != null && header.getValue() != null) {
                    headers.putIfAbsent(header.getName().trim(), header.getValue());
                }
            }
        }
        String mimeType = resolveMimeType(part, headers);
        List<MessagePart> parts = part.getParts();
        boolean hasChildren = parts != null && !parts.isEmpty();

        if (mimeType.startsWith("multipart/") || hasChildren) {
            String subtype = mimeType.startsWith("multipart/") ? mimeType.substring("multipart/".length()) : "mixed";
            List<MimeNode> children = new ArrayList<>();
            if (hasChildren && depth < MAX_DEPTH) {
                for (MessagePart child : parts) {
                    children.add(toNode(child, depth + 1));
                }
            } else if (hasChildren) {
                log.warn("MIME tree deeper than {} levels, ignoring nested parts below partId={}", MAX_DEPTH, part.getPartId());
            }
            return new ContainerNode(subtype, headers, children);
        }

        MessagePartBody body = part.getBody();
        return new LeafNode(
                mimeType,
                headers,
                part.getFilename(),
                body != null ? body.getEncoding() : null,
                body != null ? body.getData() : null,
                body != null ? body.getAttachmentId() : null,
                body != null ? body.getSize() : null);
    }

    private String resolveMimeType(MessagePart part, Map<String, String> headers) {
        String mimeType = part.getMimeType();
        if (mimeType == null || mimeType.isBlank()) {
            String contentType = headers.get("Content-Type");
            mimeType = contentType != null ? contentType.split(";", 2)[0] : "text/plain";
        }
        return mimeType.trim().toLowerCase();
    }

    private String decodeLeafText(LeafNode leaf, String messageId) {
        String data = leaf.getData();
        if (data == null || data.isEmpty()) {
            return "";
        }
        String encoding = leaf.getEncoding() == null ? "base64url" : leaf.getEncoding().trim().toLowerCase();
        switch (encoding) {
            case "base64url":
            case "base64":
                try {
                    return new String(decodeBase64(data), resolveCharset(leaf));
                } catch (IllegalArgumentException e) {
                    log.debug("Invalid base64 body in message {} ({}), treating as empty: {}",
                            messageId, leaf.getMimeType(), e.getMessage());
                    return "";
                }
            case "quoted-printable":
                try (InputStream decoded = MimeUtility.decode(
                        new ByteArrayInputStream(data.getBytes(StandardCharsets.ISO_8859_1)), "quoted-printable")) {
                    return new String(decoded.readAllBytes(), resolveCharset(leaf));
                } catch (MessagingException | IOException e) {
                    log.debug("Invalid quoted-printable body in message {} ({}), treating as empty: {}",
                            messageId, leaf.getMimeType(), e.getMessage());
                    return "";
                }
            case "7bit":
            case "8bit":
            case "binary":
                return data;
            default:
                log.debug("Unknown body encoding '{}' in message {}, using data as-is", encoding, messageId);
                return data;
        }
    }

    private byte[] decodeBase64(String data) {
        String compact = BASE64_WHITESPACE.matcher(data).replaceAll("");
        if (compact.indexOf('+') >= 0 || compact.indexOf('/') >= 0) {
            return Base64.getDecoder().decode(compact);
        }
        return Base64.getUrlDecoder().decode(compact);
    }

    private Charset resolveCharset(LeafNode leaf) {
        String contentType = leaf.header("Content-Type");
        if (contentType != null) {
            Matcher matcher = CHARSET.matcher(contentType);
            if (matcher.find()) {
                try {
                    String javaName = MimeUtility.javaCharset(matcher.group(1));
                    if (Charset.isSupported(javaName)) {
                        return Charset.forName(javaName);
                    }
                } catch (IllegalArgumentException e) {
                    log.debug("Unusable charset in '{}': {}", contentType, e.getMessage());
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    private String decodeHeaderText(String value) {
        if (value == null) {
            return "";
        }
        String unfolded = unfold(value);
        try {
            String decoded = MimeUtility.decodeText(unfolded).strip();
            return decoded.isEmpty() ? unfolded.strip() : decoded;
        } catch (UnsupportedEncodingException e) {
            log.debug("Undecodable encoded-word header '{}': {}", unfolded, e.getMessage());
            return unfolded.strip();
        }
    }

    private List<InternetAddress> parseAddresses(String value) {
        List<InternetAddress> out = new ArrayList<>();
        if (value == null || value.isBlank()) {
            return out;
        }
        String unfolded = unfold(value);
        try {
            for (InternetAddress address : InternetAddress.parseHeader(unfolded, false)) {
                if (address.getAddress() != null && !address.getAddress().isBlank()) {
                    out.add(address);
                }
            }
            return out;
        } catch (AddressException e) {
            log.debug("Malformed address header '{}', falling back to scan: {}", unfolded, e.getMessage());
        }
        Matcher matcher = EMAIL.matcher(unfolded);
        while (matcher.find()) {
            InternetAddress address = new InternetAddress();
            address.setAddress(matcher.group());
            out.add(address);
        }
        return out;
    }

    private OffsetDateTime parseDateHeader(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String cleaned = DATE_COMMENT.matcher(unfold(value).trim()).replaceAll("");
        try {
            return OffsetDateTime.parse(cleaned, DateTimeFormatter.RFC_1123_DATE_TIME);
        } catch (DateTimeParseException e) {
            log.trace("Date header '{}' is not RFC 1123, trying lenient parse", cleaned);
        }
        try {
            return new MailDateFormat().parse(cleaned).toInstant().atOffset(headerOffset(cleaned));
        } catch (ParseException e) {
            log.debug("Unparseable Date header '{}'", value);
            return null;
        }
    }

    /**
     * Numeric zone of a Date header; UTC when the header names its zone ("EST", "GMT") or has none.
     */
    private static ZoneOffset headerOffset(String value) {
        ZoneOffset offset = ZoneOffset.UTC;
        Matcher matcher = NUMERIC_ZONE.matcher(value);
        while (matcher.find()) {
            int sign = "-".equals(matcher.group(1)) ? -1 : 1;
            try {
                offset = ZoneOffset.ofHoursMinutes(sign * Integer.parseInt(matcher.group(2)),
                        sign * Integer.parseInt(matcher.group(3)));
            } catch (DateTimeException e) {
                log.debug("Out of range zone '{}' in Date header", matcher.group());
                offset = ZoneOffset.UTC;
            }
        }
        return offset;
    }

    private Instant parseInternalDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.ofEpochMilli(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            log.debug("Unparseable internalDate '{}'", value);
            return null;
        }
    }

    private static String unfold(String value) {
        return FOLDED_LINE.matcher(value).replaceAll(" ");
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }

    private static final class BodyContribution {
        static final BodyContribution EMPTY = new BodyContribution(List.of(), List.of());

        final List<String> plain;
        final List<String> html;

        BodyContribution(List<String> plain, List<String> html) {
            this.plain = plain;
            this.html = html;
        }
    }

    /**
     * Depth-first text collection. Alternatives keep only the best rendering;
     * every other container concatenates its children in order.
     */
    private final class BodyCollector implements MimeNode.Visitor<BodyContribution> {
        private final String messageId;
        private final List<AttachmentInfo> attachments;

        BodyCollector(String messageId, List<AttachmentInfo> attachments) {
            this.messageId = messageId;
            this.attachments = attachments;
        }

        @Override
        public BodyContribution visitContainer(ContainerNode container) {
            List<BodyContribution> contributions = new ArrayList<>();
            for (MimeNode child : container.getChildren()) {
                contributions.add(child.accept(this));
            }
            if (container.isAlternative()) {
                BodyContribution bestPlain = BodyContribution.EMPTY;
                BodyContribution bestHtml = BodyContribution.EMPTY;
                for (BodyContribution contribution : contributions) {
                    if (!contribution.plain.isEmpty()) {
                        bestPlain = contribution;
                    }
                    if (!contribution.html.isEmpty()) {
                        bestHtml = contribution;
                    }
                }
                return new BodyContribution(bestPlain.plain, bestHtml.html);
            }
            List<String> plain = new ArrayList<>();
            List<String> html = new ArrayList<>();
            for (BodyContribution contribution : contributions) {
                plain.addAll(contribution.plain);
                html.addAll(contribution.html);
            }
            return new BodyContribution(plain, html);
        }

        @Override
        public BodyContribution visitLeaf(LeafNode leaf) {
            if (leaf.isAttachment()) {
                attachments.add(AttachmentInfo.builder()
                        .filename(leaf.getFilename())
                        .mimeType(leaf.getMimeType())
                        .attachmentId(leaf.getAttachmentId())
                        .size(leaf.getSize())
                        .build());
                return BodyContribution.EMPTY;
            }
            switch (leaf.getMimeType()) {
                case "text/plain": {
                    String text = decodeLeafText(leaf, messageId);
                    return text.isBlank() ? BodyContribution.EMPTY : new BodyContribution(List.of(text), List.of());
                }
                case "text/html": {
                    String html = decodeLeafText(leaf, messageId);
                    return html.isBlank() ? BodyContribution.EMPTY : new BodyContribution(List.of(), List.of(html));
                }
                default:
                    return BodyContribution.EMPTY;
            }
        }
    }
}
