package com.example.mailtriage.helper;

import org.springframework.web.util.HtmlUtils;

import java.util.regex.Pattern;

/**
 * HTML to plain text for mail bodies: scripts and styles dropped, block
 * boundaries kept as single newlines, entities unescaped, whitespace collapsed.
 */
public final class HtmlTextReducer {

    private static final Pattern COMMENTS = Pattern.compile("(?s)<!--.*?(-->|$)");
    private static final Pattern HIDDEN_BLOCKS =
            Pattern.compile("(?is)<(script|style|noscript|head|title|template)\\b[^>]*>.*?</\\1\\s*>");
    private static final Pattern UNTERMINATED_HIDDEN_BLOCK =
            Pattern.compile("(?is)<(script|style)\\b[^>]*>.*$");
    private static final Pattern BLOCK_BOUNDARIES = Pattern.compile(
            "(?i)<\\s*/?\\s*(br|p|div|li|tr|h[1-6]|table|ul|ol|blockquote|hr|section|article|header|footer|pre)\\b[^>]*>");
    private static final Pattern TAGS = Pattern.compile("(?s)<[^>]*>");

    private static final Pattern INLINE_WHITESPACE = Pattern.compile("[ \\t\\x0B\\f\\u00A0\\u200B]+");
    private static final Pattern LINE_BREAKS = Pattern.compile("\\r\\n?");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n{2,}");

    private HtmlTextReducer() {}

    public static String reduce(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        String text = COMMENTS.matcher(html).replaceAll(" ");
        text = HIDDEN_BLOCKS.matcher(text).replaceAll(" ");
        text = UNTERMINATED_HIDDEN_BLOCK.matcher(text).replaceAll(" ");
        text = BLOCK_BOUNDARIES.matcher(text).replaceAll("\n");
        text = TAGS.matcher(text).replaceAll("");
        text = HtmlUtils.htmlUnescape(text);
        return collapseWhitespace(text);
    }

    /**
     * Collapses runs of spaces, trims every line and folds blank lines into single newlines.
     */
    public static String collapseWhitespace(String text) {
        String normalized = LINE_BREAKS.matcher(text).replaceAll("\n");
        normalized = INLINE_WHITESPACE.matcher(normalized).replaceAll(" ");
        StringBuilder out = new StringBuilder(normalized.length());
        for (String line : normalized.split("\n", -1)) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append(trimmed);
        }
        return BLANK_LINES.matcher(out).replaceAll("\n");
    }
}
