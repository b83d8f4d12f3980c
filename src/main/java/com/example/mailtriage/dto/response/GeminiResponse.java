package com.example.mailtriage.dto.response;

import lombok.Data;

import java.util.List;

@Data
public class GeminiResponse {

    private List<Candidate> candidates;
    private String modelVersion;
    private UsageMetadata usageMetadata;

    /**
     * Concatenated text of the first candidate, or null when there is none.
     */
    public String getText() {
        if (candidates == null || candidates.isEmpty()) return null;
        Candidate first = candidates.get(0);
        if (first == null || first.content == null) return null;
        if (first.content.parts == null || first.content.parts.isEmpty()) return null;

        StringBuilder text = new StringBuilder();
        for (Part part : first.content.parts) {
            if (part != null && part.text != null) {
                text.append(part.text);
            }
        }
        return text.length() == 0 ? null : text.toString();
    }

    @Data
    public static class Candidate {
        private Content content;
        private String finishReason;
    }

    @Data
    public static class Content {
        private List<Part> parts;
    }

    @Data
    public static class Part {
        private String text;
    }

    @Data
    public static class UsageMetadata {
        private Integer promptTokenCount;
        private Integer candidatesTokenCount;
        private Integer totalTokenCount;
    }
}
