package com.example.mailtriage.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Shared scale for urgency and task priority.
 */
public enum UrgencyLevel {
    LOW, MEDIUM, HIGH, CRITICAL;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }

    public static UrgencyLevel fromValue(String raw, UrgencyLevel fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return valueOf(raw.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
