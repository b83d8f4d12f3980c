package com.example.mailtriage.model;

public enum ActionKind {
    PRIMARY, SECONDARY, DANGER;

    public static ActionKind fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return SECONDARY;
        }
        try {
            return valueOf(raw.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return SECONDARY;
        }
    }
}
