package com.example.mailtriage.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * High-level semantic bucket of a triaged message. {@link #OTHER} is the fallback.
 */
public enum MajorCategory {
    CORE_COMMUNICATION("core_communication"),
    DECISIONS_AND_APPROVALS("decisions_and_approvals"),
    SCHEDULE_AND_TIME("schedule_and_time"),
    DOCUMENTS_AND_REVIEW("documents_and_review"),
    FINANCIAL_AND_ADMIN("financial_and_admin"),
    PEOPLE_AND_PROCESS("people_and_process"),
    INFORMATION_AND_ORG("information_and_org"),
    LEARNING_AND_AWARENESS("learning_and_awareness"),
    SOCIAL_AND_PEOPLE("social_and_people"),
    META_AND_SYSTEMS("meta_and_systems"),
    OTHER("other");

    private final String value;

    MajorCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<MajorCategory> fromValue(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String key = raw.trim().toLowerCase();
        for (MajorCategory category : values()) {
            if (category.value.equals(key)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
