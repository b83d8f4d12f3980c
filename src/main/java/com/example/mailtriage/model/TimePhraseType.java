package com.example.mailtriage.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TimePhraseType {
    ABSOLUTE, RELATIVE, RECURRING;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
