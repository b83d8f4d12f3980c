package com.example.mailtriage.model;

import lombok.Value;

@Value
public class TimePhrase {
    String rawText;
    TimePhraseType type;
}
