package com.example.mailtriage.dto.response.triage;

import lombok.Value;

@Value
public class DateRef {
    String text;
    String iso;
    String type;
}
