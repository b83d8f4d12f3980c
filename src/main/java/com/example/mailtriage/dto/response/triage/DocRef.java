package com.example.mailtriage.dto.response.triage;

import lombok.Value;

@Value
public class DocRef {
    String title;
    String url;
    String type;
}
