package com.example.mailtriage.dto.response.triage;

import lombok.Value;

@Value
public class PersonRef {
    public static final String ROLE_SENDER = "sender";

    String email;
    String role;
}
