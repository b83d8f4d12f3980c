package com.example.mailtriage.dto.response.triage;

import lombok.Value;

@Value
public class MoneyRef {
    String text;
    Double amount;
    String currency;
}
