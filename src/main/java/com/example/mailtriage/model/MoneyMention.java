package com.example.mailtriage.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class MoneyMention {
    String rawText;
    String currency;   // ISO 4217, null when ambiguous
    BigDecimal amount;
}
