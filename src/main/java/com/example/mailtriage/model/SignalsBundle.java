package com.example.mailtriage.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Observable mentions found in the body text. Derived only from the message itself.
 */
@Value
@Builder
public class SignalsBundle {
    @Singular
    Set<String> urls;
    @Singular
    List<MoneyMention> moneyMentions;
    @Singular
    List<TimePhrase> timePhrases;

    public static SignalsBundle empty() {
        return SignalsBundle.builder().build();
    }
}
