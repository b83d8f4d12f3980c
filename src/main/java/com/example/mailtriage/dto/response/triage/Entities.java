package com.example.mailtriage.dto.response.triage;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class Entities {
    List<PersonRef> people;
    List<DateRef> dates;
    List<MoneyRef> money;
    List<DocRef> docs;
    MeetingRef meeting;
}
