package com.example.mailtriage.dto.request.mail;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level =  AccessLevel.PRIVATE)
public class Message {
    String provider;
    String id;
    String threadId;
    List<String> labelIds;
    String snippet;
    String historyId;
    String internalDate;  // epoch millis
    Long sizeEstimate;
    MessagePart payload;
}
