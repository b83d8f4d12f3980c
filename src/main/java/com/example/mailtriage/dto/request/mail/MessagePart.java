package com.example.mailtriage.dto.request.mail;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level =  AccessLevel.PRIVATE)
public class MessagePart {
    String partId;
    String mimeType;
    String filename;
    MessagePartBody body;
    List<MessagePartHeader> headers;
    List<MessagePart> parts;
}
