package com.example.mailtriage.dto.request.mail;

import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level =  AccessLevel.PRIVATE)
public class MessagePartBody {
    Integer size;
    String data;          // base64 url-safe unless encoding says otherwise
    String attachmentId;
    String encoding;
}
