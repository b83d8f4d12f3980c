package com.example.mailtriage.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AttachmentInfo {
    String filename;
    String mimeType;
    String attachmentId;
    Integer size;
}
