package com.example.mailtriage.model.mime;

import lombok.Getter;

import java.util.Map;

@Getter
public final class LeafNode extends MimeNode {

    private final String mimeType;
    private final String filename;
    private final String encoding;
    private final String data;
    private final String attachmentId;
    private final Integer size;

    public LeafNode(String mimeType, Map<String, String> headers, String filename, String encoding,
                    String data, String attachmentId, Integer size) {
        super(headers);
        this.mimeType = mimeType;
        this.filename = filename;
        this.encoding = encoding;
        this.data = data;
        this.attachmentId = attachmentId;
        this.size = size;
    }

    /**
     * Attachment disposition, or a named file part.
     */
    public boolean isAttachment() {
        String disposition = header("Content-Disposition");
        if (disposition != null && disposition.trim().toLowerCase().startsWith("attachment")) {
            return true;
        }
        return filename != null && !filename.isBlank();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitLeaf(this);
    }
}
