package com.example.mailtriage.model.mime;

import java.util.Map;

/**
 * A node of the decoded MIME tree: either a {@link ContainerNode} or a {@link LeafNode}.
 * Callers branch through {@link Visitor} so every variant must be handled.
 */
public abstract class MimeNode {

    private final Map<String, String> headers;

    protected MimeNode(Map<String, String> headers) {
        this.headers = headers;
    }

    /** Case-insensitive header lookup; first occurrence wins. */
    public String header(String name) {
        return headers.get(name);
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public abstract <T> T accept(Visitor<T> visitor);

    public interface Visitor<T> {
        T visitContainer(ContainerNode container);

        T visitLeaf(LeafNode leaf);
    }
}
