package com.example.mailtriage.model.mime;

import java.util.List;
import java.util.Map;

/**
 * {@code multipart/*} node. Carries no body of its own.
 */
public final class ContainerNode extends MimeNode {

    private final String subtype;
    private final List<MimeNode> children;

    public ContainerNode(String subtype, Map<String, String> headers, List<MimeNode> children) {
        super(headers);
        this.subtype = subtype;
        this.children = List.copyOf(children);
    }

    /** Lower-cased subtype, e.g. {@code alternative}, {@code mixed}, {@code related}. */
    public String getSubtype() {
        return subtype;
    }

    public List<MimeNode> getChildren() {
        return children;
    }

    public boolean isAlternative() {
        return "alternative".equals(subtype);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitContainer(this);
    }
}
