package com.example.mailtriage.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.Value;

/**
 * Raw structured output of the classification step. Nothing in it is trusted:
 * fields may be missing, mistyped or out of range.
 */
@Value
public class CandidateOutput {
    JsonNode root;

    public static CandidateOutput of(JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return empty();
        }
        return new CandidateOutput(root);
    }

    public static CandidateOutput empty() {
        return new CandidateOutput(JsonNodeFactory.instance.objectNode());
    }

    public JsonNode path(String field) {
        return root.isObject() ? root.path(field) : MissingNode.getInstance();
    }
}
