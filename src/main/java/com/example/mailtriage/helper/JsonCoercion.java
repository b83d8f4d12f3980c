package com.example.mailtriage.helper;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Explicit, non-throwing conversions from untrusted JSON to Java values.
 * Wrong types coerce to the nearest valid value or to "absent" (null / empty).
 */
public final class JsonCoercion {

    private JsonCoercion() {}

    public static boolean isAbsent(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull();
    }

    /** Scalar as text; objects and arrays are absent. */
    public static String text(JsonNode node) {
        if (isAbsent(node) || node.isContainerNode()) {
            return null;
        }
        return node.isTextual() ? node.textValue() : node.asText();
    }

    public static String trimmedOrNull(JsonNode node) {
        String value = text(node);
        if (value == null) {
            return null;
        }
        value = value.trim();
        return value.isEmpty() ? null : value;
    }

    public static String trimmed(JsonNode node) {
        String value = trimmedOrNull(node);
        return value == null ? "" : value;
    }

    public static boolean bool(JsonNode node) {
        if (isAbsent(node)) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.doubleValue() != 0.0;
        }
        if (node.isTextual()) {
            String value = node.textValue().trim().toLowerCase();
            return value.equals("true") || value.equals("yes") || value.equals("1");
        }
        return false;
    }

    /**
     * Finite number, or null when absent, non-numeric, NaN or infinite.
     */
    public static Double number(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        double value;
        if (node.isNumber()) {
            value = node.doubleValue();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.textValue().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(value) ? value : null;
    }

    public static Integer integer(JsonNode node) {
        Double value = number(node);
        if (value == null || value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            return null;
        }
        return (int) Math.round(value);
    }

    /** Array elements; a lone object counts as a one-element array. */
    public static List<JsonNode> elements(JsonNode node) {
        List<JsonNode> out = new ArrayList<>();
        if (isAbsent(node)) {
            return out;
        }
        if (node.isArray()) {
            node.forEach(out::add);
        } else if (node.isObject()) {
            out.add(node);
        }
        return out;
    }

    /** Non-blank trimmed strings; a lone string counts as a one-element list. */
    public static List<String> stringList(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (isAbsent(node)) {
            return out;
        }
        if (node.isArray()) {
            for (JsonNode element : node) {
                String value = trimmedOrNull(element);
                if (value != null) {
                    out.add(value);
                }
            }
        } else {
            String value = trimmedOrNull(node);
            if (value != null) {
                out.add(value);
            }
        }
        return out;
    }
}
