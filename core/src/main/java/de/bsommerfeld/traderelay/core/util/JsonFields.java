package de.bsommerfeld.traderelay.core.util;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Lenient field access on upstream JSON. The dashboard API and its consumers
 * have disagreed on key spelling ({@code open_count} vs.
 * {@code openPositions}), so every lookup accepts a list of aliases and
 * takes the first one that carries a non-null value.
 */
public final class JsonFields {

    private JsonFields() {
    }

    /** First present, non-null member among {@code keys}, or {@code null}. */
    public static JsonNode first(JsonNode node, String... keys) {
        if (node == null || !node.isObject()) {
            return null;
        }
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value != null && !value.isNull() && !value.isMissingNode()) {
                return value;
            }
        }
        return null;
    }

    /**
     * Text rendering of the first matching member, or {@code fallback}.
     * Floating-point values are always written in plain decimal notation.
     */
    public static String text(JsonNode node, String fallback, String... keys) {
        JsonNode value = first(node, keys);
        if (value == null) {
            return fallback;
        }
        if (value.isFloatingPointNumber()) {
            return plainDecimal(value);
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }

    /** {@code 5.0E-4} becomes {@code 0.0005}, {@code 1.25E7} becomes {@code 12500000.0}. */
    static String plainDecimal(JsonNode value) {
        String text = value.asText();
        if (text.indexOf('E') < 0 && text.indexOf('e') < 0) {
            return text;
        }
        String plain = value.decimalValue().stripTrailingZeros().toPlainString();
        return plain.indexOf('.') < 0 ? plain + ".0" : plain;
    }

    /**
     * Numeric value of the first matching member. Numeric strings are parsed;
     * anything else yields {@code fallback}.
     */
    public static double number(JsonNode node, double fallback, String... keys) {
        JsonNode value = first(node, keys);
        if (value == null) {
            return fallback;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isTextual()) {
            try {
                return Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    public static int integer(JsonNode node, int fallback, String... keys) {
        return (int) number(node, fallback, keys);
    }
}
