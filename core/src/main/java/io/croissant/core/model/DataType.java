package io.croissant.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Data types a field may declare, and the coercion of raw cell values into them.
 *
 * <p>
 * Cells arrive as whatever the reader produced (CSV text, JSON literals, raw bytes). Coercion
 * maps them onto one canonical JSON representation per type; a {@code null}, missing or blank
 * cell becomes JSON {@code null} for every type but {@link #TEXT}.
 */
public enum DataType {
    TEXT("sc:Text"),
    INTEGER("sc:Integer"),
    FLOAT("sc:Float", "sc:Number"),
    BOOLEAN("sc:Boolean"),
    URL("sc:URL"),
    DATE("sc:Date"),
    IMAGE_OBJECT("sc:ImageObject");

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final String[] tags;

    DataType(String... tags) {
        this.tags = tags;
    }

    /** The compact tag this type is written with, e.g. {@code sc:Integer}. */
    public String compact() {
        return tags[0];
    }

    /** Resolves a compact or expanded type tag. */
    public static Optional<DataType> fromTag(String tag) {
        String expanded = Terms.expand(tag);
        return Arrays.stream(values())
                .filter(type -> Arrays.stream(type.tags).map(Terms::expand).anyMatch(t -> t.equals(expanded)))
                .findFirst();
    }

    /**
     * Converts a raw cell into this type.
     *
     * @param value the raw cell, may be {@code null}
     * @return the converted value, never Java {@code null}
     * @throws IllegalArgumentException if the value has no representation in this type
     */
    public JsonNode coerce(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return NullNode.getInstance();
        }
        if (this != TEXT && value.isTextual() && value.asText().isBlank()) {
            return NullNode.getInstance();
        }
        return switch (this) {
            case TEXT -> toText(value);
            case INTEGER -> toInteger(value);
            case FLOAT -> toFloat(value);
            case BOOLEAN -> toBoolean(value);
            case URL -> toUrl(value);
            case DATE -> toDate(value);
            case IMAGE_OBJECT -> toBytes(value);
        };
    }

    private static JsonNode toText(JsonNode value) {
        if (value.isTextual()) {
            return value;
        }
        if (value.isBinary()) {
            return NODES.textNode(new String(binary(value), StandardCharsets.UTF_8));
        }
        if (value.isValueNode()) {
            return NODES.textNode(value.asText());
        }
        return NODES.textNode(value.toString());
    }

    private JsonNode toInteger(JsonNode value) {
        if (value.isIntegralNumber()) {
            return NODES.numberNode(value.longValue());
        }
        if (value.isNumber() && value.doubleValue() == Math.rint(value.doubleValue())) {
            return NODES.numberNode(value.longValue());
        }
        if (value.isTextual()) {
            try {
                return NODES.numberNode(Long.parseLong(value.asText().trim()));
            } catch (NumberFormatException e) {
                throw unsupported(value);
            }
        }
        throw unsupported(value);
    }

    private JsonNode toFloat(JsonNode value) {
        if (value.isNumber()) {
            return NODES.numberNode(value.doubleValue());
        }
        if (value.isTextual()) {
            try {
                return NODES.numberNode(Double.parseDouble(value.asText().trim()));
            } catch (NumberFormatException e) {
                throw unsupported(value);
            }
        }
        throw unsupported(value);
    }

    private JsonNode toBoolean(JsonNode value) {
        if (value.isBoolean()) {
            return value;
        }
        if (value.isIntegralNumber() && (value.longValue() == 0 || value.longValue() == 1)) {
            return NODES.booleanNode(value.longValue() == 1);
        }
        if (value.isTextual()) {
            switch (value.asText().trim().toLowerCase(Locale.ROOT)) {
                case "true", "yes", "1" -> {
                    return NODES.booleanNode(true);
                }
                case "false", "no", "0" -> {
                    return NODES.booleanNode(false);
                }
                default -> throw unsupported(value);
            }
        }
        throw unsupported(value);
    }

    private JsonNode toUrl(JsonNode value) {
        if (!value.isTextual()) {
            throw unsupported(value);
        }
        try {
            return NODES.textNode(new URI(value.asText().trim()).toString());
        } catch (URISyntaxException e) {
            throw unsupported(value);
        }
    }

    private JsonNode toDate(JsonNode value) {
        if (!value.isTextual()) {
            throw unsupported(value);
        }
        String text = value.asText().trim();
        try {
            // Timestamps keep only their date part.
            String datePart = text.length() > 10 && text.charAt(10) == 'T' ? text.substring(0, 10) : text;
            return NODES.textNode(LocalDate.parse(datePart).toString());
        } catch (DateTimeParseException e) {
            throw unsupported(value);
        }
    }

    private JsonNode toBytes(JsonNode value) {
        if (value.isBinary()) {
            return value;
        }
        if (value.isTextual()) {
            return NODES.binaryNode(value.asText().getBytes(StandardCharsets.UTF_8));
        }
        throw unsupported(value);
    }

    private static byte[] binary(JsonNode value) {
        try {
            return value.binaryValue();
        } catch (IOException e) {
            throw new IllegalArgumentException("Unreadable binary value", e);
        }
    }

    private IllegalArgumentException unsupported(JsonNode value) {
        String shown = value.isBinary() ? "<binary>" : value.toString();
        return new IllegalArgumentException("Cannot convert " + shown + " to " + compact());
    }
}
