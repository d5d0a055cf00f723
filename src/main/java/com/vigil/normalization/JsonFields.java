package com.vigil.normalization;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Field access helpers shared by the payload decoders.
 * Missing and JSON null fields are treated alike: absent.
 */
final class JsonFields {
    
    // Epoch values below this are seconds, above are milliseconds
    private static final BigDecimal EPOCH_MILLIS_THRESHOLD = BigDecimal.valueOf(100_000_000_000L);
    
    private JsonFields() {
    }
    
    /**
     * First present, non-null field among the given names
     */
    static Optional<JsonNode> field(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
    
    static JsonNode requireObject(JsonNode node, String context) {
        if (node == null || !node.isObject()) {
            throw new PayloadParseException("Expected JSON object for " + context);
        }
        return node;
    }
    
    static JsonNode requireArray(JsonNode node, String context) {
        if (node == null || !node.isArray()) {
            throw new PayloadParseException("Expected JSON array for " + context);
        }
        return node;
    }
    
    static Double optionalDouble(JsonNode node, String... names) {
        return field(node, names).map(value -> toDouble(value, names[0])).orElse(null);
    }
    
    static Long optionalLong(JsonNode node, String... names) {
        return field(node, names).map(value -> toLong(value, names[0])).orElse(null);
    }
    
    static double requireDouble(JsonNode node, String name) {
        return field(node, name)
            .map(value -> toDouble(value, name))
            .orElseThrow(() -> new PayloadParseException("Missing required field: " + name));
    }
    
    static long requireLong(JsonNode node, String name) {
        return field(node, name)
            .map(value -> toLong(value, name))
            .orElseThrow(() -> new PayloadParseException("Missing required field: " + name));
    }
    
    static String optionalText(JsonNode node, String... names) {
        return field(node, names)
            .map(value -> value.isValueNode() ? value.asText() : value.toString())
            .orElse(null);
    }
    
    static String requireText(JsonNode node, String name) {
        String text = optionalText(node, name);
        if (text == null) {
            throw new PayloadParseException("Missing required field: " + name);
        }
        return text;
    }
    
    static Instant requireTimestamp(JsonNode node, String name) {
        return field(node, name)
            .map(JsonFields::toInstant)
            .orElseThrow(() -> new PayloadParseException("Missing required field: " + name));
    }
    
    static Instant optionalTimestamp(JsonNode node, String name) {
        return field(node, name).map(JsonFields::toInstant).orElse(null);
    }
    
    /**
     * Object of name to count, keeping the source's key order
     */
    static Map<String, Long> counts(JsonNode node, String name) {
        Map<String, Long> counts = new LinkedHashMap<>();
        Optional<JsonNode> field = field(node, name);
        if (field.isEmpty()) {
            return counts;
        }
        JsonNode object = requireObject(field.get(), name);
        Iterator<Map.Entry<String, JsonNode>> entries = object.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (!entry.getValue().isNull()) {
                counts.put(entry.getKey(), toLong(entry.getValue(), name + "." + entry.getKey()));
            }
        }
        return counts;
    }
    
    /**
     * Every field not in {@code known}, converted to plain Java values
     */
    static Map<String, Object> remaining(JsonNode node, Set<String> known) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = node.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (!known.contains(entry.getKey()) && !entry.getValue().isNull()) {
                attributes.put(entry.getKey(), scalar(entry.getValue()));
            }
        }
        return attributes;
    }
    
    static List<Double> doubles(JsonNode node, String name) {
        List<Double> values = new ArrayList<>();
        Optional<JsonNode> field = field(node, name);
        if (field.isEmpty()) {
            return values;
        }
        for (JsonNode value : requireArray(field.get(), name)) {
            values.add(toDouble(value, name));
        }
        return values;
    }
    
    static Instant toInstant(JsonNode value) {
        if (value.isNumber()) {
            return fromEpoch(value);
        }
        String text = value.asText().trim().replace(' ', 'T');
        try {
            // Naive timestamps ("2024-05-01 12:00:00.123456") are UTC
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(
                text, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new PayloadParseException("Unparseable timestamp: " + value.asText(), e);
        }
    }
    
    /**
     * Epoch seconds or millis, keeping any fractional part down to the nanosecond
     */
    private static Instant fromEpoch(JsonNode value) {
        BigDecimal epoch = value.decimalValue();
        if (epoch.compareTo(EPOCH_MILLIS_THRESHOLD) >= 0) {
            epoch = epoch.movePointLeft(3);
        }
        BigDecimal seconds = epoch.setScale(0, RoundingMode.FLOOR);
        long nanos = epoch.subtract(seconds).movePointRight(9).longValue();
        try {
            return Instant.ofEpochSecond(seconds.longValueExact(), nanos);
        } catch (ArithmeticException | DateTimeException e) {
            throw new PayloadParseException("Epoch timestamp out of range: " + value.asText(), e);
        }
    }
    
    private static double toDouble(JsonNode value, String name) {
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isTextual()) {
            try {
                return Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                throw new PayloadParseException("Field " + name + " is not numeric: " + value.asText(), e);
            }
        }
        throw new PayloadParseException("Field " + name + " is not numeric: " + value);
    }
    
    private static long toLong(JsonNode value, String name) {
        if (value.isIntegralNumber()) {
            return value.asLong();
        }
        return Math.round(toDouble(value, name));
    }
    
    private static Object scalar(JsonNode value) {
        if (value.isIntegralNumber()) {
            return value.asLong();
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        if (value.isTextual()) {
            return value.asText();
        }
        return value.toString();
    }
}
