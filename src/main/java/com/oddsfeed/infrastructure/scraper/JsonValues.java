package com.oddsfeed.infrastructure.scraper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Defensive accessors for loosely structured upstream JSON.
 *
 * Nothing in here throws on unexpected content: a value that does not have the
 * expected shape is reported as unknown ({@code null} or {@link MissingNode}).
 */
public class JsonValues {

    /** Keys searched, in order, when a text field arrives as a nested object. */
    public static final List<String> TEXT_KEYS = List.of("text", "label", "name", "value", "displayName");

    /** Epoch values above this are milliseconds rather than seconds. */
    private static final double MILLIS_THRESHOLD = 1e12;

    private static final Instant LATEST_SUPPORTED = Instant.parse("9999-12-31T23:59:59Z");

    private static final Pattern NUMERIC = Pattern.compile("[+-]?\\d+(\\.\\d+)?");

    // "2024-05-01T18:00:00+0200" style offsets, which ISO_OFFSET_DATE_TIME rejects
    private static final DateTimeFormatter COMPACT_OFFSET_DATE_TIME = new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .appendLiteral('T')
        .appendPattern("HH:mm:ss")
        .optionalStart()
        .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
        .optionalEnd()
        .appendOffset("+HHMM", "Z")
        .toFormatter();

    private static final List<Function<String, Instant>> DATE_TIME_PARSERS = List.of(
        value -> OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant(),
        value -> OffsetDateTime.parse(value, COMPACT_OFFSET_DATE_TIME).toInstant(),
        value -> LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC),
        value -> LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay(ZoneOffset.UTC).toInstant()
    );

    /**
     * True for missing, null, empty-string and empty container values.
     */
    public static boolean isAbsent(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return true;
        }
        if (node.isTextual()) {
            return node.textValue().isEmpty();
        }
        if (node.isContainerNode()) {
            return node.size() == 0;
        }
        return false;
    }

    /**
     * Ordered-alias lookup: returns the value of the first alias present on the
     * object with a non-absent value, or {@link MissingNode} when none is.
     *
     * An alias holding {@code null}, {@code ""}, {@code []} or {@code {}} does not
     * stop the lookup: {@code {"oddsDecimal": null, "value": 1.9}} resolves to 1.9
     * rather than to the null of the first key.
     */
    public static JsonNode first(JsonNode node, List<String> aliases) {
        if (node == null || !node.isObject()) {
            return MissingNode.getInstance();
        }
        for (String alias : aliases) {
            JsonNode value = node.get(alias);
            if (!isAbsent(value)) {
                return value;
            }
        }
        return MissingNode.getInstance();
    }

    /**
     * Returns the first non-absent candidate, or {@link MissingNode}.
     */
    public static JsonNode firstPresent(JsonNode... candidates) {
        for (JsonNode candidate : candidates) {
            if (!isAbsent(candidate)) {
                return candidate;
            }
        }
        return MissingNode.getInstance();
    }

    /**
     * Returns the first of the given keys whose value is a non-empty object.
     */
    public static Optional<JsonNode> firstObject(JsonNode node, List<String> keys) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value != null && value.isObject() && value.size() > 0) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /**
     * Views a value as a list: arrays yield their elements, absent values an
     * empty list, anything else a single-element list.
     */
    public static List<JsonNode> list(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        if (node.isArray()) {
            List<JsonNode> items = new ArrayList<>(node.size());
            node.forEach(items::add);
            return items;
        }
        return List.of(node);
    }

    /**
     * True if the object carries at least one of the keys, whatever its value.
     */
    public static boolean hasAnyKey(JsonNode node, Collection<String> keys) {
        if (node == null || !node.isObject()) {
            return false;
        }
        for (String key : keys) {
            if (node.has(key)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Collects every object in the tree, root first, in breadth-first order.
     */
    public static List<JsonNode> objectsBreadthFirst(JsonNode root) {
        List<JsonNode> objects = new ArrayList<>();
        if (root == null) {
            return objects;
        }
        Deque<JsonNode> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            JsonNode current = queue.poll();
            if (current.isObject()) {
                objects.add(current);
                current.elements().forEachRemaining(queue::add);
            } else if (current.isArray()) {
                current.elements().forEachRemaining(queue::add);
            }
        }
        return objects;
    }

    /**
     * Breadth-first search for the first object matching the predicate.
     */
    public static Optional<JsonNode> findFirst(JsonNode root, Predicate<JsonNode> matcher) {
        return objectsBreadthFirst(root).stream().filter(matcher).findFirst();
    }

    /**
     * Extracts a human readable text from a string, number, or nested
     * object / list. Objects are searched under {@link #TEXT_KEYS}, lists for
     * their first element that yields a text.
     */
    public static String text(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isObject()) {
            for (String key : TEXT_KEYS) {
                if (node.has(key)) {
                    String extracted = text(node.get(key));
                    if (extracted != null) {
                        return extracted;
                    }
                }
            }
            return null;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                String extracted = text(item);
                if (extracted != null) {
                    return extracted;
                }
            }
            return null;
        }
        return node.asText();
    }

    /**
     * Scalar values as an identifier string; containers fall back to {@link #text}.
     */
    public static String stringify(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        if (node.isValueNode()) {
            return node.asText();
        }
        return text(node);
    }

    /**
     * Parses a numeric or numeric-string value. Anything else is unknown.
     */
    public static BigDecimal decimal(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        if (node.isNumber()) {
            if ((node.isDouble() || node.isFloat()) && !Double.isFinite(node.doubleValue())) {
                return null;
            }
            return node.decimalValue();
        }
        if (node.isTextual()) {
            try {
                return new BigDecimal(node.textValue().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Parses an ISO-8601 string or a Unix timestamp (seconds, or milliseconds
     * when above 10^12) into a UTC instant. Unparseable values are unknown.
     */
    public static Instant timestamp(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        if (node.isNumber()) {
            return fromEpoch(node.doubleValue());
        }
        if (!node.isTextual()) {
            return null;
        }
        String value = node.textValue().trim();
        if (NUMERIC.matcher(value).matches()) {
            return fromEpoch(Double.parseDouble(value));
        }
        if (value.length() > 10 && value.charAt(10) == ' ') {
            value = value.substring(0, 10) + 'T' + value.substring(11);
        }
        for (Function<String, Instant> parser : DATE_TIME_PARSERS) {
            try {
                return parser.apply(value);
            } catch (DateTimeParseException e) {
                // try the next format
            }
        }
        return null;
    }

    private static Instant fromEpoch(double value) {
        if (!Double.isFinite(value)) {
            return null;
        }
        double millis = value > MILLIS_THRESHOLD ? value : value * 1000;
        try {
            Instant instant = Instant.ofEpochMilli(Math.round(millis));
            return instant.isAfter(LATEST_SUPPORTED) ? null : instant;
        } catch (DateTimeException | ArithmeticException e) {
            return null;
        }
    }
}
