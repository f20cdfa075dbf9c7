package com.leadflow.core.rule;

import com.fasterxml.jackson.databind.JsonNode;
import com.leadflow.core.model.RelativeTime;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Objects;

/**
 * Turns rule values and entity field values into comparable form.
 *
 * Numbers of any type become {@link BigDecimal}, temporal values become
 * {@link Instant}, JSON nodes are unwrapped and collections become lists of
 * normalized elements. Relative time expressions are resolved against the
 * evaluation time on every call.
 */
public class ValueResolver {

    // Date, optional time, optional offset. Naive values are read as UTC.
    private static final DateTimeFormatter ISO_DATE_OR_DATE_TIME = new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .optionalStart()
        .appendLiteral('T')
        .append(DateTimeFormatter.ISO_LOCAL_TIME)
        .optionalStart()
        .appendOffsetId()
        .optionalEnd()
        .optionalEnd()
        .toFormatter();

    /**
     * Resolve the expected value of a rule for one evaluation.
     */
    public Object resolveExpected(Object value, Instant evaluationTime) {
        if (value instanceof RelativeTime relative) {
            return relative.resolve(evaluationTime);
        }
        return normalize(value);
    }

    /**
     * Normalize a raw value into its comparable form.
     */
    public Object normalize(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof JsonNode node) {
            return fromJson(node);
        }
        if (raw instanceof BigDecimal decimal) {
            return decimal;
        }
        if (raw instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return BigDecimal.valueOf(((Number) raw).longValue());
        }
        if (raw instanceof Number number) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            return BigDecimal.valueOf(d);
        }
        if (raw instanceof Character c) {
            return String.valueOf(c);
        }
        if (raw instanceof Enum<?> e) {
            return e.name();
        }
        if (raw instanceof Collection<?> collection) {
            List<Object> normalized = new ArrayList<>(collection.size());
            for (Object item : collection) {
                normalized.add(normalize(item));
            }
            return normalized;
        }
        if (raw instanceof Object[] array) {
            return normalize(List.of(array));
        }
        Instant instant = temporalToInstant(raw);
        if (instant != null) {
            return instant;
        }
        return raw;
    }

    /**
     * Equality on normalized values. Numbers compare by value and ISO strings
     * compare equal to the instant they denote.
     */
    public boolean valuesEqual(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return false;
        }
        if (actual instanceof BigDecimal a && expected instanceof BigDecimal b) {
            return a.compareTo(b) == 0;
        }
        if (actual instanceof Instant || expected instanceof Instant) {
            Instant a = toInstant(actual);
            Instant b = toInstant(expected);
            return a != null && a.equals(b);
        }
        return Objects.equals(actual, expected);
    }

    /**
     * Order two normalized values.
     *
     * @return the comparison result, or null if the values are not both
     *         numbers or both instants
     */
    public Integer compare(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return null;
        }
        if (actual instanceof BigDecimal a && expected instanceof BigDecimal b) {
            return a.compareTo(b);
        }
        if (actual instanceof Instant || expected instanceof Instant) {
            Instant a = toInstant(actual);
            Instant b = toInstant(expected);
            if (a == null || b == null) {
                return null;
            }
            return a.compareTo(b);
        }
        return null;
    }

    /**
     * Text form used by the string operators.
     */
    public String asText(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().toPlainString();
        }
        return String.valueOf(value);
    }

    /**
     * Convert a temporal value or an ISO-8601 string into an instant.
     *
     * @return the instant, or null if the value does not denote one
     */
    public static Instant toInstant(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof JsonNode node) {
            return node.isTextual() ? parseInstant(node.asText()) : null;
        }
        if (value instanceof CharSequence text) {
            return parseInstant(text.toString());
        }
        return temporalToInstant(value);
    }

    // ========== Internal Methods ==========

    private static Instant temporalToInstant(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof OffsetDateTime offset) {
            return offset.toInstant();
        }
        if (value instanceof ZonedDateTime zoned) {
            return zoned.toInstant();
        }
        if (value instanceof LocalDateTime local) {
            return local.toInstant(ZoneOffset.UTC);
        }
        if (value instanceof LocalDate date) {
            return date.atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        return null;
    }

    private static Instant parseInstant(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            TemporalAccessor parsed = ISO_DATE_OR_DATE_TIME.parseBest(text.trim(),
                OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime offset) {
                return offset.toInstant();
            }
            if (parsed instanceof LocalDateTime local) {
                return local.toInstant(ZoneOffset.UTC);
            }
            return ((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private Object fromJson(JsonNode node) {
        if (node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isArray()) {
            List<Object> items = new ArrayList<>(node.size());
            node.forEach(item -> items.add(fromJson(item)));
            return items;
        }
        return node;
    }
}
