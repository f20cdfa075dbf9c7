package com.leadflow.core.rule;

import com.leadflow.core.model.EntitySnapshot;
import com.leadflow.core.model.FieldType;
import com.leadflow.core.model.RelativeTime;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;

/**
 * Number of related events recorded in a collection field, optionally limited
 * to a trailing window, e.g. {@code email_opens_last_30d}.
 *
 * Elements are timestamps, or maps carrying one under {@code timestamp} or
 * {@code at}. Elements without a readable timestamp only count when no
 * window is set.
 */
public record EventCountField(String name, String sourceField, RelativeTime window) implements ComputedField {

    public static EventCountField total(String name, String sourceField) {
        return new EventCountField(name, sourceField, null);
    }

    @Override
    public FieldType type() {
        return FieldType.NUMBER;
    }

    @Override
    public Object compute(EntitySnapshot snapshot, Instant evaluationTime) {
        Object source = snapshot.get(sourceField);
        if (source == null) {
            return BigDecimal.ZERO;
        }
        if (!(source instanceof Collection<?> events)) {
            throw new IllegalStateException("Field " + sourceField + " is not a collection");
        }
        if (window == null) {
            return BigDecimal.valueOf(events.size());
        }
        Instant from = window.resolve(evaluationTime);
        long count = events.stream()
            .map(EventCountField::timestampOf)
            .filter(at -> at != null && !at.isBefore(from) && !at.isAfter(evaluationTime))
            .count();
        return BigDecimal.valueOf(count);
    }

    private static Instant timestampOf(Object event) {
        if (event instanceof Map<?, ?> map) {
            Object at = map.containsKey("timestamp") ? map.get("timestamp") : map.get("at");
            return ValueResolver.toInstant(at);
        }
        return ValueResolver.toInstant(event);
    }
}
