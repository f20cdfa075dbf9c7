package com.leadflow.core.rule;

import com.leadflow.core.model.EntitySnapshot;
import com.leadflow.core.model.FieldType;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Whole days elapsed between a timestamp field and the evaluation time,
 * e.g. {@code days_since_last_activity}.
 */
public record DaysSinceField(String name, String sourceField) implements ComputedField {

    @Override
    public FieldType type() {
        return FieldType.NUMBER;
    }

    @Override
    public Object compute(EntitySnapshot snapshot, Instant evaluationTime) {
        Instant since = ValueResolver.toInstant(snapshot.get(sourceField));
        if (since == null) {
            return null;
        }
        return BigDecimal.valueOf(Duration.between(since, evaluationTime).toDays());
    }
}
