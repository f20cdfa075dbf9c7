package com.leadflow.core.rule;

import com.fasterxml.jackson.databind.JsonNode;
import com.leadflow.core.model.EntitySnapshot;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the actual value a rule field refers to.
 *
 * Lookup order: the {@code trigger.*} namespace reads the trigger payload,
 * registered computed fields are computed, anything else is a snapshot
 * attribute.
 */
public class FieldResolver {

    public static final String TRIGGER_PREFIX = "trigger.";

    private final Map<String, ComputedField> computedFields;

    public FieldResolver(Collection<? extends ComputedField> computedFields) {
        Map<String, ComputedField> byName = new LinkedHashMap<>();
        for (ComputedField field : computedFields) {
            if (byName.putIfAbsent(field.name(), field) != null) {
                throw new IllegalArgumentException("Duplicate computed field: " + field.name());
            }
        }
        this.computedFields = Map.copyOf(byName);
    }

    /**
     * Check if a field addresses the trigger payload.
     */
    public static boolean isTriggerField(String field) {
        return field.startsWith(TRIGGER_PREFIX) && field.length() > TRIGGER_PREFIX.length();
    }

    public Optional<ComputedField> computed(String field) {
        return Optional.ofNullable(computedFields.get(field));
    }

    /**
     * Resolve a field's raw value.
     *
     * @return the value, or null if missing
     * @throws RuntimeException if a computed field cannot be computed
     */
    public Object resolve(EntitySnapshot snapshot, String field, Instant evaluationTime) {
        if (isTriggerField(field)) {
            return triggerValue(snapshot.trigger(), field.substring(TRIGGER_PREFIX.length()));
        }
        ComputedField computed = computedFields.get(field);
        if (computed != null) {
            return computed.compute(snapshot, evaluationTime);
        }
        return snapshot.get(field);
    }

    private Object triggerValue(JsonNode payload, String path) {
        if (payload == null) {
            return null;
        }
        JsonNode current = payload;
        for (String part : path.split("\\.")) {
            current = current.get(part);
            if (current == null || current.isNull()) {
                return null;
            }
        }
        return current;
    }
}
