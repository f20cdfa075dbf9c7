package com.leadflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Point-in-time view of an entity's fields, as supplied by the surrounding
 * system. Values may be null. Nested maps are addressable with dotted paths.
 *
 * The optional trigger payload is exposed to rules under {@code trigger.*}.
 */
public record EntitySnapshot(
    String entityId,
    Map<String, Object> attributes,
    JsonNode trigger
) {
    public EntitySnapshot {
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new HashMap<>(attributes));
    }

    public static EntitySnapshot of(String entityId, Map<String, Object> attributes) {
        return new EntitySnapshot(entityId, attributes, null);
    }

    /**
     * Copy of this snapshot carrying the given trigger payload.
     */
    public EntitySnapshot withTrigger(JsonNode triggerPayload) {
        return new EntitySnapshot(entityId, attributes, triggerPayload);
    }

    /**
     * Look up an attribute. A direct key wins over a dotted path.
     *
     * @return the value, or null if absent
     */
    public Object get(String field) {
        if (attributes.containsKey(field)) {
            return attributes.get(field);
        }
        if (field.indexOf('.') < 0) {
            return null;
        }
        Object current = attributes;
        for (String part : field.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(part);
        }
        return current;
    }

    public boolean has(String field) {
        return get(field) != null;
    }
}
