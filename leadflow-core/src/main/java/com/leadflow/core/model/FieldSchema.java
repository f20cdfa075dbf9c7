package com.leadflow.core.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Declared types of the entity fields that rules may reference.
 * Computed fields are not listed here; they declare their own type.
 */
public record FieldSchema(Map<String, FieldType> fields) {

    public FieldSchema {
        fields = Map.copyOf(fields);
    }

    public Optional<FieldType> typeOf(String field) {
        return Optional.ofNullable(fields.get(field));
    }

    public boolean declares(String field) {
        return fields.containsKey(field);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, FieldType> fields = new LinkedHashMap<>();

        public Builder field(String name, FieldType type) {
            fields.put(name, type);
            return this;
        }

        public Builder string(String name) {
            return field(name, FieldType.STRING);
        }

        public Builder number(String name) {
            return field(name, FieldType.NUMBER);
        }

        public Builder bool(String name) {
            return field(name, FieldType.BOOLEAN);
        }

        public Builder datetime(String name) {
            return field(name, FieldType.DATETIME);
        }

        public Builder collection(String name) {
            return field(name, FieldType.COLLECTION);
        }

        public FieldSchema build() {
            return new FieldSchema(fields);
        }
    }
}
