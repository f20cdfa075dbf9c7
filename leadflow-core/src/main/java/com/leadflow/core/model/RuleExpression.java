package com.leadflow.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A single condition: {@code field operator value}.
 *
 * Values are literals (string, number, boolean, instant, or a list of those
 * for {@code in}) or a {@link RelativeTime}. String values written as relative
 * expressions ({@code 30_days_ago}) are converted on construction.
 */
public record RuleExpression(String field, Operator operator, Object value) {

    public RuleExpression {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(operator, "operator");
        if (value instanceof String text) {
            Optional<RelativeTime> relative = RelativeTime.parse(text);
            if (relative.isPresent()) {
                value = relative.get();
            }
        } else if (value instanceof List<?> list) {
            value = List.copyOf(list);
        }
    }

    public static RuleExpression of(String field, Operator operator, Object value) {
        return new RuleExpression(field, operator, value);
    }

    /**
     * Build from wire representation ({@code gte}, {@code in}, ...).
     */
    public static RuleExpression of(String field, String operatorCode, Object value) {
        return new RuleExpression(field, Operator.fromCode(operatorCode), value);
    }

    public boolean hasRelativeValue() {
        return value instanceof RelativeTime;
    }

    @Override
    public String toString() {
        return field + " " + operator.code() + " " + value;
    }
}
