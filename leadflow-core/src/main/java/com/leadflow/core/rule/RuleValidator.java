package com.leadflow.core.rule;

import com.leadflow.core.exception.RuleValidationException;
import com.leadflow.core.model.FieldSchema;
import com.leadflow.core.model.FieldType;
import com.leadflow.core.model.Operator;
import com.leadflow.core.model.RelativeTime;
import com.leadflow.core.model.RuleExpression;
import com.leadflow.core.model.RuleSet;

import java.util.List;
import java.util.Optional;

/**
 * Checks rule sets against the declared field types when a workflow or
 * segment is defined, so that type errors never reach evaluation.
 *
 * Fields in the {@code trigger.*} namespace have no declared type; only the
 * shape of their values is checked.
 */
public class RuleValidator {

    private final FieldSchema schema;
    private final FieldResolver fieldResolver;

    public RuleValidator(FieldSchema schema, FieldResolver fieldResolver) {
        this.schema = schema;
        this.fieldResolver = fieldResolver;
    }

    /**
     * Validate every rule of a rule set.
     *
     * @throws RuleValidationException on the first invalid rule
     */
    public void validate(RuleSet ruleSet) {
        for (RuleExpression rule : ruleSet.rules()) {
            validate(rule);
        }
    }

    /**
     * Validate a single rule.
     *
     * @throws RuleValidationException if the rule is invalid
     */
    public void validate(RuleExpression rule) {
        if (rule.field().isBlank()) {
            throw new RuleValidationException(rule, "field cannot be empty");
        }
        if (rule.value() == null) {
            throw new RuleValidationException(rule, "value is required");
        }
        if (rule.hasRelativeValue() && !rule.operator().isOrdering()) {
            throw new RuleValidationException(rule,
                "relative time values require gt, lt, gte or lte");
        }
        
        if (FieldResolver.isTriggerField(rule.field())) {
            validateUntyped(rule);
            return;
        }
        
        FieldType type = typeOf(rule.field())
            .orElseThrow(() -> new RuleValidationException(rule, "unknown field"));
        
        if (!rule.operator().supports(type)) {
            throw new RuleValidationException(rule, String.format(
                "operator %s cannot be applied to %s field", rule.operator().code(), type));
        }
        validateValue(rule, type);
    }

    /**
     * Declared type of a field, computed fields included.
     */
    public Optional<FieldType> typeOf(String field) {
        Optional<ComputedField> computed = fieldResolver.computed(field);
        if (computed.isPresent()) {
            return Optional.of(computed.get().type());
        }
        return schema.typeOf(field);
    }

    // ========== Internal Methods ==========

    private void validateValue(RuleExpression rule, FieldType type) {
        Object value = rule.value();
        Operator operator = rule.operator();
        
        switch (operator) {
            case IN -> {
                List<?> options = requireList(rule);
                for (Object option : options) {
                    if (!isScalarOf(type, option)) {
                        throw new RuleValidationException(rule, "list element " + option + " is not a " + type);
                    }
                }
            }
            case GT, LT, GTE, LTE -> {
                if (value instanceof RelativeTime && type != FieldType.DATETIME) {
                    throw new RuleValidationException(rule, "relative time requires a DATETIME field");
                }
                if (!(value instanceof RelativeTime) && !isScalarOf(type, value)) {
                    throw new RuleValidationException(rule, "value is not a " + type);
                }
            }
            case CONTAINS -> {
                if (type == FieldType.STRING && !(value instanceof String)) {
                    throw new RuleValidationException(rule, "contains on a STRING field needs a string value");
                }
                if (type == FieldType.COLLECTION && !isScalar(value)) {
                    throw new RuleValidationException(rule, "contains on a COLLECTION field needs a scalar value");
                }
            }
            case STARTS_WITH, ENDS_WITH -> {
                if (!(value instanceof String)) {
                    throw new RuleValidationException(rule, "value must be a string");
                }
            }
            case EQ, NOT_EQ -> {
                if (!isScalarOf(type, value)) {
                    throw new RuleValidationException(rule, "value is not a " + type);
                }
            }
        }
    }

    private void validateUntyped(RuleExpression rule) {
        Object value = rule.value();
        switch (rule.operator()) {
            case IN -> requireList(rule);
            case GT, LT, GTE, LTE -> {
                if (!(value instanceof Number) && !(value instanceof RelativeTime)
                        && ValueResolver.toInstant(value) == null) {
                    throw new RuleValidationException(rule, "ordering needs a number, instant or relative time");
                }
            }
            case STARTS_WITH, ENDS_WITH -> {
                if (!(value instanceof String)) {
                    throw new RuleValidationException(rule, "value must be a string");
                }
            }
            case EQ, NOT_EQ, CONTAINS -> {
                if (!isScalar(value)) {
                    throw new RuleValidationException(rule, "value must be a scalar");
                }
            }
        }
    }

    private List<?> requireList(RuleExpression rule) {
        if (!(rule.value() instanceof List<?> options) || options.isEmpty()) {
            throw new RuleValidationException(rule, "in requires a non-empty list");
        }
        return options;
    }

    private boolean isScalarOf(FieldType type, Object value) {
        return switch (type) {
            case STRING -> value instanceof String;
            case NUMBER -> value instanceof Number;
            case BOOLEAN -> value instanceof Boolean;
            case DATETIME -> !(value instanceof RelativeTime) && ValueResolver.toInstant(value) != null;
            case COLLECTION -> false;
        };
    }

    private boolean isScalar(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }
}
