package com.leadflow.core.model;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Comparison operators of the rule language.
 * Each operator declares the field types it may be applied to; the pairing is
 * checked when a rule set is defined, never during evaluation.
 */
public enum Operator {
    EQ("eq"),
    NOT_EQ("not_eq"),
    GT("gt"),
    LT("lt"),
    GTE("gte"),
    LTE("lte"),
    IN("in"),
    CONTAINS("contains"),
    STARTS_WITH("starts_with"),
    ENDS_WITH("ends_with");

    private final String code;

    Operator(String code) {
        this.code = code;
    }

    /**
     * Wire code as used in stored rule definitions.
     */
    public String code() {
        return code;
    }

    /**
     * Resolve an operator from its wire code.
     *
     * @throws IllegalArgumentException if the code is unknown
     */
    public static Operator fromCode(String code) {
        return Arrays.stream(values())
            .filter(op -> op.code.equals(code))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown operator: " + code));
    }

    /**
     * Check if this operator orders its operands (numbers or instants).
     */
    public boolean isOrdering() {
        return this == GT || this == LT || this == GTE || this == LTE;
    }

    /**
     * Field types this operator accepts.
     */
    public Set<FieldType> supportedTypes() {
        return switch (this) {
            case EQ, NOT_EQ -> EnumSet.of(FieldType.STRING, FieldType.NUMBER, FieldType.BOOLEAN, FieldType.DATETIME);
            case GT, LT, GTE, LTE -> EnumSet.of(FieldType.NUMBER, FieldType.DATETIME);
            case IN -> EnumSet.of(FieldType.STRING, FieldType.NUMBER, FieldType.BOOLEAN);
            case CONTAINS -> EnumSet.of(FieldType.STRING, FieldType.COLLECTION);
            case STARTS_WITH, ENDS_WITH -> EnumSet.of(FieldType.STRING);
        };
    }

    public boolean supports(FieldType type) {
        return supportedTypes().contains(type);
    }
}
