package com.leadflow.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered list of rule expressions combined with AND semantics.
 * An empty rule set always matches.
 */
public record RuleSet(List<RuleExpression> rules) {

    private static final RuleSet EMPTY = new RuleSet(List.of());

    public RuleSet {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public static RuleSet empty() {
        return EMPTY;
    }

    public static RuleSet of(RuleExpression... rules) {
        return new RuleSet(List.of(rules));
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    public int size() {
        return rules.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<RuleExpression> rules = new ArrayList<>();

        public Builder rule(String field, Operator operator, Object value) {
            rules.add(RuleExpression.of(field, operator, value));
            return this;
        }

        public Builder rule(String field, String operatorCode, Object value) {
            rules.add(RuleExpression.of(field, operatorCode, value));
            return this;
        }

        public RuleSet build() {
            return new RuleSet(rules);
        }
    }
}
