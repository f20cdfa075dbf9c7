package com.leadflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * One step of a workflow: an action, an optional guard and the delay that
 * follows the action before the next step runs.
 * 
 * Invariants:
 * - index >= 0, contiguous within the workflow
 * - delay >= 0
 * - maxRetries >= 0
 */
public record StepDefinition(
    int index,
    String actionKind,
    JsonNode parameters,
    Duration delay,
    RuleSet skipIf,
    int maxRetries
) {
    public static final int DEFAULT_MAX_RETRIES = 3;

    public StepDefinition {
        Objects.requireNonNull(actionKind, "actionKind");
        if (index < 0) {
            throw new IllegalArgumentException("Step index must be >= 0");
        }
        if (delay == null) {
            delay = Duration.ZERO;
        }
        if (delay.isNegative()) {
            throw new IllegalArgumentException("Step delay must be >= 0");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (parameters == null) {
            parameters = JsonNodeFactory.instance.objectNode();
        }
        if (skipIf == null) {
            skipIf = RuleSet.empty();
        }
    }

    public boolean hasDelay() {
        return !delay.isZero();
    }

    public boolean hasGuard() {
        return !skipIf.isEmpty();
    }

    public StepDefinition withIndex(int newIndex) {
        return new StepDefinition(newIndex, actionKind, parameters, delay, skipIf, maxRetries);
    }

    public static Builder builder(String actionKind) {
        return new Builder(actionKind);
    }

    public static class Builder {
        private final String actionKind;
        private int index;
        private JsonNode parameters;
        private Duration delay = Duration.ZERO;
        private RuleSet skipIf = RuleSet.empty();
        private int maxRetries = DEFAULT_MAX_RETRIES;

        public Builder(String actionKind) {
            this.actionKind = actionKind;
        }

        public Builder index(int index) {
            this.index = index;
            return this;
        }

        public Builder parameters(JsonNode parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder delay(Duration delay) {
            this.delay = delay;
            return this;
        }

        public Builder skipIf(RuleSet skipIf) {
            this.skipIf = skipIf;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public StepDefinition build() {
            return new StepDefinition(index, actionKind, parameters, delay, skipIf, maxRetries);
        }
    }
}
