package com.leadflow.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A named grouping of entities.
 * Dynamic segments derive membership from their rules and are only written by
 * recalculation; static segments are maintained by hand.
 */
public record SegmentDefinition(
    String id,
    String name,
    String description,
    RuleSet rules,
    boolean dynamic,
    boolean active,
    int priority,
    Instant createdAt
) {
    public SegmentDefinition {
        Objects.requireNonNull(id, "id");
        rules = rules == null ? RuleSet.empty() : rules;
    }

    public static SegmentDefinition dynamic(String id, String name, String description, RuleSet rules, int priority) {
        return new SegmentDefinition(id, name, description, rules, true, true, priority, null);
    }

    public static SegmentDefinition manual(String id, String name, String description) {
        return new SegmentDefinition(id, name, description, RuleSet.empty(), false, true, 0, null);
    }

    public SegmentDefinition withCreatedAt(Instant at) {
        return new SegmentDefinition(id, name, description, rules, dynamic, active, priority, at);
    }

    public SegmentDefinition withActive(boolean newActive) {
        return new SegmentDefinition(id, name, description, rules, dynamic, newActive, priority, createdAt);
    }
}
