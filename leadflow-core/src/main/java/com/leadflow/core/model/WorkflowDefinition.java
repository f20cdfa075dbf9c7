package com.leadflow.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Published definition of a nurturing workflow.
 * Immutable once published: a change is published as a new version with a
 * new id ({@code name:vN}), and executions keep referencing the id they
 * started with.
 * 
 * Primary Key: id
 * Unique Constraint: (name, version)
 * 
 * Invariants:
 * - steps are indexed 0..n-1 in order
 * - maxConcurrentPerEntity == 1 (one active execution per entity)
 * - maxEntriesPerEntity >= 0, 0 means unlimited
 * - cooldown >= 0
 */
public record WorkflowDefinition(
    String id,
    String name,
    int version,
    
    // Entry
    String triggerKind,
    RuleSet entryRules,
    
    // Steps
    List<StepDefinition> steps,
    
    // Gating
    boolean active,
    int maxConcurrentPerEntity,
    int maxEntriesPerEntity,
    Duration cooldown,
    RetryPolicy retryPolicy,
    
    // Metadata
    Instant createdAt,
    String createdBy,
    String description,
    String category
) {
    public WorkflowDefinition {
        steps = steps == null ? List.of() : List.copyOf(steps);
        entryRules = entryRules == null ? RuleSet.empty() : entryRules;
        cooldown = cooldown == null ? Duration.ZERO : cooldown;
        retryPolicy = retryPolicy == null ? RetryPolicy.defaultPolicy() : retryPolicy;
    }

    /**
     * Identifier of a published version.
     */
    public static String versionedId(String name, int version) {
        return name + ":v" + version;
    }

    /**
     * Get a step by index.
     */
    public StepDefinition step(int index) {
        if (index < 0 || index >= steps.size()) {
            return null;
        }
        return steps.get(index);
    }

    public int stepCount() {
        return steps.size();
    }

    public boolean hasCooldown() {
        return !cooldown.isZero() && !cooldown.isNegative();
    }

    public boolean limitsEntries() {
        return maxEntriesPerEntity > 0;
    }

    /**
     * Copy published under the given version.
     */
    public WorkflowDefinition asVersion(int newVersion, Instant publishedAt) {
        return new WorkflowDefinition(
            versionedId(name, newVersion), name, newVersion,
            triggerKind, entryRules, steps,
            true, maxConcurrentPerEntity, maxEntriesPerEntity, cooldown, retryPolicy,
            publishedAt, createdBy, description, category
        );
    }

    /**
     * Copy with the active flag cleared. Steps are untouched.
     */
    public WorkflowDefinition deactivated() {
        return withActive(false);
    }

    public WorkflowDefinition withActive(boolean newActive) {
        return new WorkflowDefinition(
            id, name, version,
            triggerKind, entryRules, steps,
            newActive, maxConcurrentPerEntity, maxEntriesPerEntity, cooldown, retryPolicy,
            createdAt, createdBy, description, category
        );
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private String triggerKind;
        private RuleSet entryRules = RuleSet.empty();
        private final List<StepDefinition> steps = new ArrayList<>();
        private boolean active = true;
        private int maxConcurrentPerEntity = 1;
        private int maxEntriesPerEntity = 0;
        private Duration cooldown = Duration.ZERO;
        private RetryPolicy retryPolicy = RetryPolicy.defaultPolicy();
        private String createdBy;
        private String description;
        private String category;

        public Builder(String name) {
            this.name = name;
        }

        public Builder triggerKind(String triggerKind) {
            this.triggerKind = triggerKind;
            return this;
        }

        public Builder entryRules(RuleSet entryRules) {
            this.entryRules = entryRules;
            return this;
        }

        /**
         * Append a step; its index is its position.
         */
        public Builder step(StepDefinition.Builder step) {
            steps.add(step.index(steps.size()).build());
            return this;
        }

        public Builder step(StepDefinition step) {
            steps.add(step.withIndex(steps.size()));
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder maxConcurrentPerEntity(int maxConcurrentPerEntity) {
            this.maxConcurrentPerEntity = maxConcurrentPerEntity;
            return this;
        }

        public Builder maxEntriesPerEntity(int maxEntriesPerEntity) {
            this.maxEntriesPerEntity = maxEntriesPerEntity;
            return this;
        }

        public Builder cooldown(Duration cooldown) {
            this.cooldown = cooldown;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        /**
         * Build an unpublished draft (version 0, no id).
         */
        public WorkflowDefinition build() {
            return new WorkflowDefinition(
                null, name, 0,
                triggerKind, entryRules, steps,
                active, maxConcurrentPerEntity, maxEntriesPerEntity, cooldown, retryPolicy,
                null, createdBy, description, category
            );
        }
    }
}
