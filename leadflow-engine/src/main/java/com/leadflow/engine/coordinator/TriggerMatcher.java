package com.leadflow.engine.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.leadflow.core.exception.DuplicateExecutionException;
import com.leadflow.core.exception.NotFoundException;
import com.leadflow.core.model.EntitySnapshot;
import com.leadflow.core.model.ExecutionInstance;
import com.leadflow.core.model.WorkflowDefinition;
import com.leadflow.core.port.EntitySnapshotProvider;
import com.leadflow.core.repository.ExecutionInstanceRepository;
import com.leadflow.core.rule.RuleEvaluation;
import com.leadflow.core.rule.RuleEvaluator;
import com.leadflow.engine.cache.DefinitionCache;
import com.leadflow.engine.logging.LoggingContext;
import com.leadflow.engine.metrics.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for trigger events. Finds the active workflows listening to a
 * trigger kind, checks their entry gates for the entity and starts an
 * execution for each workflow that admits it.
 */
public class TriggerMatcher {

    private static final Logger log = LoggerFactory.getLogger(TriggerMatcher.class);

    public static final String MANUAL_TRIGGER = "manual";

    private final DefinitionCache definitionCache;
    private final ExecutionInstanceRepository instanceRepository;
    private final EntitySnapshotProvider snapshotProvider;
    private final RuleEvaluator ruleEvaluator;
    private final ExecutionStateMachine stateMachine;
    private final WorkflowMetrics metrics;
    private final Clock clock;

    public TriggerMatcher(
            DefinitionCache definitionCache,
            ExecutionInstanceRepository instanceRepository,
            EntitySnapshotProvider snapshotProvider,
            RuleEvaluator ruleEvaluator,
            ExecutionStateMachine stateMachine,
            WorkflowMetrics metrics,
            Clock clock) {
        this.definitionCache = definitionCache;
        this.instanceRepository = instanceRepository;
        this.snapshotProvider = snapshotProvider;
        this.ruleEvaluator = ruleEvaluator;
        this.stateMachine = stateMachine;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Start executions of every active workflow whose entry gates admit the
     * entity. A failure for one workflow does not affect the others.
     *
     * @return ids of the executions created
     */
    public List<UUID> onTrigger(String triggerKind, String entityId, JsonNode payload) {
        try (var ctx = LoggingContext.forEntity(entityId)) {
            List<WorkflowDefinition> candidates = definitionCache.activeByTriggerKind(triggerKind);
            if (candidates.isEmpty()) {
                log.debug("No active workflows for trigger {}", triggerKind);
                return List.of();
            }

            Optional<EntitySnapshot> snapshot;
            try {
                snapshot = snapshotProvider.getSnapshot(entityId);
            } catch (RuntimeException e) {
                log.error("Could not load entity {} for trigger {}", entityId, triggerKind, e);
                return List.of();
            }
            if (snapshot.isEmpty()) {
                log.warn("Ignoring trigger {} for unknown entity {}", triggerKind, entityId);
                return List.of();
            }

            EntitySnapshot withTrigger = snapshot.get().withTrigger(payload);
            Instant now = clock.instant();
            List<UUID> started = new ArrayList<>();
            for (WorkflowDefinition definition : candidates) {
                try {
                    admit(definition, withTrigger, triggerKind, payload, now).ifPresent(started::add);
                } catch (RuntimeException e) {
                    log.error("Failed to evaluate workflow {} for entity {}", definition.id(), entityId, e);
                    metrics.triggerEvaluated(triggerKind, "error");
                }
            }

            log.info("Trigger {} for entity {} started {} of {} candidate workflows",
                triggerKind, entityId, started.size(), candidates.size());
            return started;
        }
    }

    /**
     * Evaluate a workflow's entry rules for an entity without creating an
     * execution.
     *
     * @throws NotFoundException if the entity does not exist
     */
    public RuleEvaluation evaluateEntry(WorkflowDefinition definition, String entityId, JsonNode payload) {
        EntitySnapshot snapshot = snapshotProvider.getSnapshot(entityId)
            .orElseThrow(() -> new NotFoundException("Entity", entityId));
        return ruleEvaluator.evaluateDetailed(snapshot.withTrigger(payload), definition.entryRules(), clock.instant());
    }

    /**
     * Start an execution directly, bypassing entry rules, cooldown and entry limits.
     *
     * @throws NotFoundException if the workflow is unknown or inactive
     * @throws DuplicateExecutionException if the entity already has an active execution
     */
    public ExecutionInstance enroll(String workflowId, String entityId, JsonNode payload) {
        WorkflowDefinition definition = definitionCache.definition(workflowId)
            .filter(WorkflowDefinition::active)
            .orElseThrow(() -> new NotFoundException("WorkflowDefinition", workflowId));

        try (var ctx = LoggingContext.forEntity(entityId)) {
            return stateMachine.start(definition, entityId, MANUAL_TRIGGER, payload)
                .orElseThrow(() -> new DuplicateExecutionException(workflowId, entityId,
                    instanceRepository.findActive(workflowId, entityId)
                        .map(ExecutionInstance::id)
                        .orElse(null)));
        }
    }

    // ========== Internal Methods ==========

    private Optional<UUID> admit(WorkflowDefinition definition, EntitySnapshot snapshot,
                                 String triggerKind, JsonNode payload, Instant now) {
        String entityId = snapshot.entityId();

        RuleEvaluation entry = ruleEvaluator.evaluateDetailed(snapshot, definition.entryRules(), now);
        if (entry.isError()) {
            log.warn("Entry rules of {} could not be evaluated for entity {}: {}",
                definition.id(), entityId, entry.error());
            metrics.ruleEvaluationError("entry");
            metrics.triggerEvaluated(triggerKind, "error");
            return Optional.empty();
        }
        if (!entry.isMatched()) {
            log.debug("Entity {} does not match entry rules of {} ({})",
                entityId, definition.id(), entry.failedRule());
            metrics.triggerEvaluated(triggerKind, "not_matched");
            return Optional.empty();
        }

        if (definition.hasCooldown() && inCooldown(definition, entityId, now)) {
            log.debug("Entity {} is in cooldown for {}", entityId, definition.id());
            metrics.triggerEvaluated(triggerKind, "cooldown");
            return Optional.empty();
        }

        if (definition.limitsEntries()
                && instanceRepository.countByWorkflowAndEntity(definition.id(), entityId)
                    >= definition.maxEntriesPerEntity()) {
            log.debug("Entity {} reached the entry limit of {}", entityId, definition.id());
            metrics.triggerEvaluated(triggerKind, "entry_limit");
            return Optional.empty();
        }

        Optional<ExecutionInstance> started = stateMachine.start(definition, entityId, triggerKind, payload);
        metrics.triggerEvaluated(triggerKind, started.isPresent() ? "matched" : "duplicate");
        return started.map(ExecutionInstance::id);
    }

    private boolean inCooldown(WorkflowDefinition definition, String entityId, Instant now) {
        return instanceRepository.findLatestFinished(definition.id(), entityId)
            .map(ExecutionInstance::completedAt)
            .map(completedAt -> completedAt.plus(definition.cooldown()).isAfter(now))
            .orElse(false);
    }
}
