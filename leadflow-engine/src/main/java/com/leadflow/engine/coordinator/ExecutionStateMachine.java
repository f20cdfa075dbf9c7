package com.leadflow.engine.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadflow.core.exception.InvalidStateTransitionException;
import com.leadflow.core.exception.NotFoundException;
import com.leadflow.core.exception.OptimisticLockException;
import com.leadflow.core.model.ActionResult;
import com.leadflow.core.model.EntitySnapshot;
import com.leadflow.core.model.ExecutionEvent;
import com.leadflow.core.model.ExecutionEventType;
import com.leadflow.core.model.ExecutionInstance;
import com.leadflow.core.model.ExecutionStatus;
import com.leadflow.core.model.StepDefinition;
import com.leadflow.core.model.StepRecord;
import com.leadflow.core.model.WakeAction;
import com.leadflow.core.model.WorkflowDefinition;
import com.leadflow.core.port.EntitySnapshotProvider;
import com.leadflow.core.repository.ExecutionInstanceRepository;
import com.leadflow.core.rule.RuleEvaluation;
import com.leadflow.core.rule.RuleEvaluator;
import com.leadflow.engine.cache.DefinitionCache;
import com.leadflow.engine.coordinator.ActionDispatcher.RetryDecision;
import com.leadflow.engine.history.ExecutionEventRecorder;
import com.leadflow.engine.logging.LoggingContext;
import com.leadflow.engine.metrics.WorkflowMetrics;
import com.leadflow.worker.ActionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Drives executions through their workflow's steps.
 *
 * Every state change is a compare-and-set on the execution's version. The
 * thread whose commit succeeds owns the next move; a thread that loses a
 * commit stops working on the execution. Steps without a delay are chained in
 * a loop on the calling thread; a delay or a retry backoff hands the execution
 * to the {@link StepScheduler} and the loop ends.
 *
 * Handler results that arrive after a concurrent pause are recorded onto the
 * paused execution. Results that arrive after a cancel, or after any other
 * change to the current step, are discarded.
 */
public class ExecutionStateMachine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionStateMachine.class);

    public static final String DEFINITION_NOT_FOUND = "DEFINITION_NOT_FOUND";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private static final int MAX_COMMIT_ATTEMPTS = 5;

    private final DefinitionCache definitionCache;
    private final ExecutionInstanceRepository instanceRepository;
    private final ExecutionEventRecorder events;
    private final ActionDispatcher dispatcher;
    private final StepScheduler stepScheduler;
    private final EntitySnapshotProvider snapshotProvider;
    private final RuleEvaluator ruleEvaluator;
    private final WorkflowMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ExecutionStateMachine(
            DefinitionCache definitionCache,
            ExecutionInstanceRepository instanceRepository,
            ExecutionEventRecorder events,
            ActionDispatcher dispatcher,
            StepScheduler stepScheduler,
            EntitySnapshotProvider snapshotProvider,
            RuleEvaluator ruleEvaluator,
            WorkflowMetrics metrics,
            ObjectMapper objectMapper,
            Clock clock) {
        this.definitionCache = definitionCache;
        this.instanceRepository = instanceRepository;
        this.events = events;
        this.dispatcher = dispatcher;
        this.stepScheduler = stepScheduler;
        this.snapshotProvider = snapshotProvider;
        this.ruleEvaluator = ruleEvaluator;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;
        stepScheduler.bind(this::wake);
    }

    // ========== Lifecycle Operations ==========

    /**
     * Create an execution for an entity and run it until it waits or ends.
     *
     * @return the execution after its first run, or empty if the entity
     *         already has an active execution of this workflow
     */
    public Optional<ExecutionInstance> start(WorkflowDefinition definition, String entityId,
                                             String triggerKind, JsonNode triggerPayload) {
        ExecutionInstance instance = ExecutionInstance.create(
            definition.id(), entityId, triggerKind, triggerPayload, clock.instant());

        try (var ctx = LoggingContext.forExecution(instance.id(), definition.id(), entityId)) {
            if (!instanceRepository.insertIfNoActive(instance)) {
                log.debug("Entity {} already has an active execution of {}", entityId, definition.id());
                return Optional.empty();
            }

            metrics.executionStarted(definition.id());
            events.record(instance.id(), ExecutionEventType.EXECUTION_CREATED, null,
                details("workflowId", definition.id(), "entityId", entityId, "triggerKind", triggerKind),
                "created:" + instance.id());
            log.info("Started execution {} of {} for entity {}", instance.id(), definition.id(), entityId);

            run(instance, definition);
            return Optional.of(getExecution(instance.id()));
        }
    }

    public ExecutionInstance getExecution(UUID executionId) {
        return instanceRepository.findById(executionId)
            .orElseThrow(() -> new NotFoundException("ExecutionInstance", executionId.toString()));
    }

    public Optional<ExecutionInstance> findActive(String workflowId, String entityId) {
        return instanceRepository.findActive(workflowId, entityId);
    }

    /**
     * Halt a running or waiting execution. A pending wake is kept on the
     * execution and its timer is cancelled.
     *
     * @throws InvalidStateTransitionException if the execution is not RUNNING or WAITING
     */
    public ExecutionInstance pause(UUID executionId, String reason) {
        ExecutionInstance existing = getExecution(executionId);
        try (var ctx = LoggingContext.forExecution(executionId, existing.workflowId(), existing.entityId())) {
            Instant now = clock.instant();
            ExecutionInstance paused = transition(executionId, ExecutionStatus.PAUSED,
                status -> status.canTransitionTo(ExecutionStatus.PAUSED),
                current -> current.toBuilder()
                    .status(ExecutionStatus.PAUSED)
                    .updatedAt(now)
                    .incrementVersion()
                    .build());

            stepScheduler.cancelWakes(executionId);
            metrics.executionPaused(paused.workflowId());
            events.record(executionId, ExecutionEventType.EXECUTION_PAUSED, paused.currentStepIndex(),
                details("reason", reason), "paused:" + executionId + ":" + paused.version(),
                ExecutionEvent.ACTOR_USER, "pause");
            log.info("Paused execution {} at step {}: {}", executionId, paused.currentStepIndex(), reason);
            return paused;
        }
    }

    /**
     * Continue a paused execution.
     *
     * A pending wake whose time has not come puts the execution back to
     * WAITING for the remaining time. A due wake is performed now. With no
     * pending wake the current step is dispatched again.
     *
     * @throws InvalidStateTransitionException if the execution is not PAUSED
     */
    public ExecutionInstance resume(UUID executionId) {
        ExecutionInstance existing = getExecution(executionId);
        try (var ctx = LoggingContext.forExecution(executionId, existing.workflowId(), existing.entityId())) {
            Instant now = clock.instant();
            ExecutionInstance resumed = transition(executionId, ExecutionStatus.RUNNING,
                status -> status == ExecutionStatus.PAUSED,
                paused -> resumedState(paused, now));

            metrics.executionResumed(resumed.workflowId());
            events.record(executionId, ExecutionEventType.EXECUTION_RESUMED, resumed.currentStepIndex(),
                details("status", resumed.status().name()), "resumed:" + executionId + ":" + resumed.version(),
                ExecutionEvent.ACTOR_USER, "resume");

            if (resumed.status() == ExecutionStatus.WAITING) {
                Duration remaining = Duration.between(now, resumed.nextWakeAt());
                stepScheduler.scheduleWake(executionId, remaining);
                log.info("Resumed execution {}; waiting {} more", executionId, remaining);
                return resumed;
            }

            log.info("Resumed execution {} at step {}", executionId, resumed.currentStepIndex());
            run(resumed);
            return getExecution(executionId);
        }
    }

    /**
     * Stop an execution for good. A step in flight finishes but its result
     * is discarded.
     *
     * @throws InvalidStateTransitionException if the execution is already terminal
     */
    public ExecutionInstance cancel(UUID executionId, String reason) {
        ExecutionInstance existing = getExecution(executionId);
        try (var ctx = LoggingContext.forExecution(executionId, existing.workflowId(), existing.entityId())) {
            Instant now = clock.instant();
            ExecutionInstance cancelled = transition(executionId, ExecutionStatus.CANCELLED,
                status -> status.canTransitionTo(ExecutionStatus.CANCELLED),
                current -> current.toBuilder()
                    .status(ExecutionStatus.CANCELLED)
                    .pendingWake(null)
                    .nextWakeAt(null)
                    .completedAt(now)
                    .updatedAt(now)
                    .incrementVersion()
                    .build());

            stepScheduler.cancelWakes(executionId);
            metrics.executionCancelled(cancelled.workflowId());
            events.record(executionId, ExecutionEventType.EXECUTION_CANCELLED, cancelled.currentStepIndex(),
                details("reason", reason), "cancelled:" + executionId,
                ExecutionEvent.ACTOR_USER, "cancel");
            log.info("Cancelled execution {}: {}", executionId, reason);
            return cancelled;
        }
    }

    /**
     * Perform the pending wake of a WAITING execution and run it.
     * Called by the {@link StepScheduler}; a wake whose execution changed
     * since it was loaded is ignored.
     */
    public void wake(ExecutionInstance waiting) {
        Instant now = clock.instant();
        ExecutionInstance running = wakeUp(waiting, now);
        try {
            instanceRepository.update(running, waiting.version());
        } catch (OptimisticLockException e) {
            log.info("Ignoring stale wake for execution {} (version {})", waiting.id(), waiting.version());
            metrics.wakeIgnored("stale");
            events.record(waiting.id(), ExecutionEventType.WAKE_IGNORED, waiting.currentStepIndex(),
                details("reason", "stale", "version", waiting.version()),
                "wake-stale:" + waiting.id() + ":" + waiting.version(),
                ExecutionEvent.ACTOR_SCHEDULER, "timer");
            return;
        }

        events.record(waiting.id(), ExecutionEventType.EXECUTION_WOKEN, running.currentStepIndex(),
            details("wakeAction", waiting.pendingWake() == null ? null : waiting.pendingWake().name()),
            "woken:" + waiting.id() + ":" + running.version(),
            ExecutionEvent.ACTOR_SCHEDULER, "timer");
        log.info("Woke execution {} ({}) at step {}", waiting.id(), waiting.pendingWake(), running.currentStepIndex());
        run(running);
    }

    // ========== Run Loop ==========

    private void run(ExecutionInstance instance) {
        Optional<WorkflowDefinition> definition = definitionCache.definition(instance.workflowId());
        if (definition.isEmpty()) {
            log.error("Definition {} of execution {} not found", instance.workflowId(), instance.id());
            try {
                fail(instance, DEFINITION_NOT_FOUND, "Workflow definition not found: " + instance.workflowId());
            } catch (OptimisticLockException e) {
                log.warn("Execution {} changed before it could be failed", instance.id());
            }
            return;
        }
        run(instance, definition.get());
    }

    /**
     * Dispatch steps until the execution waits, ends or is taken over.
     * An unexpected error fails the execution instead of leaving it RUNNING.
     */
    private void run(ExecutionInstance instance, WorkflowDefinition definition) {
        ExecutionInstance current = instance;
        while (current != null && current.status() == ExecutionStatus.RUNNING) {
            StepDefinition step = definition.step(current.currentStepIndex());
            try {
                current = step == null ? complete(current) : executeStep(current, definition, step);
            } catch (RuntimeException e) {
                current = abort(current, e);
            }
        }
    }

    /**
     * @return the failed execution, or null if it is no longer RUNNING
     */
    private ExecutionInstance abort(ExecutionInstance current, RuntimeException cause) {
        log.error("Unexpected error in execution {} at step {}", current.id(), current.currentStepIndex(), cause);
        ExecutionInstance latest = instanceRepository.findById(current.id()).orElse(null);
        if (latest == null || latest.status() != ExecutionStatus.RUNNING) {
            return null;
        }
        try {
            return fail(latest, INTERNAL_ERROR, cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (OptimisticLockException e) {
            log.warn("Execution {} changed before it could be failed", current.id());
            return null;
        }
    }

    /**
     * @return the committed state, or null if this thread lost the execution
     */
    private ExecutionInstance executeStep(ExecutionInstance current, WorkflowDefinition definition,
                                          StepDefinition step) {
        int attempt = current.retryCountForCurrentStep() + 1;
        try (var ctx = LoggingContext.forStep(current.id(), current.workflowId(), current.entityId(),
                step.index(), attempt)) {
            if (step.hasGuard() && guardMatches(current, step)) {
                log.info("Skipping step {} ({}): skip_if matched", step.index(), step.actionKind());
                metrics.stepSkipped(current.workflowId(), step.actionKind());
                events.record(current.id(), ExecutionEventType.STEP_SKIPPED, step.index(),
                    details("actionKind", step.actionKind()),
                    "step-skipped:" + current.id() + ":" + step.index());
                return applyResult(current, definition, step, ActionResult.succeeded(), true);
            }

            events.record(current.id(), ExecutionEventType.STEP_DISPATCHED, step.index(),
                details("actionKind", step.actionKind(), "attempt", attempt),
                "step-dispatched:" + current.id() + ":" + step.index() + ":" + attempt);
            log.info("Dispatching step {} ({}) attempt {}", step.index(), step.actionKind(), attempt);

            ActionResult result = dispatcher.dispatch(step.actionKind(), step.parameters(),
                ActionContext.forExecution(current, objectMapper));

            if (result.success()) {
                events.record(current.id(), ExecutionEventType.STEP_SUCCEEDED, step.index(),
                    details("actionKind", step.actionKind(), "attempt", attempt),
                    "step-succeeded:" + current.id() + ":" + step.index());
            } else {
                log.warn("Step {} ({}) failed: {} - {}", step.index(), step.actionKind(),
                    result.errorCode(), result.error());
                events.record(current.id(), ExecutionEventType.STEP_FAILED, step.index(),
                    details("actionKind", step.actionKind(), "attempt", attempt,
                            "errorCode", result.errorCode(), "error", result.error(),
                            "retriable", result.retriable()),
                    "step-failed:" + current.id() + ":" + step.index() + ":" + attempt);
            }
            return applyResult(current, definition, step, result, false);
        }
    }

    private ExecutionInstance applyResult(ExecutionInstance current, WorkflowDefinition definition,
                                          StepDefinition step, ActionResult result, boolean skipped) {
        try {
            return result.success()
                ? commitSuccess(current, step, result, skipped)
                : commitFailure(current, definition, step, result);
        } catch (OptimisticLockException e) {
            log.warn("Execution {} changed while step {} was running", current.id(), step.index());
            reconcile(current, definition, step, result, skipped);
            return null;
        }
    }

    private ExecutionInstance commitSuccess(ExecutionInstance current, StepDefinition step,
                                            ActionResult result, boolean skipped) {
        Instant now = clock.instant();
        ExecutionInstance recorded = current.withStepRecorded(
            record(step, current.retryCountForCurrentStep(), skipped, now), result.output(), now);

        if (step.hasDelay()) {
            return stepScheduler.suspend(recorded, step.delay(), WakeAction.ADVANCE, current.version());
        }

        ExecutionInstance advanced = recorded.advance(now);
        instanceRepository.update(advanced, current.version());
        log.debug("Execution {} advanced to step {}", current.id(), advanced.currentStepIndex());
        return advanced;
    }

    private ExecutionInstance commitFailure(ExecutionInstance current, WorkflowDefinition definition,
                                            StepDefinition step, ActionResult result) {
        RetryDecision decision = dispatcher.decideRetry(
            result, current.retryCountForCurrentStep(), step.maxRetries(), definition.retryPolicy());

        if (!decision.retry()) {
            return fail(current, result.errorCode(), result.error());
        }

        int retry = current.retryCountForCurrentStep() + 1;
        ExecutionInstance retrying = current.toBuilder()
            .retryCountForCurrentStep(retry)
            .build();
        ExecutionInstance waiting = stepScheduler.suspend(
            retrying, decision.backoff(), WakeAction.RETRY, current.version());
        retryScheduled(waiting, step, retry, decision.backoff());
        return waiting;
    }

    private ExecutionInstance complete(ExecutionInstance current) {
        Instant now = clock.instant();
        ExecutionInstance completed = current.toBuilder()
            .status(ExecutionStatus.COMPLETED)
            .pendingWake(null)
            .nextWakeAt(null)
            .completedAt(now)
            .updatedAt(now)
            .incrementVersion()
            .build();

        try {
            instanceRepository.update(completed, current.version());
        } catch (OptimisticLockException e) {
            log.warn("Execution {} changed before it could complete", current.id());
            return null;
        }

        metrics.executionCompleted(completed.workflowId(), Duration.between(completed.createdAt(), now));
        events.record(completed.id(), ExecutionEventType.EXECUTION_COMPLETED, null,
            details("steps", completed.stepHistory().size()), "completed:" + completed.id());
        log.info("Execution {} completed after {} steps", completed.id(), completed.stepHistory().size());
        return completed;
    }

    private ExecutionInstance fail(ExecutionInstance current, String errorCode, String error) {
        Instant now = clock.instant();
        ExecutionInstance failed = current.toBuilder()
            .status(ExecutionStatus.FAILED)
            .error(errorCode, error)
            .pendingWake(null)
            .nextWakeAt(null)
            .completedAt(now)
            .updatedAt(now)
            .incrementVersion()
            .build();

        instanceRepository.update(failed, current.version());

        metrics.executionFailed(failed.workflowId(), errorCode);
        events.record(failed.id(), ExecutionEventType.EXECUTION_FAILED, failed.currentStepIndex(),
            details("errorCode", errorCode, "error", error,
                    "retries", failed.retryCountForCurrentStep()),
            "failed:" + failed.id());
        log.warn("Execution {} failed at step {}: {} - {}",
            failed.id(), failed.currentStepIndex(), errorCode, error);
        return failed;
    }

    // ========== Concurrent Changes ==========

    /**
     * Apply a step result whose commit lost to a concurrent change.
     */
    private void reconcile(ExecutionInstance dispatched, WorkflowDefinition definition,
                           StepDefinition step, ActionResult result, boolean skipped) {
        for (int attempt = 1; attempt <= MAX_COMMIT_ATTEMPTS; attempt++) {
            ExecutionInstance fresh = instanceRepository.findById(dispatched.id()).orElse(null);
            if (fresh == null || !acceptsLateResult(fresh, dispatched, step)) {
                discard(dispatched, fresh, step);
                return;
            }
            try {
                applyWhilePaused(fresh, definition, step, result, skipped);
                return;
            } catch (OptimisticLockException e) {
                log.debug("Execution {} changed again, retrying late result of step {}", dispatched.id(), step.index());
            }
        }
        discard(dispatched, null, step);
    }

    private boolean acceptsLateResult(ExecutionInstance fresh, ExecutionInstance dispatched, StepDefinition step) {
        return fresh.status() == ExecutionStatus.PAUSED
            && fresh.currentStepIndex() == step.index()
            && fresh.retryCountForCurrentStep() == dispatched.retryCountForCurrentStep()
            && !fresh.hasRecordFor(step.index())
            && !fresh.hasPendingWake();
    }

    /**
     * Record a result onto a paused execution. A follow-up wait becomes a
     * pending wake that {@link #resume} schedules.
     */
    private void applyWhilePaused(ExecutionInstance paused, WorkflowDefinition definition,
                                  StepDefinition step, ActionResult result, boolean skipped) {
        Instant now = clock.instant();
        if (result.success()) {
            ExecutionInstance recorded = paused.withStepRecorded(
                record(step, paused.retryCountForCurrentStep(), skipped, now), result.output(), now);
            ExecutionInstance next = step.hasDelay()
                ? recorded.toBuilder()
                    .pendingWake(WakeAction.ADVANCE)
                    .nextWakeAt(now.plus(step.delay()))
                    .build()
                : recorded.advance(now);
            instanceRepository.update(next, paused.version());
            log.info("Recorded result of step {} onto paused execution {}", step.index(), paused.id());
            return;
        }

        RetryDecision decision = dispatcher.decideRetry(
            result, paused.retryCountForCurrentStep(), step.maxRetries(), definition.retryPolicy());
        if (!decision.retry()) {
            fail(paused, result.errorCode(), result.error());
            return;
        }

        int retry = paused.retryCountForCurrentStep() + 1;
        ExecutionInstance next = paused.toBuilder()
            .retryCountForCurrentStep(retry)
            .pendingWake(WakeAction.RETRY)
            .nextWakeAt(now.plus(decision.backoff()))
            .updatedAt(now)
            .incrementVersion()
            .build();
        instanceRepository.update(next, paused.version());
        retryScheduled(next, step, retry, decision.backoff());
    }

    private void discard(ExecutionInstance dispatched, ExecutionInstance fresh, StepDefinition step) {
        int attempt = dispatched.retryCountForCurrentStep() + 1;
        String status = fresh == null ? "UNKNOWN" : fresh.status().name();
        log.warn("Discarding result of step {} for execution {} in status {}", step.index(), dispatched.id(), status);
        metrics.stepResultDiscarded(dispatched.workflowId());
        events.record(dispatched.id(), ExecutionEventType.STEP_RESULT_DISCARDED, step.index(),
            details("status", status, "attempt", attempt),
            "discarded:" + dispatched.id() + ":" + step.index() + ":" + attempt);
    }

    // ========== Internal Methods ==========

    /**
     * Run a status change as a compare-and-set, reloading on conflict.
     */
    private ExecutionInstance transition(UUID executionId, ExecutionStatus target,
                                         Predicate<ExecutionStatus> allowedFrom,
                                         UnaryOperator<ExecutionInstance> change) {
        for (int attempt = 1; ; attempt++) {
            ExecutionInstance current = getExecution(executionId);
            if (!allowedFrom.test(current.status())) {
                throw new InvalidStateTransitionException(executionId, current.status(), target);
            }
            ExecutionInstance next = change.apply(current);
            try {
                instanceRepository.update(next, current.version());
                return next;
            } catch (OptimisticLockException e) {
                if (attempt >= MAX_COMMIT_ATTEMPTS) {
                    throw e;
                }
                log.debug("Execution {} changed concurrently, retrying transition to {}", executionId, target);
            }
        }
    }

    private ExecutionInstance resumedState(ExecutionInstance paused, Instant now) {
        if (paused.hasPendingWake() && paused.nextWakeAt() != null && paused.nextWakeAt().isAfter(now)) {
            return paused.toBuilder()
                .status(ExecutionStatus.WAITING)
                .updatedAt(now)
                .incrementVersion()
                .build();
        }
        if (paused.hasPendingWake()) {
            return wakeUp(paused, now);
        }
        return paused.toBuilder()
            .status(ExecutionStatus.RUNNING)
            .updatedAt(now)
            .incrementVersion()
            .build();
    }

    /**
     * Running state after performing an execution's pending wake.
     */
    private ExecutionInstance wakeUp(ExecutionInstance instance, Instant now) {
        ExecutionInstance woken = instance.pendingWake() == WakeAction.ADVANCE
            ? instance.advance(now)
            : instance.toBuilder()
                .pendingWake(null)
                .nextWakeAt(null)
                .updatedAt(now)
                .incrementVersion()
                .build();
        return woken.toBuilder().status(ExecutionStatus.RUNNING).build();
    }

    /**
     * Evaluate a step's skip_if against the entity as it is now. An
     * evaluation that cannot complete does not skip.
     */
    private boolean guardMatches(ExecutionInstance instance, StepDefinition step) {
        Optional<EntitySnapshot> snapshot;
        try {
            snapshot = snapshotProvider.getSnapshot(instance.entityId());
        } catch (RuntimeException e) {
            log.warn("Could not load entity {} for skip_if of step {}; dispatching",
                instance.entityId(), step.index(), e);
            metrics.ruleEvaluationError("skip_if");
            return false;
        }
        if (snapshot.isEmpty()) {
            log.warn("Entity {} not found for skip_if of step {}; dispatching", instance.entityId(), step.index());
            return false;
        }

        RuleEvaluation evaluation = ruleEvaluator.evaluateDetailed(
            snapshot.get().withTrigger(instance.triggerPayload()), step.skipIf(), clock.instant());
        if (evaluation.isError()) {
            log.warn("skip_if of step {} could not be evaluated: {}; dispatching", step.index(), evaluation.error());
            metrics.ruleEvaluationError("skip_if");
            return false;
        }
        return evaluation.isMatched();
    }

    private void retryScheduled(ExecutionInstance instance, StepDefinition step, int retry, Duration backoff) {
        metrics.stepRetried(instance.workflowId(), step.actionKind());
        events.record(instance.id(), ExecutionEventType.STEP_RETRY_SCHEDULED, step.index(),
            details("retry", retry, "maxRetries", step.maxRetries(), "backoff", backoff.toString()),
            "retry-scheduled:" + instance.id() + ":" + step.index() + ":" + retry);
        log.warn("Retry {}/{} of step {} scheduled in {}", retry, step.maxRetries(), step.index(), backoff);
    }

    private static StepRecord record(StepDefinition step, int retryCount, boolean skipped, Instant now) {
        return skipped ? StepRecord.skipped(step, now) : StepRecord.succeeded(step, retryCount + 1, now);
    }

    /**
     * Event payload from key/value pairs; null values are left out.
     */
    private static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
            }
        }
        return map;
    }
}
