package com.leadflow.engine.coordinator;

import com.leadflow.core.model.ExecutionEventType;
import com.leadflow.core.model.ExecutionInstance;
import com.leadflow.core.model.ExecutionStatus;
import com.leadflow.core.model.WakeAction;
import com.leadflow.core.port.TimerService;
import com.leadflow.core.port.WakeListener;
import com.leadflow.core.repository.ExecutionInstanceRepository;
import com.leadflow.engine.history.ExecutionEventRecorder;
import com.leadflow.engine.logging.LoggingContext;
import com.leadflow.engine.metrics.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Suspends executions until a later time and hands them back to the state
 * machine when their wake fires.
 *
 * Wake-ups go through the {@link TimerService}; the scheduler is the
 * {@link WakeListener} the timer service calls. It does not check that the
 * delay actually elapsed.
 */
public class StepScheduler implements WakeListener {

    private static final Logger log = LoggerFactory.getLogger(StepScheduler.class);

    private final ExecutionInstanceRepository instanceRepository;
    private final TimerService timerService;
    private final ExecutionEventRecorder events;
    private final WorkflowMetrics metrics;
    private final Clock clock;

    private volatile Consumer<ExecutionInstance> wakeHandler;

    public StepScheduler(
            ExecutionInstanceRepository instanceRepository,
            TimerService timerService,
            ExecutionEventRecorder events,
            WorkflowMetrics metrics,
            Clock clock) {
        this.instanceRepository = instanceRepository;
        this.timerService = timerService;
        this.events = events;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Set the callback that receives woken executions.
     */
    public void bind(Consumer<ExecutionInstance> wakeHandler) {
        this.wakeHandler = Objects.requireNonNull(wakeHandler, "wakeHandler");
    }

    /**
     * Move a running execution to WAITING and schedule its wake.
     *
     * @param instance the running state to suspend
     * @param delay how long to wait
     * @param wakeAction what happens when the wake fires
     * @param expectedVersion the stored version {@code instance} was derived from
     * @return the committed WAITING execution
     * @throws com.leadflow.core.exception.OptimisticLockException if the execution changed concurrently
     */
    public ExecutionInstance suspend(ExecutionInstance instance, Duration delay, WakeAction wakeAction,
                                     long expectedVersion) {
        Instant now = clock.instant();
        ExecutionInstance waiting = instance.toBuilder()
            .status(ExecutionStatus.WAITING)
            .pendingWake(wakeAction)
            .nextWakeAt(now.plus(delay))
            .updatedAt(now)
            .incrementVersion()
            .build();

        instanceRepository.update(waiting, expectedVersion);
        scheduleWake(waiting.id(), delay);

        events.record(waiting.id(), ExecutionEventType.EXECUTION_WAITING, waiting.currentStepIndex(),
            Map.of("wakeAction", wakeAction.name(),
                   "delay", delay.toString(),
                   "nextWakeAt", waiting.nextWakeAt().toString()),
            "waiting:" + waiting.id() + ":" + waiting.currentStepIndex() + ":" + waiting.version());

        log.info("Execution {} waiting {} before {} of step {}",
            waiting.id(), delay, wakeAction, waiting.currentStepIndex());
        return waiting;
    }

    public void scheduleWake(UUID executionId, Duration delay) {
        timerService.scheduleWake(executionId, delay);
    }

    public void cancelWakes(UUID executionId) {
        timerService.cancelWakes(executionId);
    }

    @Override
    public void onWake(UUID executionId) {
        ExecutionInstance instance = instanceRepository.findById(executionId).orElse(null);
        if (instance == null) {
            log.warn("Ignoring wake for unknown execution {}", executionId);
            metrics.wakeIgnored("unknown");
            return;
        }

        try (var ctx = LoggingContext.forExecution(instance.id(), instance.workflowId(), instance.entityId())) {
            if (instance.status() != ExecutionStatus.WAITING) {
                log.info("Ignoring wake for execution {} in status {}", executionId, instance.status());
                metrics.wakeIgnored(instance.status().name().toLowerCase(Locale.ROOT));
                events.record(executionId, ExecutionEventType.WAKE_IGNORED, instance.currentStepIndex(),
                    Map.of("status", instance.status().name()),
                    "wake-ignored:" + executionId + ":" + instance.version());
                return;
            }

            Consumer<ExecutionInstance> handler = wakeHandler;
            if (handler == null) {
                throw new IllegalStateException("No wake handler bound to the step scheduler");
            }
            handler.accept(instance);
        }
    }
}
