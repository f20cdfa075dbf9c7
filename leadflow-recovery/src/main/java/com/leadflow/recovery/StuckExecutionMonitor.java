package com.leadflow.recovery;

import com.leadflow.core.model.ExecutionEvent;
import com.leadflow.core.model.ExecutionEventType;
import com.leadflow.core.model.ExecutionInstance;
import com.leadflow.core.port.TimerService;
import com.leadflow.core.repository.ExecutionInstanceRepository;
import com.leadflow.engine.history.ExecutionEventRecorder;
import com.leadflow.engine.logging.LoggingContext;
import com.leadflow.engine.metrics.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Detects executions left WAITING past their wake time, e.g. because a timer
 * was lost or the process was down longer than the threshold.
 *
 * Responsibilities:
 * - Find WAITING executions whose wake is overdue by more than the threshold
 * - Report each one once per wake deadline (log, metric, EXECUTION_STUCK event)
 * - Re-arm the wake so the execution continues
 */
public class StuckExecutionMonitor {

    private static final Logger log = LoggerFactory.getLogger(StuckExecutionMonitor.class);

    public static final Duration DEFAULT_THRESHOLD = Duration.ofMinutes(15);
    public static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofMinutes(1);
    private static final int BATCH_SIZE = 100;
    private static final String ACTOR_ID = "stuck-execution-monitor";

    private final ExecutionInstanceRepository instanceRepository;
    private final ExecutionEventRecorder events;
    private final TimerService timerService;
    private final WorkflowMetrics metrics;
    private final Clock clock;
    private final Duration threshold;
    private final Duration checkInterval;

    private ScheduledExecutorService scheduler;
    private volatile boolean running = false;
    private volatile int lastOverdueCount = 0;

    public StuckExecutionMonitor(
            ExecutionInstanceRepository instanceRepository,
            ExecutionEventRecorder events,
            TimerService timerService,
            WorkflowMetrics metrics,
            Clock clock,
            Duration threshold,
            Duration checkInterval) {
        if (threshold.isNegative()) {
            throw new IllegalArgumentException("Stuck threshold must not be negative");
        }
        if (checkInterval.isNegative() || checkInterval.isZero()) {
            throw new IllegalArgumentException("Check interval must be positive");
        }
        this.instanceRepository = instanceRepository;
        this.events = events;
        this.timerService = timerService;
        this.metrics = metrics;
        this.clock = clock;
        this.threshold = threshold;
        this.checkInterval = checkInterval;
    }

    /**
     * Start periodic detection.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Stuck execution monitor already running");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "leadflow-recovery");
            thread.setDaemon(true);
            return thread;
        });
        running = true;

        scheduler.scheduleWithFixedDelay(
            this::detectSafely,
            checkInterval.toMillis(),
            checkInterval.toMillis(),
            TimeUnit.MILLISECONDS
        );

        log.info("Stuck execution monitor started (threshold {}, interval {})", threshold, checkInterval);
    }

    /**
     * Stop periodic detection.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Stuck execution monitor stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Overdue executions found by the last scan, reported or not.
     */
    public int lastOverdueCount() {
        return lastOverdueCount;
    }

    /**
     * Scan once.
     *
     * @return the number of executions reported for the first time
     */
    public int detectStuckExecutions() {
        Instant now = clock.instant();
        List<ExecutionInstance> overdue = instanceRepository.findOverdueWaiting(now.minus(threshold), BATCH_SIZE);
        lastOverdueCount = overdue.size();
        if (overdue.isEmpty()) {
            return 0;
        }

        int reported = 0;
        for (ExecutionInstance instance : overdue) {
            try {
                if (report(instance, now)) {
                    reported++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to handle stuck execution {}", instance.id(), e);
            }
        }
        if (reported > 0) {
            log.warn("Found {} stuck executions ({} newly reported)", overdue.size(), reported);
        }
        return reported;
    }

    // ========== Internal Methods ==========

    private boolean report(ExecutionInstance instance, Instant now) {
        try (var ctx = LoggingContext.forExecution(instance.id(), instance.workflowId(), instance.entityId())) {
            Duration overdueBy = Duration.between(instance.nextWakeAt(), now);
            boolean first = events.record(instance.id(), ExecutionEventType.EXECUTION_STUCK,
                instance.currentStepIndex(),
                Map.of("nextWakeAt", instance.nextWakeAt().toString(),
                       "overdueBy", overdueBy.toString(),
                       "wakeAction", String.valueOf(instance.pendingWake())),
                "stuck:" + instance.id() + ":" + instance.nextWakeAt().toEpochMilli(),
                ExecutionEvent.ACTOR_RECOVERY, ACTOR_ID);
            if (!first) {
                log.debug("Execution {} already reported stuck for wake at {}", instance.id(), instance.nextWakeAt());
                return false;
            }

            log.warn("Execution {} stuck in WAITING, wake was due {} ago; re-arming", instance.id(), overdueBy);
            metrics.stuckExecutionDetected(instance.workflowId());
            timerService.scheduleWake(instance.id(), Duration.ZERO);
            return true;
        }
    }

    private void detectSafely() {
        if (!running) return;

        try {
            detectStuckExecutions();
        } catch (Exception e) {
            log.error("Error in stuck execution detection", e);
        }
    }
}
