package com.leadflow.app.config;

import com.leadflow.core.model.RetryPolicy;
import com.leadflow.core.model.SegmentDefinition;
import com.leadflow.core.model.WorkflowDefinition;
import com.leadflow.core.repository.ExecutionInstanceRepository;
import com.leadflow.core.repository.SegmentRepository;
import com.leadflow.engine.coordinator.StepScheduler;
import com.leadflow.engine.coordinator.WorkflowDefinitionService;
import com.leadflow.engine.metrics.WorkflowMetrics;
import com.leadflow.engine.segment.SegmentEvaluator;
import com.leadflow.examples.nurturing.NurturingSegments;
import com.leadflow.examples.nurturing.NurturingWorkflows;
import com.leadflow.recovery.StuckExecutionMonitor;
import com.leadflow.scheduler.PollingTimerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Starts the background parts of the engine once the context is ready:
 * the timer poller, the stuck-execution monitor and the status gauge refresh.
 */
@Component
public class EngineLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(EngineLifecycle.class);

    private final LeadflowProperties properties;
    private final WorkflowDefinitionService definitionService;
    private final SegmentEvaluator segmentEvaluator;
    private final SegmentRepository segmentRepository;
    private final ExecutionInstanceRepository instanceRepository;
    private final PollingTimerService timerService;
    private final StepScheduler stepScheduler;
    private final StuckExecutionMonitor monitor;
    private final WorkflowMetrics metrics;

    private ScheduledExecutorService gaugeRefresher;
    private volatile boolean running = false;

    public EngineLifecycle(
            LeadflowProperties properties,
            WorkflowDefinitionService definitionService,
            SegmentEvaluator segmentEvaluator,
            SegmentRepository segmentRepository,
            ExecutionInstanceRepository instanceRepository,
            PollingTimerService timerService,
            StepScheduler stepScheduler,
            StuckExecutionMonitor monitor,
            WorkflowMetrics metrics) {
        this.properties = properties;
        this.definitionService = definitionService;
        this.segmentEvaluator = segmentEvaluator;
        this.segmentRepository = segmentRepository;
        this.instanceRepository = instanceRepository;
        this.timerService = timerService;
        this.stepScheduler = stepScheduler;
        this.monitor = monitor;
        this.metrics = metrics;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        if (properties.getExamples().isInstallDefaults()) {
            installDefaults();
        }

        timerService.start(stepScheduler);
        if (properties.getRecovery().isEnabled()) {
            monitor.start();
        }

        long refreshMillis = properties.getMetrics().getGaugeRefreshInterval().toMillis();
        gaugeRefresher = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "leadflow-gauges");
            thread.setDaemon(true);
            return thread;
        });
        gaugeRefresher.scheduleWithFixedDelay(this::refreshGauges, 0, refreshMillis, TimeUnit.MILLISECONDS);

        running = true;
        log.info("Leadflow engine started (persistence {}, recovery {})",
            properties.getPersistence().getMode(),
            properties.getRecovery().isEnabled() ? "enabled" : "disabled");
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        gaugeRefresher.shutdownNow();
        monitor.stop();
        timerService.stop();
        log.info("Leadflow engine stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Publish the predefined workflows and segments that are not stored yet.
     * Restarting against a database that already holds them publishes nothing.
     */
    void installDefaults() {
        RetryPolicy retryPolicy = properties.getRetry().toPolicy();
        int workflows = 0;
        for (WorkflowDefinition draft : NurturingWorkflows.all(retryPolicy)) {
            if (definitionService.versions(draft.name()).isEmpty()) {
                definitionService.publish(draft);
                workflows++;
            }
        }
        int segments = 0;
        for (SegmentDefinition segment : NurturingSegments.all()) {
            if (segmentRepository.findById(segment.id()).isEmpty()) {
                segmentEvaluator.define(segment);
                segments++;
            }
        }
        log.info("Installed {} default workflows and {} default segments", workflows, segments);
    }

    private void refreshGauges() {
        try {
            metrics.syncStatusGauges(instanceRepository.countByStatus());
        } catch (Exception e) {
            log.warn("Failed to refresh execution gauges: {}", e.getMessage());
        }
    }
}
