package com.leadflow.app.health;

import com.leadflow.core.model.ExecutionStatus;
import com.leadflow.core.repository.ExecutionInstanceRepository;
import com.leadflow.recovery.StuckExecutionMonitor;
import com.leadflow.scheduler.PollingTimerService;
import com.leadflow.scheduler.TimerRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Health of the engine.
 * Reports DOWN when the timer poller is not running, since no waiting
 * execution would ever resume. Stuck executions are reported as details.
 */
@Component
public class LeadflowHealthIndicator implements HealthIndicator {

    private final ExecutionInstanceRepository instanceRepository;
    private final TimerRepository timerRepository;
    private final PollingTimerService timerService;
    private final StuckExecutionMonitor monitor;

    public LeadflowHealthIndicator(
            ExecutionInstanceRepository instanceRepository,
            TimerRepository timerRepository,
            PollingTimerService timerService,
            StuckExecutionMonitor monitor) {
        this.instanceRepository = instanceRepository;
        this.timerRepository = timerRepository;
        this.timerService = timerService;
        this.monitor = monitor;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        details.put("timerRunning", timerService.isRunning());
        details.put("monitorRunning", monitor.isRunning());

        try {
            Map<String, Long> executions = new HashMap<>();
            for (Map.Entry<ExecutionStatus, Long> entry : instanceRepository.countByStatus().entrySet()) {
                executions.put(entry.getKey().name(), entry.getValue());
            }
            details.put("executions", executions);
            details.put("pendingWakes", timerRepository.countPending());
            details.put("stuckExecutions", monitor.lastOverdueCount());
        } catch (Exception e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }

        if (!timerService.isRunning()) {
            return Health.down()
                .withDetails(details)
                .build();
        }
        return Health.up()
            .withDetails(details)
            .build();
    }
}
