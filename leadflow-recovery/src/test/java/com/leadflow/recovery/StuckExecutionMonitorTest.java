package com.leadflow.recovery;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadflow.core.model.ExecutionEvent;
import com.leadflow.core.model.ExecutionEventType;
import com.leadflow.core.model.ExecutionInstance;
import com.leadflow.core.model.ExecutionStatus;
import com.leadflow.core.model.WakeAction;
import com.leadflow.core.test.TimeController;
import com.leadflow.engine.history.ExecutionEventRecorder;
import com.leadflow.engine.metrics.WorkflowMetrics;
import com.leadflow.engine.persistence.InMemoryExecutionEventRepository;
import com.leadflow.engine.persistence.InMemoryExecutionInstanceRepository;
import com.leadflow.scheduler.InMemoryTimerRepository;
import com.leadflow.scheduler.PollingTimerService;
import com.leadflow.scheduler.ScheduledWake;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StuckExecutionMonitorTest {

    private static final Instant START = Instant.parse("2024-03-15T12:00:00Z");

    private final TimeController clock = TimeController.frozenAt(START);
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final WorkflowMetrics metrics = new WorkflowMetrics();
    private final InMemoryExecutionInstanceRepository instances = new InMemoryExecutionInstanceRepository();
    private final InMemoryExecutionEventRepository eventRepository = new InMemoryExecutionEventRepository();
    private final InMemoryTimerRepository timers = new InMemoryTimerRepository();
    private final PollingTimerService timerService = new PollingTimerService(timers, clock);

    private StuckExecutionMonitor monitor;

    @BeforeEach
    void setUp() {
        metrics.bindTo(registry);
        ExecutionEventRecorder recorder = new ExecutionEventRecorder(eventRepository, new ObjectMapper(), clock);
        monitor = new StuckExecutionMonitor(instances, recorder, timerService, metrics, clock,
            Duration.ofMinutes(15), Duration.ofMinutes(1));
    }

    private ExecutionInstance waiting(String entityId, Instant wakeAt) {
        ExecutionInstance instance = ExecutionInstance.create("welcome:v1", entityId, "lead_created", null, START)
            .toBuilder()
            .status(ExecutionStatus.WAITING)
            .pendingWake(WakeAction.ADVANCE)
            .nextWakeAt(wakeAt)
            .build();
        instances.insertIfNoActive(instance);
        return instance;
    }

    private double stuckCount() {
        var counter = registry.find(WorkflowMetrics.STUCK_EXECUTIONS).tag("workflow", "welcome:v1").counter();
        return counter == null ? 0 : counter.count();
    }

    @Test
    @DisplayName("Waits within the threshold are not reported")
    void detect_shouldIgnoreRecentlyDueWakes() {
        waiting("lead-1", START.plus(Duration.ofHours(1)));
        waiting("lead-2", START.minus(Duration.ofMinutes(10)));

        assertThat(monitor.detectStuckExecutions()).isZero();
        assertThat(monitor.lastOverdueCount()).isZero();
        assertThat(stuckCount()).isZero();
    }

    @Test
    @DisplayName("An overdue execution is reported and its wake re-armed")
    void detect_shouldReportAndRearm() {
        ExecutionInstance stuck = waiting("lead-1", START.minus(Duration.ofHours(2)));

        assertThat(monitor.detectStuckExecutions()).isEqualTo(1);

        List<ExecutionEvent> events = eventRepository.findByExecution(stuck.id());
        assertThat(events).extracting(ExecutionEvent::type).containsExactly(ExecutionEventType.EXECUTION_STUCK);
        assertThat(events.get(0).actorType()).isEqualTo(ExecutionEvent.ACTOR_RECOVERY);
        assertThat(events.get(0).payload().get("overdueBy").asText()).isEqualTo("PT2H");
        assertThat(stuckCount()).isEqualTo(1);
        assertThat(timers.findPending(stuck.id())).map(ScheduledWake::fireAt).contains(START);
    }

    @Test
    @DisplayName("The same wake deadline is reported only once")
    void detect_shouldReportOncePerDeadline() {
        ExecutionInstance stuck = waiting("lead-1", START.minus(Duration.ofHours(2)));
        monitor.detectStuckExecutions();
        clock.advanceMinutes(5);

        assertThat(monitor.detectStuckExecutions()).isZero();

        assertThat(monitor.lastOverdueCount()).isEqualTo(1);
        assertThat(eventRepository.findByExecution(stuck.id())).hasSize(1);
        assertThat(stuckCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Executions that are no longer waiting are not reported")
    void detect_shouldIgnoreNonWaitingExecutions() {
        ExecutionInstance stuck = waiting("lead-1", START.minus(Duration.ofHours(2)));
        instances.update(stuck.toBuilder().status(ExecutionStatus.PAUSED).incrementVersion().build(), stuck.version());

        assertThat(monitor.detectStuckExecutions()).isZero();
    }

    @Test
    void constructor_shouldRejectNonPositiveInterval() {
        assertThatThrownBy(() -> new StuckExecutionMonitor(instances, null, timerService, metrics, clock,
                Duration.ofMinutes(15), Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
