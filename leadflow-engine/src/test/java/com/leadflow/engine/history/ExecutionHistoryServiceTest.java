package com.leadflow.engine.history;

import com.leadflow.core.exception.NotFoundException;
import com.leadflow.core.model.ActionResult;
import com.leadflow.core.model.ExecutionStatus;
import com.leadflow.core.model.StepDefinition;
import com.leadflow.core.model.WorkflowDefinition;
import com.leadflow.engine.history.ExecutionHistoryService.ExecutionHistory;
import com.leadflow.engine.history.ExecutionHistoryService.StepHistory;
import com.leadflow.engine.history.ExecutionHistoryService.TimelineEntry;
import com.leadflow.engine.history.ExecutionHistoryService.WorkflowStats;
import com.leadflow.engine.test.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ExecutionHistoryServiceTest {

    private EngineFixture fixture;
    private WorkflowDefinition definition;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        fixture.entity("lead-a", "score", 80);
        fixture.entity("lead-b", "score", 90);
        fixture.email.answer((ctx, n) -> ctx.getEntityId().equals("lead-b")
            ? ActionResult.permanentFailure("BOUNCED", "mailbox does not exist")
            : ActionResult.succeeded());
        definition = fixture.definitionService.publish(WorkflowDefinition.builder("welcome")
            .triggerKind("lead_created")
            .step(StepDefinition.builder("send_email"))
            .step(StepDefinition.builder("send_email").delay(Duration.ofHours(1)))
            .build());
    }

    private UUID start(String entityId) {
        return fixture.triggerMatcher.onTrigger("lead_created", entityId, null).get(0);
    }

    @Test
    void getHistory_shouldGroupEventsByStep() {
        UUID executionId = start("lead-a");
        fixture.advanceAndPoll(Duration.ofHours(1));

        ExecutionHistory history = fixture.history.getHistory(executionId);

        assertThat(history.currentStatus()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(history.workflowId()).isEqualTo(definition.id());
        assertThat(history.stepHistory()).containsOnlyKeys(0, 1);

        StepHistory second = history.stepHistory().get(1);
        assertThat(second.actionKind()).isEqualTo("send_email");
        assertThat(second.dispatches()).isEqualTo(1);
        assertThat(second.lastOutcome()).isEqualTo("STEP_SUCCEEDED");

        assertThat(history.statistics().finishedSteps()).isEqualTo(2);
        assertThat(history.statistics().dispatches()).isEqualTo(2);
        assertThat(history.statistics().failures()).isZero();
        assertThat(history.statistics().totalDuration()).isEqualTo(Duration.ofHours(1));
    }

    @Test
    void timeline_shouldFollowSequenceOrder() {
        UUID executionId = start("lead-a");
        fixture.advanceAndPoll(Duration.ofHours(1));

        List<TimelineEntry> timeline = fixture.history.timeline(executionId);

        assertThat(timeline).isNotEmpty();
        assertThat(timeline.get(0).eventType()).isEqualTo("EXECUTION_CREATED");
        assertThat(timeline.get(timeline.size() - 1).eventType()).isEqualTo("EXECUTION_COMPLETED");
        assertThat(timeline).extracting(TimelineEntry::sequenceNumber).isSorted();
    }

    @Test
    void getHistory_shouldRecordFailure() {
        UUID executionId = start("lead-b");

        ExecutionHistory history = fixture.history.getHistory(executionId);

        assertThat(history.currentStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(history.stepHistory().get(0).lastOutcome()).isEqualTo("STEP_FAILED");
        assertThat(history.statistics().failures()).isEqualTo(1);
        assertThat(history.statistics().retries()).isZero();
    }

    @Test
    void getHistory_shouldRejectUnknownExecution() {
        assertThatThrownBy(() -> fixture.history.getHistory(UUID.randomUUID()))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void workflowStats_shouldSummarizeWindow() {
        start("lead-a");
        start("lead-b");
        fixture.advanceAndPoll(Duration.ofHours(1));

        WorkflowStats stats = fixture.history.workflowStats(definition.id(), Duration.ofDays(1));

        assertThat(stats.totalExecutions()).isEqualTo(2);
        assertThat(stats.byStatus().get(ExecutionStatus.COMPLETED)).isEqualTo(1);
        assertThat(stats.byStatus().get(ExecutionStatus.FAILED)).isEqualTo(1);
        assertThat(stats.completionRate()).isCloseTo(0.5, within(1e-9));
        assertThat(stats.failureRate()).isCloseTo(0.5, within(1e-9));
        assertThat(stats.averageCompletionTime()).isEqualTo(Duration.ofHours(1));
    }

    @Test
    void workflowStats_shouldExcludeExecutionsOutsideWindow() {
        start("lead-a");
        fixture.advanceAndPoll(Duration.ofDays(3));

        WorkflowStats stats = fixture.history.workflowStats(definition.id(), Duration.ofDays(1));

        assertThat(stats.totalExecutions()).isZero();
        assertThat(stats.completionRate()).isZero();
    }
}
