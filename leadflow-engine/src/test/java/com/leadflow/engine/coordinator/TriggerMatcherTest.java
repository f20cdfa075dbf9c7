package com.leadflow.engine.coordinator;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.leadflow.core.exception.DuplicateExecutionException;
import com.leadflow.core.exception.NotFoundException;
import com.leadflow.core.model.ExecutionInstance;
import com.leadflow.core.model.ExecutionStatus;
import com.leadflow.core.model.RuleSet;
import com.leadflow.core.model.StepDefinition;
import com.leadflow.core.model.WorkflowDefinition;
import com.leadflow.core.rule.RuleEvaluation;
import com.leadflow.engine.metrics.WorkflowMetrics;
import com.leadflow.engine.test.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TriggerMatcherTest {

    private static final String LEAD_CREATED = "lead_created";

    private EngineFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        fixture.entity("hot-lead", "score", 85, "source", "chatbot");
        fixture.entity("cold-lead", "score", 20, "source", "web");
    }

    private WorkflowDefinition publish(WorkflowDefinition.Builder builder) {
        return fixture.definitionService.publish(builder.build());
    }

    private WorkflowDefinition.Builder hotLeadWorkflow() {
        return WorkflowDefinition.builder("hot-lead-welcome")
            .triggerKind(LEAD_CREATED)
            .entryRules(RuleSet.builder().rule("score", "gte", 70).build())
            .step(StepDefinition.builder("send_email"));
    }

    private double evaluations(String outcome) {
        return fixture.counter(WorkflowMetrics.TRIGGER_EVALUATIONS, "trigger", LEAD_CREATED, "outcome", outcome);
    }

    @Test
    @DisplayName("An entity matching the entry rules starts an execution")
    void onTrigger_shouldStartMatchingWorkflow() {
        WorkflowDefinition definition = publish(hotLeadWorkflow());

        List<UUID> started = fixture.triggerMatcher.onTrigger(LEAD_CREATED, "hot-lead", null);

        assertThat(started).hasSize(1);
        ExecutionInstance execution = fixture.stateMachine.getExecution(started.get(0));
        assertThat(execution.workflowId()).isEqualTo(definition.id());
        assertThat(execution.entityId()).isEqualTo("hot-lead");
        assertThat(execution.triggerKind()).isEqualTo(LEAD_CREATED);
        assertThat(execution.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(evaluations("matched")).isEqualTo(1);
    }

    @Test
    @DisplayName("An entity failing the entry rules is not enrolled")
    void onTrigger_shouldSkipNonMatchingEntity() {
        publish(hotLeadWorkflow());

        assertThat(fixture.triggerMatcher.onTrigger(LEAD_CREATED, "cold-lead", null)).isEmpty();
        assertThat(fixture.email.invocationCount()).isZero();
        assertThat(evaluations("not_matched")).isEqualTo(1);
    }

    @Test
    @DisplayName("Only workflows listening to the trigger kind are evaluated")
    void onTrigger_shouldIgnoreOtherTriggerKinds() {
        publish(hotLeadWorkflow());

        assertThat(fixture.triggerMatcher.onTrigger("form_submitted", "hot-lead", null)).isEmpty();
    }

    @Test
    @DisplayName("Unknown entities start nothing")
    void onTrigger_shouldIgnoreUnknownEntity() {
        publish(hotLeadWorkflow());

        assertThat(fixture.triggerMatcher.onTrigger(LEAD_CREATED, "ghost", null)).isEmpty();
    }

    @Test
    @DisplayName("Entry rules can read the trigger payload")
    void onTrigger_shouldEvaluateTriggerFields() {
        publish(WorkflowDefinition.builder("demo-follow-up")
            .triggerKind(LEAD_CREATED)
            .entryRules(RuleSet.builder().rule("trigger.form", "eq", "demo_request").build())
            .step(StepDefinition.builder("send_email")));
        ObjectNode demo = fixture.objectMapper.createObjectNode().put("form", "demo_request");
        ObjectNode newsletter = fixture.objectMapper.createObjectNode().put("form", "newsletter");

        assertThat(fixture.triggerMatcher.onTrigger(LEAD_CREATED, "cold-lead", newsletter)).isEmpty();
        assertThat(fixture.triggerMatcher.onTrigger(LEAD_CREATED, "cold-lead", demo)).hasSize(1);
    }

    @Test
    @DisplayName("An entry rule that cannot be evaluated does not block other workflows")
    void onTrigger_shouldIsolateEvaluationErrors() {
        fixture.entity("hot-lead", "score", 85, "status", "qualified");
        publish(WorkflowDefinition.builder("broken")
            .triggerKind(LEAD_CREATED)
            .entryRules(RuleSet.builder().rule("status_events", "gt", 0).build())
            .step(StepDefinition.builder("send_email")));
        publish(hotLeadWorkflow());

        List<UUID> started = fixture.triggerMatcher.onTrigger(LEAD_CREATED, "hot-lead", null);

        assertThat(started).hasSize(1);
        assertThat(fixture.stateMachine.getExecution(started.get(0)).workflowId()).isEqualTo("hot-lead-welcome:v1");
        assertThat(evaluations("error")).isEqualTo(1);
        assertThat(fixture.counter(WorkflowMetrics.RULE_ERRORS, "scope", "entry")).isEqualTo(1);
    }

    @Test
    @DisplayName("A second trigger while an execution is active is deduplicated")
    void onTrigger_shouldDeduplicateActiveExecution() {
        publish(hotLeadWorkflow().step(StepDefinition.builder("send_email").delay(Duration.ofDays(3))));

        List<UUID> first = fixture.triggerMatcher.onTrigger(LEAD_CREATED, "hot-lead", null);
        List<UUID> second = fixture.triggerMatcher.onTrigger(LEAD_CREATED, "hot-lead", null);

        assertThat(first).hasSize(1);
        assertThat(second).isEmpty();
        assertThat(evaluations("duplicate")).isEqualTo(1);
    }

    @Test
    @DisplayName("Concurrent duplicate triggers start exactly one execution")
    void onTrigger_shouldStartOneExecutionForConcurrentDuplicates() throws Exception {
        WorkflowDefinition definition =
            publish(hotLeadWorkflow().step(StepDefinition.builder("send_email").delay(Duration.ofDays(3))));
        int threads = 64;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch ready = new CountDownLatch(threads);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<List<UUID>>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(executor.submit(() -> {
                    ready.countDown();
                    go.await();
                    return fixture.triggerMatcher.onTrigger(LEAD_CREATED, "hot-lead", null);
                }));
            }
            assertThat(ready.await(10, TimeUnit.SECONDS)).isTrue();
            go.countDown();

            List<UUID> started = new ArrayList<>();
            for (Future<List<UUID>> result : results) {
                started.addAll(result.get(30, TimeUnit.SECONDS));
            }

            assertThat(started).hasSize(1);
            assertThat(fixture.stateMachine.findActive(definition.id(), "hot-lead"))
                .map(ExecutionInstance::id)
                .contains(started.get(0));
            assertThat(fixture.instanceRepository.countByWorkflowAndEntity(definition.id(), "hot-lead")).isEqualTo(1);
            assertThat(evaluations("duplicate")).isEqualTo(threads - 1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Re-entry is blocked until the cooldown after the last finished execution")
    void onTrigger_shouldHonorCooldown() {
        publish(hotLeadWorkflow().cooldown(Duration.ofDays(7)));

        assertThat(fixture.triggerMatcher.onTrigger(LEAD_CREATED, "hot-lead", null)).hasSize(1);

        fixture.clock.advanceDays(6);
        assertThat(fixture.triggerMatcher.onTrigger(LEAD_CREATED, "hot-lead", null)).isEmpty();
        assertThat(evaluations("cooldown")).isEqualTo(1);

        fixture.clock.advanceDays(1);
        assertThat(fixture.triggerMatcher.onTrigger(LEAD_CREATED, "hot-lead", null)).hasSize(1);
    }

    @Test
    @DisplayName("An entity enters a workflow at most maxEntriesPerEntity times")
    void onTrigger_shouldHonorEntryLimit() {
        publish(hotLeadWorkflow().maxEntriesPerEntity(2));

        assertThat(fixture.triggerMatcher.onTrigger(LEAD_CREATED, "hot-lead", null)).hasSize(1);
        assertThat(fixture.triggerMatcher.onTrigger(LEAD_CREATED, "hot-lead", null)).hasSize(1);
        assertThat(fixture.triggerMatcher.onTrigger(LEAD_CREATED, "hot-lead", null)).isEmpty();

        assertThat(evaluations("entry_limit")).isEqualTo(1);
        assertThat(fixture.instanceRepository.countByWorkflowAndEntity("hot-lead-welcome:v1", "hot-lead"))
            .isEqualTo(2);
    }

    @Test
    @DisplayName("Deactivated workflows no longer enroll entities")
    void onTrigger_shouldIgnoreInactiveWorkflow() {
        WorkflowDefinition definition = publish(hotLeadWorkflow());
        fixture.definitionService.deactivate(definition.id());

        assertThat(fixture.triggerMatcher.onTrigger(LEAD_CREATED, "hot-lead", null)).isEmpty();
    }

    @Test
    @DisplayName("New triggers go to the latest published version")
    void onTrigger_shouldUseLatestVersion() {
        publish(hotLeadWorkflow());
        WorkflowDefinition v2 = publish(hotLeadWorkflow().step(StepDefinition.builder("wait")));

        List<UUID> started = fixture.triggerMatcher.onTrigger(LEAD_CREATED, "hot-lead", null);

        assertThat(started).hasSize(1);
        assertThat(fixture.stateMachine.getExecution(started.get(0)).workflowId()).isEqualTo(v2.id());
    }

    @Test
    @DisplayName("Manual enrollment bypasses entry rules but not deduplication")
    void enroll_shouldBypassEntryRules() {
        WorkflowDefinition definition = publish(hotLeadWorkflow()
            .step(StepDefinition.builder("send_email").delay(Duration.ofDays(1))));

        ExecutionInstance enrolled = fixture.triggerMatcher.enroll(definition.id(), "cold-lead", null);

        assertThat(enrolled.triggerKind()).isEqualTo(TriggerMatcher.MANUAL_TRIGGER);
        assertThat(enrolled.status()).isEqualTo(ExecutionStatus.WAITING);
        assertThatThrownBy(() -> fixture.triggerMatcher.enroll(definition.id(), "cold-lead", null))
            .isInstanceOfSatisfying(DuplicateExecutionException.class,
                e -> assertThat(e.getExistingExecutionId()).isEqualTo(enrolled.id()));
    }

    @Test
    @DisplayName("Manual enrollment into an unknown workflow fails")
    void enroll_shouldRejectUnknownWorkflow() {
        assertThatThrownBy(() -> fixture.triggerMatcher.enroll("nope:v1", "hot-lead", null))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Entry rules can be evaluated without enrolling")
    void evaluateEntry_shouldReportFailedRule() {
        WorkflowDefinition definition = publish(hotLeadWorkflow());

        RuleEvaluation cold = fixture.triggerMatcher.evaluateEntry(definition, "cold-lead", null);
        RuleEvaluation hot = fixture.triggerMatcher.evaluateEntry(definition, "hot-lead", null);

        assertThat(cold.isMatched()).isFalse();
        assertThat(cold.failedRule().field()).isEqualTo("score");
        assertThat(hot.isMatched()).isTrue();
        assertThat(fixture.instanceRepository.findByEntity("hot-lead")).isEmpty();
        assertThatThrownBy(() -> fixture.triggerMatcher.evaluateEntry(definition, "ghost", null))
            .isInstanceOf(NotFoundException.class);
    }
}
