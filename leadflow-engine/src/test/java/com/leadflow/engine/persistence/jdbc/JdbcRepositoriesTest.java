package com.leadflow.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.leadflow.core.exception.OptimisticLockException;
import com.leadflow.core.model.ExecutionEvent;
import com.leadflow.core.model.ExecutionEventType;
import com.leadflow.core.model.ExecutionInstance;
import com.leadflow.core.model.ExecutionStatus;
import com.leadflow.core.model.RelativeTime;
import com.leadflow.core.model.RetryPolicy;
import com.leadflow.core.model.RuleSet;
import com.leadflow.core.model.SegmentDefinition;
import com.leadflow.core.model.SegmentMembership;
import com.leadflow.core.model.StepDefinition;
import com.leadflow.core.model.StepOutcome;
import com.leadflow.core.model.StepRecord;
import com.leadflow.core.model.WakeAction;
import com.leadflow.core.model.WorkflowDefinition;
import com.leadflow.scheduler.JdbcTimerRepository;
import com.leadflow.scheduler.ScheduledWake;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the JDBC repositories against a real PostgreSQL with the production schema.
 */
@Testcontainers(disabledWithoutDocker = true)
class JdbcRepositoriesTest {

    private static final Instant NOW = Instant.parse("2024-03-15T12:00:00Z");

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15")
        .withDatabaseName("leadflow_test")
        .withUsername("test")
        .withPassword("test");

    private static JdbcTemplate jdbcTemplate;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final DefinitionJsonCodec codec = new DefinitionJsonCodec(objectMapper);

    @BeforeAll
    static void createSchema() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
            postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        new ResourceDatabasePopulator(new ClassPathResource("db/schema.sql")).execute(dataSource);
        jdbcTemplate = new JdbcTemplate(dataSource);
    }

    @BeforeEach
    void truncate() {
        jdbcTemplate.execute("TRUNCATE workflow_definitions, execution_instances, execution_events, "
            + "segments, segment_memberships, scheduled_wakes");
    }

    @Nested
    @DisplayName("Workflow definitions")
    class Definitions {

        private final JdbcWorkflowDefinitionRepository repository =
            new JdbcWorkflowDefinitionRepository(jdbcTemplate, codec);

        private WorkflowDefinition welcome(int version) {
            ObjectNode parameters = objectMapper.createObjectNode().put("template", "welcome-1");
            return WorkflowDefinition.builder("welcome")
                .triggerKind("lead_created")
                .entryRules(RuleSet.builder()
                    .rule("score", "gte", 70)
                    .rule("last_activity_at", "gt", RelativeTime.daysAgo(7))
                    .rule("created_at", "lt", NOW)
                    .rule("source", "in", List.of("chatbot", "web"))
                    .build())
                .step(StepDefinition.builder("send_email").parameters(parameters))
                .step(StepDefinition.builder("send_email").delay(Duration.ofDays(2))
                    .skipIf(RuleSet.builder().rule("converted", "eq", true).build())
                    .maxRetries(5))
                .cooldown(Duration.ofDays(7))
                .maxEntriesPerEntity(3)
                .retryPolicy(RetryPolicy.builder()
                    .initialBackoff(Duration.ofMinutes(1))
                    .nonRetryableErrors(Set.of("UNSUBSCRIBED"))
                    .build())
                .build()
                .asVersion(version, NOW);
        }

        @Test
        void save_shouldRoundTripRulesAndSteps() {
            repository.save(welcome(1));

            WorkflowDefinition loaded = repository.findById("welcome:v1").orElseThrow();

            assertThat(loaded.triggerKind()).isEqualTo("lead_created");
            assertThat(loaded.cooldown()).isEqualTo(Duration.ofDays(7));
            assertThat(loaded.maxEntriesPerEntity()).isEqualTo(3);
            assertThat(loaded.createdAt()).isEqualTo(NOW);
            assertThat(loaded.retryPolicy()).isEqualTo(welcome(1).retryPolicy());

            assertThat(loaded.entryRules().size()).isEqualTo(4);
            assertThat(loaded.entryRules().rules().get(1).value()).isEqualTo(RelativeTime.daysAgo(7));
            assertThat(loaded.entryRules().rules().get(2).value()).isEqualTo(NOW);
            assertThat(loaded.entryRules().rules().get(3).value()).isEqualTo(List.of("chatbot", "web"));

            assertThat(loaded.steps()).hasSize(2);
            assertThat(loaded.steps().get(0).parameters().get("template").asText()).isEqualTo("welcome-1");
            assertThat(loaded.steps().get(1).delay()).isEqualTo(Duration.ofDays(2));
            assertThat(loaded.steps().get(1).skipIf().rules().get(0).value()).isEqualTo(true);
            assertThat(loaded.steps().get(1).maxRetries()).isEqualTo(5);
        }

        @Test
        void versions_shouldBeQueryableByName() {
            assertThat(repository.getNextVersion("welcome")).isEqualTo(1);
            repository.save(welcome(1));
            repository.save(welcome(2));
            repository.setActive("welcome:v1", false);

            assertThat(repository.getNextVersion("welcome")).isEqualTo(3);
            assertThat(repository.findLatest("welcome")).hasValueSatisfying(d -> assertThat(d.version()).isEqualTo(2));
            assertThat(repository.findVersions("welcome")).extracting(WorkflowDefinition::version).containsExactly(1, 2);
            assertThat(repository.findActiveByTriggerKind("lead_created")).extracting(WorkflowDefinition::id)
                .containsExactly("welcome:v2");
            assertThat(repository.setActive("missing:v1", false)).isFalse();
        }
    }

    @Nested
    @DisplayName("Execution instances")
    class Instances {

        private final JdbcExecutionInstanceRepository repository =
            new JdbcExecutionInstanceRepository(jdbcTemplate, codec);

        @Test
        void insertIfNoActive_shouldAllowOneActiveExecution() {
            ExecutionInstance first = ExecutionInstance.create("welcome:v1", "lead-1", "lead_created",
                objectMapper.createObjectNode().put("form", "demo"), NOW);

            assertThat(repository.insertIfNoActive(first)).isTrue();
            assertThat(repository.insertIfNoActive(
                ExecutionInstance.create("welcome:v1", "lead-1", "lead_created", null, NOW))).isFalse();

            ExecutionInstance loaded = repository.findActive("welcome:v1", "lead-1").orElseThrow();
            assertThat(loaded.id()).isEqualTo(first.id());
            assertThat(loaded.context().path(ExecutionInstance.CONTEXT_TRIGGER).path("form").asText()).isEqualTo("demo");
        }

        @Test
        void update_shouldCompareAndSetOnVersion() {
            ExecutionInstance created = ExecutionInstance.create("welcome:v1", "lead-1", "lead_created", null, NOW);
            repository.insertIfNoActive(created);

            ExecutionInstance waiting = created.toBuilder()
                .status(ExecutionStatus.WAITING)
                .pendingWake(WakeAction.ADVANCE)
                .appendStep(new StepRecord(0, "send_email", StepOutcome.SUCCEEDED, 1, NOW))
                .nextWakeAt(NOW.plus(Duration.ofHours(1)))
                .incrementVersion()
                .build();
            repository.update(waiting, created.version());

            ExecutionInstance loaded = repository.findById(created.id()).orElseThrow();
            assertThat(loaded.status()).isEqualTo(ExecutionStatus.WAITING);
            assertThat(loaded.version()).isEqualTo(1);
            assertThat(loaded.pendingWake()).isEqualTo(WakeAction.ADVANCE);
            assertThat(loaded.stepHistory()).hasSize(1);

            assertThatThrownBy(() -> repository.update(waiting, created.version()))
                .isInstanceOf(OptimisticLockException.class);
        }

        @Test
        void queries_shouldCoverFinishedAndOverdueExecutions() {
            ExecutionInstance done = ExecutionInstance.create("welcome:v1", "lead-1", "lead_created", null, NOW);
            repository.insertIfNoActive(done);
            repository.update(done.toBuilder().status(ExecutionStatus.COMPLETED).completedAt(NOW)
                .incrementVersion().build(), 0);

            ExecutionInstance overdue = ExecutionInstance.create("welcome:v1", "lead-2", "lead_created", null, NOW);
            repository.insertIfNoActive(overdue);
            repository.update(overdue.toBuilder().status(ExecutionStatus.WAITING)
                .nextWakeAt(NOW.minus(Duration.ofMinutes(10))).incrementVersion().build(), 0);

            assertThat(repository.findLatestFinished("welcome:v1", "lead-1"))
                .hasValueSatisfying(e -> assertThat(e.id()).isEqualTo(done.id()));
            assertThat(repository.findOverdueWaiting(NOW, 10)).extracting(ExecutionInstance::id)
                .containsExactly(overdue.id());
            assertThat(repository.countByWorkflowAndEntity("welcome:v1", "lead-1")).isEqualTo(1);
            assertThat(repository.findByWorkflow("welcome:v1", null)).hasSize(2);
            assertThat(repository.countByStatus())
                .containsEntry(ExecutionStatus.COMPLETED, 1L)
                .containsEntry(ExecutionStatus.WAITING, 1L);

            // the finished execution no longer blocks a new one
            assertThat(repository.insertIfNoActive(
                ExecutionInstance.create("welcome:v1", "lead-1", "lead_created", null, NOW))).isTrue();
        }
    }

    @Test
    void events_shouldAppendOnceAndKeepSequence() {
        JdbcExecutionEventRepository repository = new JdbcExecutionEventRepository(jdbcTemplate, codec);
        UUID executionId = UUID.randomUUID();
        ObjectNode payload = objectMapper.createObjectNode().put("actionKind", "send_email");

        assertThat(repository.getNextSequenceNumber(executionId)).isEqualTo(1);
        assertThat(repository.append(ExecutionEvent.create(executionId, 1, ExecutionEventType.EXECUTION_CREATED,
            null, NOW, null, "created:" + executionId, ExecutionEvent.ACTOR_SYSTEM, "engine"))).isTrue();
        assertThat(repository.append(ExecutionEvent.create(executionId, 2, ExecutionEventType.STEP_DISPATCHED,
            0, NOW, payload, "dispatched:" + executionId, ExecutionEvent.ACTOR_SYSTEM, "engine"))).isTrue();
        assertThat(repository.append(ExecutionEvent.create(executionId, 3, ExecutionEventType.STEP_DISPATCHED,
            0, NOW, payload, "dispatched:" + executionId, ExecutionEvent.ACTOR_SYSTEM, "engine"))).isFalse();

        List<ExecutionEvent> events = repository.findByExecution(executionId);
        assertThat(events).extracting(ExecutionEvent::type)
            .containsExactly(ExecutionEventType.EXECUTION_CREATED, ExecutionEventType.STEP_DISPATCHED);
        assertThat(events.get(1).stepIndex()).isZero();
        assertThat(events.get(1).payload().get("actionKind").asText()).isEqualTo("send_email");
        assertThat(repository.getNextSequenceNumber(executionId)).isEqualTo(3);
        assertThat(repository.findByIdempotencyKey("created:" + executionId)).isPresent();
    }

    @Test
    void segments_shouldUpsertAndOrderByPriority() {
        JdbcSegmentRepository repository = new JdbcSegmentRepository(jdbcTemplate, codec);
        repository.save(SegmentDefinition.dynamic("warm", "Warm", null,
            RuleSet.builder().rule("score", "gte", 40).build(), 1).withCreatedAt(NOW));
        repository.save(SegmentDefinition.dynamic("hot", "Hot", null,
            RuleSet.builder().rule("score", "gte", 70).build(), 5).withCreatedAt(NOW));
        repository.save(SegmentDefinition.manual("vip", "VIP", null).withCreatedAt(NOW));
        repository.save(SegmentDefinition.dynamic("warm", "Warm leads", null,
            RuleSet.builder().rule("score", "gte", 50).build(), 1).withCreatedAt(NOW));

        assertThat(repository.findActiveDynamic()).extracting(SegmentDefinition::id).containsExactly("hot", "warm");
        assertThat(repository.findById("warm")).hasValueSatisfying(s -> assertThat(s.name()).isEqualTo("Warm leads"));
        assertThat(repository.findAll()).extracting(SegmentDefinition::id).containsExactly("hot", "vip", "warm");
    }

    @Test
    void memberships_shouldKeepClosedSpans() {
        JdbcSegmentMembershipRepository repository = new JdbcSegmentMembershipRepository(jdbcTemplate);
        SegmentMembership first = SegmentMembership.join("hot", "lead-1", NOW,
            SegmentMembership.ADDED_BY_SYSTEM, SegmentMembership.REASON_AUTOMATIC);

        assertThat(repository.insertIfNotMember(first)).isTrue();
        assertThat(repository.insertIfNotMember(SegmentMembership.join("hot", "lead-1", NOW,
            SegmentMembership.ADDED_BY_SYSTEM, SegmentMembership.REASON_AUTOMATIC))).isFalse();
        assertThat(repository.countActive("hot")).isEqualTo(1);

        Instant left = NOW.plus(Duration.ofDays(1));
        assertThat(repository.close(first.id(), left, SegmentMembership.REASON_RULES_NO_LONGER_MATCH)).isTrue();
        assertThat(repository.close(first.id(), left, SegmentMembership.REASON_RULES_NO_LONGER_MATCH)).isFalse();
        assertThat(repository.findActive("hot", "lead-1")).isEmpty();

        assertThat(repository.insertIfNotMember(SegmentMembership.join("hot", "lead-1", left.plusSeconds(60),
            SegmentMembership.ADDED_BY_SYSTEM, SegmentMembership.REASON_AUTOMATIC))).isTrue();

        List<SegmentMembership> history = repository.findHistory("hot", "lead-1");
        assertThat(history).hasSize(2);
        assertThat(history.get(0).leftAt()).isEqualTo(left);
        assertThat(history.get(0).leftReason()).isEqualTo(SegmentMembership.REASON_RULES_NO_LONGER_MATCH);
        assertThat(history.get(1).isActive()).isTrue();
        assertThat(repository.findActiveByEntity("lead-1")).extracting(SegmentMembership::segmentId)
            .containsExactly("hot");
        assertThat(repository.findActiveBySegment("hot")).hasSize(1);
    }

    @Test
    void timers_shouldKeepOnePendingWakePerExecution() {
        JdbcTimerRepository repository = new JdbcTimerRepository(jdbcTemplate);
        UUID executionId = UUID.randomUUID();

        repository.upsert(ScheduledWake.pending(executionId, NOW.plus(Duration.ofHours(2)), NOW));
        repository.upsert(ScheduledWake.pending(executionId, NOW.plus(Duration.ofHours(1)), NOW));

        assertThat(repository.countPending()).isEqualTo(1);
        assertThat(repository.findDue(NOW, 10)).isEmpty();

        List<ScheduledWake> due = repository.findDue(NOW.plus(Duration.ofHours(1)), 10);
        assertThat(due).hasSize(1);
        assertThat(due.get(0).fireAt()).isEqualTo(NOW.plus(Duration.ofHours(1)));

        assertThat(repository.claim(due.get(0).wakeId())).isTrue();
        assertThat(repository.claim(due.get(0).wakeId())).isFalse();
        assertThat(repository.findPending(executionId)).isEmpty();

        repository.upsert(ScheduledWake.pending(executionId, NOW.plus(Duration.ofDays(1)), NOW));
        assertThat(repository.cancelForExecution(executionId)).isEqualTo(1);
        assertThat(repository.countPending()).isZero();
    }

    @Test
    void timers_shouldDeleteWakesWhenClaimed() {
        JdbcTimerRepository repository = new JdbcTimerRepository(jdbcTemplate);
        for (int i = 0; i < 3; i++) {
            repository.upsert(ScheduledWake.pending(UUID.randomUUID(), NOW, NOW));
        }

        for (ScheduledWake wake : repository.findDue(NOW, 10)) {
            assertThat(repository.claim(wake.wakeId())).isTrue();
        }

        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM scheduled_wakes", Long.class)).isZero();
        assertThat(repository.countPending()).isZero();
        assertThat(repository.findDue(NOW.plus(Duration.ofDays(1)), 10)).isEmpty();
    }
}
