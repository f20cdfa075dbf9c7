package com.leadflow.engine.coordinator;

import com.leadflow.core.exception.NotFoundException;
import com.leadflow.core.exception.RuleValidationException;
import com.leadflow.core.exception.WorkflowValidationException;
import com.leadflow.core.model.RuleSet;
import com.leadflow.core.model.StepDefinition;
import com.leadflow.core.model.WorkflowDefinition;
import com.leadflow.engine.test.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowDefinitionServiceTest {

    private EngineFixture fixture;
    private WorkflowDefinitionService service;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        service = fixture.definitionService;
    }

    private WorkflowDefinition.Builder draft() {
        return WorkflowDefinition.builder("reengagement")
            .triggerKind("lead_inactive")
            .entryRules(RuleSet.builder().rule("days_since_last_activity", "gte", 30).build())
            .step(StepDefinition.builder("send_email"))
            .step(StepDefinition.builder("wait").delay(Duration.ofDays(3)))
            .step(StepDefinition.builder("send_email"));
    }

    @Test
    @DisplayName("Publishing assigns the next version and a versioned id")
    void publish_shouldAssignVersion() {
        WorkflowDefinition v1 = service.publish(draft().build());
        WorkflowDefinition v2 = service.publish(draft().build());

        assertThat(v1.id()).isEqualTo("reengagement:v1");
        assertThat(v2.id()).isEqualTo("reengagement:v2");
        assertThat(v2.version()).isEqualTo(2);
        assertThat(v2.createdAt()).isEqualTo(EngineFixture.START);
    }

    @Test
    @DisplayName("Publishing a new version deactivates the previous one")
    void publish_shouldDeactivatePreviousVersion() {
        service.publish(draft().build());
        service.publish(draft().build());

        List<WorkflowDefinition> versions = service.versions("reengagement");

        assertThat(versions).extracting(WorkflowDefinition::active).containsExactly(false, true);
        assertThat(service.activeDefinitions()).extracting(WorkflowDefinition::id).containsExactly("reengagement:v2");
        assertThat(fixture.cache.activeByTriggerKind("lead_inactive"))
            .extracting(WorkflowDefinition::id).containsExactly("reengagement:v2");
    }

    @Test
    @DisplayName("Old versions stay readable for executions that reference them")
    void getDefinition_shouldReturnInactiveVersion() {
        service.publish(draft().build());
        service.publish(draft().build());

        assertThat(service.getDefinition("reengagement:v1").stepCount()).isEqualTo(3);
        assertThat(fixture.cache.definition("reengagement:v1")).isPresent();
        assertThatThrownBy(() -> service.getDefinition("reengagement:v9")).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Deactivating a version removes it from trigger matching")
    void deactivate_shouldRemoveFromTriggerMatching() {
        WorkflowDefinition v1 = service.publish(draft().build());
        assertThat(fixture.cache.activeByTriggerKind("lead_inactive")).hasSize(1);

        service.deactivate(v1.id());

        assertThat(fixture.cache.activeByTriggerKind("lead_inactive")).isEmpty();
        assertThatThrownBy(() -> service.deactivate("unknown:v1")).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Workflows without steps are rejected")
    void publish_shouldRejectEmptySteps() {
        WorkflowDefinition empty = WorkflowDefinition.builder("empty").triggerKind("lead_created").build();

        assertThatThrownBy(() -> service.publish(empty)).isInstanceOf(WorkflowValidationException.class);
    }

    @Test
    @DisplayName("Names and trigger kinds are required")
    void publish_shouldRejectMissingNameOrTrigger() {
        assertThatThrownBy(() -> service.publish(WorkflowDefinition.builder("no-trigger")
                .step(StepDefinition.builder("send_email")).build()))
            .isInstanceOf(WorkflowValidationException.class);
        assertThatThrownBy(() -> service.publish(WorkflowDefinition.builder("bad:name")
                .triggerKind("lead_created").step(StepDefinition.builder("send_email")).build()))
            .isInstanceOf(WorkflowValidationException.class);
    }

    @Test
    @DisplayName("Steps must reference a registered action kind")
    void publish_shouldRejectUnknownActionKind() {
        WorkflowDefinition draft = WorkflowDefinition.builder("welcome")
            .triggerKind("lead_created")
            .step(StepDefinition.builder("carrier_pigeon"))
            .build();

        assertThatThrownBy(() -> service.publish(draft))
            .isInstanceOf(WorkflowValidationException.class)
            .hasMessageContaining("carrier_pigeon");
    }

    @Test
    @DisplayName("Only one concurrent execution per entity is supported")
    void publish_shouldRejectConcurrency() {
        WorkflowDefinition draft = draft().maxConcurrentPerEntity(2).build();

        assertThatThrownBy(() -> service.publish(draft)).isInstanceOf(WorkflowValidationException.class);
    }

    @Test
    @DisplayName("Entry rules and skip_if rules are type checked")
    void publish_shouldValidateRules() {
        WorkflowDefinition badEntry = draft()
            .entryRules(RuleSet.builder().rule("score", "starts_with", 10).build())
            .build();
        WorkflowDefinition badGuard = WorkflowDefinition.builder("guarded")
            .triggerKind("lead_created")
            .step(StepDefinition.builder("send_email")
                .skipIf(RuleSet.builder().rule("favourite_color", "eq", "blue").build()))
            .build();

        assertThatThrownBy(() -> service.publish(badEntry)).isInstanceOf(RuleValidationException.class);
        assertThatThrownBy(() -> service.publish(badGuard)).isInstanceOf(RuleValidationException.class);
        assertThat(service.versions("reengagement")).isEmpty();
    }
}
