package com.leadflow.examples.nurturing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.leadflow.core.model.ActionResult;
import com.leadflow.worker.ActionContext;
import com.leadflow.worker.ActionException;
import com.leadflow.worker.ActionHandlerRegistry;
import com.leadflow.worker.WebhookActionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NurturingActionHandlersTest {

    private static final Instant NOW = Instant.parse("2024-06-03T09:00:00Z");

    private final ObjectMapper mapper = new ObjectMapper();
    private SimulatedClock clock;
    private InMemoryLeadStore leads;
    private NurturingActionHandlers actions;

    @BeforeEach
    void setUp() {
        clock = new SimulatedClock(NOW);
        leads = new InMemoryLeadStore(clock);
        actions = new NurturingActionHandlers(leads, clock);

        Map<String, Object> lead = new HashMap<>();
        lead.put(LeadSchema.NAME, "Ana");
        lead.put(LeadSchema.EMAIL, "ana@acme.io");
        lead.put(LeadSchema.SCORE, 90);
        lead.put(LeadSchema.STATUS, "new");
        lead.put(LeadSchema.TAGS, new ArrayList<>(List.of("newsletter")));
        leads.save("lead-1", lead);
    }

    private ActionContext context(UUID executionId, int stepIndex) {
        return new ActionContext(executionId, "wf:v1", "lead-1", stepIndex, 1, null, mapper);
    }

    private ActionContext context() {
        return context(UUID.randomUUID(), 0);
    }

    private ObjectNode params() {
        return mapper.createObjectNode();
    }

    @Test
    @DisplayName("A message is sent once per step, even when the step is replayed")
    void sendMessage_shouldBeIdempotentPerStep() throws ActionException {
        ActionContext step = context();
        ObjectNode parameters = params().put("template", "welcome").put("subject", "Hi");

        ActionResult first = actions.sendMessage(parameters, step);
        ActionResult replay = actions.sendMessage(parameters, step);

        assertThat(first.success()).isTrue();
        assertThat(replay.output().get("messageId")).isEqualTo(first.output().get("messageId"));
        assertThat(actions.sentMessages()).singleElement().satisfies(message -> {
            assertThat(message.channel()).isEqualTo(NurturingActionHandlers.CHANNEL_EMAIL);
            assertThat(message.address()).isEqualTo("ana@acme.io");
            assertThat(message.sentAt()).isEqualTo(NOW);
        });
    }

    @Test
    @DisplayName("Unsubscribed leads and missing addresses fail permanently")
    void sendMessage_shouldFailPermanentlyWithoutConsent() throws ActionException {
        ActionResult noPhone = actions.sendMessage(params().put("channel", "sms").put("template", "t"), context());
        leads.update("lead-1", lead -> lead.put(LeadSchema.STATUS, NurturingActionHandlers.STATUS_UNSUBSCRIBED));
        ActionResult unsubscribed = actions.sendMessage(params().put("template", "t"), context());

        assertThat(noPhone.retriable()).isFalse();
        assertThat(noPhone.errorCode()).isEqualTo("NO_PHONE_NUMBER");
        assertThat(unsubscribed.retriable()).isFalse();
        assertThat(unsubscribed.errorCode()).isEqualTo("UNSUBSCRIBED");
        assertThat(actions.sentMessages()).isEmpty();
    }

    @Test
    @DisplayName("Provider outages are transient failures")
    void sendMessage_shouldReportTransientOutage() throws ActionException {
        actions.failNextSends(1);
        ActionContext step = context();

        ActionResult outage = actions.sendMessage(params().put("template", "t"), step);
        ActionResult retry = actions.sendMessage(params().put("template", "t"), step);

        assertThat(outage.retriable()).isTrue();
        assertThat(outage.errorCode()).isEqualTo("PROVIDER_UNAVAILABLE");
        assertThat(retry.success()).isTrue();
    }

    @Test
    @DisplayName("Invalid message parameters are rejected")
    void sendMessage_shouldRejectInvalidParameters() {
        assertThatThrownBy(() -> actions.sendMessage(params().put("channel", "fax").put("template", "t"), context()))
            .isInstanceOfSatisfying(ActionException.class, e -> assertThat(e.isRetryable()).isFalse());
        assertThatThrownBy(() -> actions.sendMessage(params(), context()))
            .isInstanceOf(ActionException.class)
            .hasMessageContaining("template");
    }

    @Test
    @DisplayName("Score changes are clamped to 0..100 and applied once per step")
    void updateScore_shouldClampAndApplyOnce() throws ActionException {
        ActionContext step = context();

        ActionResult raised = actions.updateScore(params().put("delta", 25), step);
        ActionResult replay = actions.updateScore(params().put("delta", 25), step);
        actions.updateScore(params().put("score_change", -500), context());

        assertThat(raised.output().get("to").asInt()).isEqualTo(100);
        assertThat(replay.output().get("applied").asBoolean()).isFalse();
        assertThat(leads.attribute("lead-1", LeadSchema.SCORE)).isEqualTo(0);
        assertThat(leads.attribute("lead-1", LeadSchema.UPDATED_AT)).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Tags are added without duplicates and removed")
    void tags_shouldBeAddedAndRemoved() throws ActionException {
        actions.addTag(params().put("tag", "hot"), context());
        actions.addTag(params().put("tag", "hot"), context());
        actions.removeTag(params().put("tag", "newsletter"), context());

        assertThat(leads.attribute("lead-1", LeadSchema.TAGS)).isEqualTo(List.of("hot"));
    }

    @Test
    @DisplayName("Segment changes report the previous segment")
    void changeSegment_shouldReportTransition() throws ActionException {
        actions.changeSegment(params().put("segment", "warm"), context());
        ActionResult result = actions.changeSegment(params().put("segment", "hot"), context());

        assertThat(result.output().get("from").asText()).isEqualTo("warm");
        assertThat(leads.attribute("lead-1", LeadSchema.SEGMENT)).isEqualTo("hot");
    }

    @Test
    @DisplayName("Only declared scalar fields can be updated, with values of their type")
    void updateField_shouldFollowSchema() throws ActionException {
        actions.updateField(params().put("field", LeadSchema.COMPANY).put("value", "Acme"), context());
        actions.updateField(params().put("field", LeadSchema.LAST_INTERACTION_AT)
            .put("value", "2024-06-01T10:00:00Z"), context());

        assertThat(leads.attribute("lead-1", LeadSchema.COMPANY)).isEqualTo("Acme");
        assertThat(leads.attribute("lead-1", LeadSchema.LAST_INTERACTION_AT))
            .isEqualTo(Instant.parse("2024-06-01T10:00:00Z"));
        assertThatThrownBy(() -> actions.updateField(params().put("field", "salary").put("value", 1), context()))
            .isInstanceOfSatisfying(ActionException.class,
                e -> assertThat(e.getErrorCode()).isEqualTo("UNKNOWN_FIELD"));
        assertThatThrownBy(() -> actions.updateField(params().put("field", LeadSchema.TAGS).put("value", "x"), context()))
            .isInstanceOfSatisfying(ActionException.class,
                e -> assertThat(e.getErrorCode()).isEqualTo("UNSUPPORTED_FIELD"));
        assertThatThrownBy(() -> actions.updateField(params().put("field", LeadSchema.SCORE).put("value", "high"), context()))
            .isInstanceOf(ActionException.class);
    }

    @Test
    @DisplayName("Tasks and notifications are recorded once per step")
    void teamFollowUp_shouldBeRecordedOnce() throws ActionException {
        ActionContext step = context();
        ObjectNode task = params().put("title", "Call").put("assignee", "sales").put("due_in", "PT4H");

        actions.createTask(task, step);
        actions.createTask(task, step);
        actions.sendNotification(params().put("message", "Hot lead"), step);
        actions.sendNotification(params().put("message", "Hot lead"), step);

        assertThat(actions.tasks()).singleElement().satisfies(created -> {
            assertThat(created.dueAt()).isEqualTo(NOW.plus(Duration.ofHours(4)));
            assertThat(created.assignee()).isEqualTo("sales");
        });
        assertThat(actions.notifications()).singleElement()
            .satisfies(notification -> assertThat(notification.channel()).isEqualTo("slack"));
    }

    @Test
    @DisplayName("Actions on unknown leads fail permanently")
    void actions_shouldRejectUnknownLead() {
        ActionContext ghost = new ActionContext(UUID.randomUUID(), "wf:v1", "ghost", 0, 1, null, mapper);

        assertThatThrownBy(() -> actions.addTag(params().put("tag", "x"), ghost))
            .isInstanceOfSatisfying(ActionException.class, e -> {
                assertThat(e.getErrorCode()).isEqualTo("LEAD_NOT_FOUND");
                assertThat(e.isRetryable()).isFalse();
            });
    }

    @Test
    @DisplayName("Every nurturing action kind is registered")
    void registerAll_shouldRegisterEveryKind() {
        ActionHandlerRegistry registry = actions.registerAll(ActionHandlerRegistry.withBuiltIns(),
            new WebhookActionHandler(Duration.ofSeconds(1), Duration.ofSeconds(1)));

        assertThat(registry.kinds()).containsExactlyInAnyOrder(
            "wait", "send_message", "update_score", "add_tag", "remove_tag", "change_segment",
            "update_field", "create_task", "send_notification", "call_webhook");
    }
}
