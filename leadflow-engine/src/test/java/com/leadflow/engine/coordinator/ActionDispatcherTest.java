package com.leadflow.engine.coordinator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadflow.core.model.ActionResult;
import com.leadflow.core.model.RetryPolicy;
import com.leadflow.engine.coordinator.ActionDispatcher.RetryDecision;
import com.leadflow.engine.metrics.WorkflowMetrics;
import com.leadflow.worker.ActionContext;
import com.leadflow.worker.ActionException;
import com.leadflow.worker.ActionHandlerRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class ActionDispatcherTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private ActionHandlerRegistry registry;
    private ActionDispatcher dispatcher;

    private final RetryPolicy policy = RetryPolicy.builder()
        .initialBackoff(Duration.ofSeconds(30))
        .maxBackoff(Duration.ofMinutes(10))
        .backoffMultiplier(2.0)
        .jitterFactor(0.0)
        .nonRetryableErrors(Set.of("UNSUBSCRIBED"))
        .build();

    @BeforeEach
    void setUp() {
        WorkflowMetrics metrics = new WorkflowMetrics();
        metrics.bindTo(meterRegistry);
        registry = new ActionHandlerRegistry();
        dispatcher = new ActionDispatcher(registry, metrics);
    }

    private ActionContext context() {
        return new ActionContext(UUID.randomUUID(), "welcome:v1", "lead-1", 0, 1, null, objectMapper);
    }

    private ActionResult dispatch(String kind) {
        return dispatcher.dispatch(kind, objectMapper.createObjectNode(), context());
    }

    @Test
    @DisplayName("The registered handler's result is returned and timed")
    void dispatch_shouldReturnHandlerResult() {
        registry.register("send_email", (parameters, context) ->
            ActionResult.success(objectMapper.createObjectNode().put("messageId", "m-7")));

        ActionResult result = dispatch("send_email");

        assertThat(result.success()).isTrue();
        assertThat(result.output().get("messageId").asText()).isEqualTo("m-7");
        assertThat(meterRegistry.find(WorkflowMetrics.STEP_DURATION)
            .tags("action", "send_email", "outcome", "success").timer().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("An unknown action kind is a permanent failure")
    void dispatch_shouldFailUnknownKind() {
        ActionResult result = dispatch("fax");

        assertThat(result.success()).isFalse();
        assertThat(result.retriable()).isFalse();
        assertThat(result.errorCode()).isEqualTo(ActionDispatcher.UNKNOWN_ACTION_KIND);
    }

    @Test
    @DisplayName("A thrown ActionException keeps its code and retryability")
    void dispatch_shouldTranslateActionException() {
        registry.register("crm_update", (parameters, context) -> {
            throw ActionException.transient_("CRM_TIMEOUT", "crm did not answer");
        });

        ActionResult result = dispatch("crm_update");

        assertThat(result.success()).isFalse();
        assertThat(result.errorCode()).isEqualTo("CRM_TIMEOUT");
        assertThat(result.error()).isEqualTo("crm did not answer");
        assertThat(result.retriable()).isTrue();
    }

    @Test
    @DisplayName("An unexpected exception is a retriable handler error")
    void dispatch_shouldTranslateRuntimeException() {
        registry.register("send_sms", (parameters, context) -> {
            throw new IllegalStateException("gateway closed");
        });

        ActionResult result = dispatch("send_sms");

        assertThat(result.errorCode()).isEqualTo(ActionDispatcher.HANDLER_ERROR);
        assertThat(result.retriable()).isTrue();
        assertThat(result.error()).contains("gateway closed");
    }

    @Test
    @DisplayName("A handler returning null is a permanent failure")
    void dispatch_shouldRejectNullResult() {
        registry.register("noop", (parameters, context) -> null);

        ActionResult result = dispatch("noop");

        assertThat(result.errorCode()).isEqualTo(ActionDispatcher.NULL_RESULT);
        assertThat(result.retriable()).isFalse();
    }

    @Test
    @DisplayName("Retriable failures are retried with growing backoff while retries remain")
    void decideRetry_shouldFollowPolicy() {
        ActionResult timeout = ActionResult.transientFailure("TIMEOUT", "timed out");

        RetryDecision first = dispatcher.decideRetry(timeout, 0, 3, policy);
        RetryDecision third = dispatcher.decideRetry(timeout, 2, 3, policy);
        RetryDecision exhausted = dispatcher.decideRetry(timeout, 3, 3, policy);

        assertThat(first.retry()).isTrue();
        assertThat(first.backoff()).isEqualTo(Duration.ofSeconds(30));
        assertThat(third.backoff()).isEqualTo(Duration.ofMinutes(2));
        assertThat(exhausted.retry()).isFalse();
    }

    @Test
    @DisplayName("Permanent failures, excluded codes and successes are never retried")
    void decideRetry_shouldRefuseNonRetriable() {
        assertThat(dispatcher.decideRetry(ActionResult.permanentFailure("BAD_TEMPLATE", "x"), 0, 3, policy).retry())
            .isFalse();
        assertThat(dispatcher.decideRetry(ActionResult.transientFailure("UNSUBSCRIBED", "x"), 0, 3, policy).retry())
            .isFalse();
        assertThat(dispatcher.decideRetry(ActionResult.succeeded(), 0, 3, policy).retry()).isFalse();
        assertThat(dispatcher.decideRetry(ActionResult.transientFailure("TIMEOUT", "x"), 0, 0, policy).retry())
            .isFalse();
    }
}
