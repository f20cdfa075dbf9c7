package com.leadflow.engine.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.leadflow.core.model.ActionResult;
import com.leadflow.core.model.RetryPolicy;
import com.leadflow.engine.metrics.WorkflowMetrics;
import com.leadflow.worker.ActionContext;
import com.leadflow.worker.ActionException;
import com.leadflow.worker.ActionHandler;
import com.leadflow.worker.ActionHandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Invokes the registered handler for a step's action kind and turns every
 * way a handler can end into an {@link ActionResult}.
 *
 * Handlers never see the execution store; the dispatcher never throws.
 */
public class ActionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ActionDispatcher.class);

    public static final String UNKNOWN_ACTION_KIND = "UNKNOWN_ACTION_KIND";
    public static final String HANDLER_ERROR = "HANDLER_ERROR";
    public static final String NULL_RESULT = "NULL_RESULT";

    private final ActionHandlerRegistry registry;
    private final WorkflowMetrics metrics;

    public ActionDispatcher(ActionHandlerRegistry registry, WorkflowMetrics metrics) {
        this.registry = registry;
        this.metrics = metrics;
    }

    /**
     * Run the handler registered for an action kind.
     *
     * @return the handler's result, or a failure describing why there is none
     */
    public ActionResult dispatch(String actionKind, JsonNode parameters, ActionContext context) {
        Optional<ActionHandler> handler = registry.find(actionKind);
        if (handler.isEmpty()) {
            log.error("No handler registered for action kind '{}'", actionKind);
            metrics.stepDispatched(actionKind, "unknown", Duration.ZERO);
            return ActionResult.permanentFailure(UNKNOWN_ACTION_KIND,
                "No handler registered for action kind: " + actionKind);
        }

        long start = System.nanoTime();
        ActionResult result;
        try {
            result = handler.get().execute(parameters, context);
            if (result == null) {
                result = ActionResult.permanentFailure(NULL_RESULT,
                    "Handler for " + actionKind + " returned no result");
            }
        } catch (ActionException e) {
            log.warn("Action {} failed: {} - {}", actionKind, e.getErrorCode(), e.getMessage());
            result = ActionResult.failure(e.getErrorCode(), e.getMessage(), e.isRetryable());
        } catch (RuntimeException e) {
            log.error("Action {} threw unexpectedly", actionKind, e);
            result = ActionResult.transientFailure(HANDLER_ERROR,
                e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        metrics.stepDispatched(actionKind, result.success() ? "success" : "failure", elapsed);
        log.debug("Action {} finished in {} ms (success={})", actionKind, elapsed.toMillis(), result.success());
        return result;
    }

    /**
     * Decide whether a failed step is dispatched again.
     *
     * A retry needs a retriable result, a code the policy does not exclude
     * and retries left on the step.
     *
     * @param retriesSoFar retries already scheduled for the current step
     */
    public RetryDecision decideRetry(ActionResult result, int retriesSoFar, int maxRetries, RetryPolicy policy) {
        if (result.success()) {
            return RetryDecision.noRetry();
        }
        if (!result.retriable() || !policy.shouldRetry(result.errorCode())) {
            return RetryDecision.noRetry();
        }
        if (retriesSoFar >= maxRetries) {
            return RetryDecision.noRetry();
        }
        return RetryDecision.retryAfter(policy.computeBackoff(retriesSoFar + 1));
    }

    /**
     * Outcome of {@link #decideRetry}.
     */
    public record RetryDecision(boolean retry, Duration backoff) {

        public static RetryDecision noRetry() {
            return new RetryDecision(false, Duration.ZERO);
        }

        public static RetryDecision retryAfter(Duration backoff) {
            return new RetryDecision(true, backoff);
        }
    }
}
