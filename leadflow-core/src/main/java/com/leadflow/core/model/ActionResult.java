package com.leadflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of dispatching one step's action.
 */
public record ActionResult(
    boolean success,
    JsonNode output,
    String error,
    String errorCode,
    boolean retriable
) {
    public static ActionResult success(JsonNode output) {
        return new ActionResult(true, output, null, null, false);
    }

    public static ActionResult succeeded() {
        return new ActionResult(true, null, null, null, false);
    }

    public static ActionResult failure(String errorCode, String error, boolean retriable) {
        return new ActionResult(false, null, error, errorCode, retriable);
    }

    /**
     * Failure worth retrying (timeouts, rate limits, unavailable integrations).
     */
    public static ActionResult transientFailure(String errorCode, String error) {
        return failure(errorCode, error, true);
    }

    /**
     * Failure that will not succeed on retry.
     */
    public static ActionResult permanentFailure(String errorCode, String error) {
        return failure(errorCode, error, false);
    }

    public boolean failed() {
        return !success;
    }
}
