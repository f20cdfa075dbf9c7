package com.leadflow.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.leadflow.core.model.ActionResult;

/**
 * Side-effecting implementation of one action kind.
 *
 * Handlers may be invoked more than once for the same step (retries, a result
 * lost to a concurrent cancel). Use {@link ActionContext#getIdempotencyKey()}
 * when calling external systems.
 */
@FunctionalInterface
public interface ActionHandler {
    
    /**
     * Execute the action.
     * 
     * @param parameters the step's parameters
     * @param context execution context of the step
     * @return the result; failures may be returned or thrown
     * @throws ActionException if the action fails
     */
    ActionResult execute(JsonNode parameters, ActionContext context) throws ActionException;
}
