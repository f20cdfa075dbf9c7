package com.leadflow.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.leadflow.core.model.ExecutionInstance;

import java.util.UUID;

/**
 * Context provided to action handlers for one step attempt.
 */
public class ActionContext {
    
    private final UUID executionId;
    private final String workflowId;
    private final String entityId;
    private final int stepIndex;
    private final int attempt;
    private final JsonNode executionContext;
    private final ObjectMapper objectMapper;
    
    public ActionContext(
            UUID executionId,
            String workflowId,
            String entityId,
            int stepIndex,
            int attempt,
            JsonNode executionContext,
            ObjectMapper objectMapper) {
        this.executionId = executionId;
        this.workflowId = workflowId;
        this.entityId = entityId;
        this.stepIndex = stepIndex;
        this.attempt = attempt;
        this.executionContext = executionContext != null ? executionContext : MissingNode.getInstance();
        this.objectMapper = objectMapper;
    }
    
    /**
     * Context for the current step of an execution. Attempts are numbered from 1.
     * The handler gets its own copy of the execution context.
     */
    public static ActionContext forExecution(ExecutionInstance instance, ObjectMapper objectMapper) {
        return new ActionContext(
            instance.id(),
            instance.workflowId(),
            instance.entityId(),
            instance.currentStepIndex(),
            instance.retryCountForCurrentStep() + 1,
            instance.context().deepCopy(),
            objectMapper
        );
    }
    
    public UUID getExecutionId() {
        return executionId;
    }
    
    public String getWorkflowId() {
        return workflowId;
    }
    
    public String getEntityId() {
        return entityId;
    }
    
    public int getStepIndex() {
        return stepIndex;
    }
    
    /**
     * Get the attempt number, starting at 1.
     */
    public int getAttempt() {
        return attempt;
    }
    
    /**
     * Accumulated execution context: the trigger payload and earlier step outputs.
     */
    public JsonNode getExecutionContext() {
        return executionContext;
    }
    
    /**
     * Payload of the trigger that started the execution.
     */
    public JsonNode getTriggerPayload() {
        return executionContext.path(ExecutionInstance.CONTEXT_TRIGGER);
    }
    
    /**
     * Output of an earlier step, or a missing node.
     */
    public JsonNode getStepOutput(int index) {
        return executionContext.path(ExecutionInstance.CONTEXT_STEP_PREFIX + index);
    }
    
    /**
     * Get the idempotency key for this step. Stable across retries of the same
     * step of the same execution.
     */
    public String getIdempotencyKey() {
        return executionId + ":" + stepIndex;
    }
    
    /**
     * Idempotency key that also distinguishes attempts.
     */
    public String getAttemptKey() {
        return getIdempotencyKey() + ":" + attempt;
    }
    
    /**
     * Convert a result object to JsonNode.
     */
    public JsonNode toJsonNode(Object result) {
        return objectMapper.valueToTree(result);
    }
    
    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
