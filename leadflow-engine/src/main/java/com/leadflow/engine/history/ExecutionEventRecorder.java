package com.leadflow.engine.history;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadflow.core.model.ExecutionEvent;
import com.leadflow.core.model.ExecutionEventType;
import com.leadflow.core.repository.ExecutionEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;

/**
 * Appends execution events to the audit log.
 *
 * Events are keyed by an idempotency key; recording the same key twice keeps
 * the first event. A failure to write an event is logged and does not undo
 * the state change it describes.
 */
public class ExecutionEventRecorder {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEventRecorder.class);

    private final ExecutionEventRepository eventRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ExecutionEventRecorder(ExecutionEventRepository eventRepository, ObjectMapper objectMapper, Clock clock) {
        this.eventRepository = eventRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Record an event raised by the engine itself.
     */
    public boolean record(UUID executionId, ExecutionEventType type, Integer stepIndex,
                          Map<String, ?> payload, String idempotencyKey) {
        return record(executionId, type, stepIndex, payload, idempotencyKey, ExecutionEvent.ACTOR_SYSTEM, "engine");
    }

    /**
     * Record an event.
     *
     * @return true if the event was appended, false if it was a duplicate or could not be written
     */
    public boolean record(UUID executionId, ExecutionEventType type, Integer stepIndex,
                          Map<String, ?> payload, String idempotencyKey,
                          String actorType, String actorId) {
        try {
            long sequenceNumber = eventRepository.getNextSequenceNumber(executionId);
            
            ExecutionEvent event = ExecutionEvent.create(
                executionId,
                sequenceNumber,
                type,
                stepIndex,
                clock.instant(),
                toJsonNode(payload),
                idempotencyKey,
                actorType,
                actorId
            );
            
            boolean appended = eventRepository.append(event);
            if (!appended) {
                log.debug("Event {} already recorded for execution {}", idempotencyKey, executionId);
            }
            return appended;
        } catch (RuntimeException e) {
            log.error("Failed to record {} event for execution {}", type, executionId, e);
            return false;
        }
    }

    private JsonNode toJsonNode(Map<String, ?> payload) {
        if (payload == null || payload.isEmpty()) {
            return objectMapper.createObjectNode();
        }
        return objectMapper.valueToTree(payload);
    }
}
