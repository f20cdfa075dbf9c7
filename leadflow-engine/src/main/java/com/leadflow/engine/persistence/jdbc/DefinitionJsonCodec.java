package com.leadflow.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.leadflow.core.model.Operator;
import com.leadflow.core.model.RelativeTime;
import com.leadflow.core.model.RetryPolicy;
import com.leadflow.core.model.RuleExpression;
import com.leadflow.core.model.RuleSet;
import com.leadflow.core.model.StepDefinition;
import com.leadflow.core.model.StepOutcome;
import com.leadflow.core.model.StepRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * JSON form of rules, steps, retry policies and step records for JSONB columns.
 *
 * Rule values keep their type: relative times are written in expression form,
 * instants as {@code {"instant": "<ISO-8601>"}}.
 */
public class DefinitionJsonCodec {

    private static final String INSTANT_KEY = "instant";

    private final ObjectMapper objectMapper;

    public DefinitionJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    // ========== Rules ==========

    public String writeRules(RuleSet ruleSet) {
        ArrayNode array = objectMapper.createArrayNode();
        for (RuleExpression rule : ruleSet.rules()) {
            ObjectNode node = array.addObject();
            node.put("field", rule.field());
            node.put("operator", rule.operator().code());
            node.set("value", writeValue(rule.value()));
        }
        return write(array);
    }

    public RuleSet readRules(String json) {
        JsonNode array = read(json);
        if (array == null || !array.isArray()) {
            return RuleSet.empty();
        }
        List<RuleExpression> rules = new ArrayList<>();
        for (JsonNode node : array) {
            rules.add(new RuleExpression(
                node.get("field").asText(),
                Operator.fromCode(node.get("operator").asText()),
                readValue(node.get("value"))));
        }
        return new RuleSet(rules);
    }

    // ========== Steps ==========

    public String writeSteps(List<StepDefinition> steps) {
        ArrayNode array = objectMapper.createArrayNode();
        for (StepDefinition step : steps) {
            ObjectNode node = array.addObject();
            node.put("index", step.index());
            node.put("actionKind", step.actionKind());
            node.set("parameters", step.parameters());
            node.put("delay", step.delay().toString());
            node.set("skipIf", read(writeRules(step.skipIf())));
            node.put("maxRetries", step.maxRetries());
        }
        return write(array);
    }

    public List<StepDefinition> readSteps(String json) {
        JsonNode array = read(json);
        List<StepDefinition> steps = new ArrayList<>();
        if (array == null) {
            return steps;
        }
        for (JsonNode node : array) {
            steps.add(new StepDefinition(
                node.get("index").asInt(),
                node.get("actionKind").asText(),
                node.get("parameters"),
                Duration.parse(node.get("delay").asText()),
                readRules(write(node.get("skipIf"))),
                node.path("maxRetries").asInt(StepDefinition.DEFAULT_MAX_RETRIES)));
        }
        return steps;
    }

    // ========== Retry Policy ==========

    public String writeRetryPolicy(RetryPolicy policy) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("initialBackoff", policy.initialBackoff().toString());
        node.put("maxBackoff", policy.maxBackoff().toString());
        node.put("backoffMultiplier", policy.backoffMultiplier());
        node.put("jitterFactor", policy.jitterFactor());
        ArrayNode codes = node.putArray("nonRetryableErrors");
        policy.nonRetryableErrors().stream().sorted().forEach(codes::add);
        return write(node);
    }

    public RetryPolicy readRetryPolicy(String json) {
        JsonNode node = read(json);
        if (node == null || node.isEmpty()) {
            return RetryPolicy.defaultPolicy();
        }
        Set<String> codes = new HashSet<>();
        node.path("nonRetryableErrors").forEach(code -> codes.add(code.asText()));
        return new RetryPolicy(
            Duration.parse(node.get("initialBackoff").asText()),
            Duration.parse(node.get("maxBackoff").asText()),
            node.get("backoffMultiplier").asDouble(),
            node.get("jitterFactor").asDouble(),
            codes);
    }

    // ========== Step Records ==========

    public String writeStepHistory(List<StepRecord> records) {
        ArrayNode array = objectMapper.createArrayNode();
        for (StepRecord record : records) {
            ObjectNode node = array.addObject();
            node.put("index", record.index());
            node.put("actionKind", record.actionKind());
            node.put("outcome", record.outcome().name());
            node.put("attempts", record.attempts());
            node.put("recordedAt", record.recordedAt().toString());
        }
        return write(array);
    }

    public List<StepRecord> readStepHistory(String json) {
        JsonNode array = read(json);
        List<StepRecord> records = new ArrayList<>();
        if (array == null) {
            return records;
        }
        for (JsonNode node : array) {
            records.add(new StepRecord(
                node.get("index").asInt(),
                node.get("actionKind").asText(),
                StepOutcome.valueOf(node.get("outcome").asText()),
                node.get("attempts").asInt(),
                Instant.parse(node.get("recordedAt").asText())));
        }
        return records;
    }

    // ========== Raw JSON ==========

    public String write(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize to JSON", e);
        }
    }

    public JsonNode read(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to parse stored JSON", e);
        }
    }

    // ========== Internal Methods ==========

    private JsonNode writeValue(Object value) {
        if (value instanceof RelativeTime relative) {
            return objectMapper.getNodeFactory().textNode(relative.expression());
        }
        if (value instanceof Instant instant) {
            ObjectNode node = objectMapper.createObjectNode();
            node.put(INSTANT_KEY, instant.toString());
            return node;
        }
        if (value instanceof List<?> list) {
            ArrayNode array = objectMapper.createArrayNode();
            list.forEach(element -> array.add(writeValue(element)));
            return array;
        }
        return objectMapper.valueToTree(value);
    }

    private Object readValue(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isObject() && node.has(INSTANT_KEY)) {
            return Instant.parse(node.get(INSTANT_KEY).asText());
        }
        if (node.isArray()) {
            List<Object> list = new ArrayList<>();
            node.forEach(element -> list.add(readValue(element)));
            return list;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        // Relative expressions are parsed back by RuleExpression
        return node.asText();
    }
}
