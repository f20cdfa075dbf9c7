package com.leadflow.examples.nurturing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.leadflow.core.model.ActionResult;
import com.leadflow.core.model.FieldType;
import com.leadflow.worker.ActionContext;
import com.leadflow.worker.ActionException;
import com.leadflow.worker.ActionHandlerRegistry;
import com.leadflow.worker.WebhookActionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lead nurturing actions over an {@link InMemoryLeadStore}.
 *
 * Messages, tasks and notifications go to in-memory outboxes instead of real
 * providers. Handlers with side effects are idempotent on the step key, so a
 * retried or replayed step sends one message and applies one score change.
 */
public class NurturingActionHandlers {

    private static final Logger log = LoggerFactory.getLogger(NurturingActionHandlers.class);

    public static final String SEND_MESSAGE = "send_message";
    public static final String UPDATE_SCORE = "update_score";
    public static final String ADD_TAG = "add_tag";
    public static final String REMOVE_TAG = "remove_tag";
    public static final String CHANGE_SEGMENT = "change_segment";
    public static final String UPDATE_FIELD = "update_field";
    public static final String CREATE_TASK = "create_task";
    public static final String SEND_NOTIFICATION = "send_notification";

    public static final String CHANNEL_EMAIL = "email";
    public static final String CHANNEL_WHATSAPP = "whatsapp";
    public static final String CHANNEL_SMS = "sms";

    public static final String STATUS_UNSUBSCRIBED = "unsubscribed";

    private static final Set<String> CHANNELS = Set.of(CHANNEL_EMAIL, CHANNEL_WHATSAPP, CHANNEL_SMS);
    private static final int MIN_SCORE = 0;
    private static final int MAX_SCORE = 100;

    private final InMemoryLeadStore leads;
    private final Clock clock;

    private final Map<String, SentMessage> sentByKey = new ConcurrentHashMap<>();
    private final List<SentMessage> outbox = new CopyOnWriteArrayList<>();
    private final Set<String> appliedScoreChanges = ConcurrentHashMap.newKeySet();
    private final List<LeadTask> tasks = new CopyOnWriteArrayList<>();
    private final List<Notification> notifications = new CopyOnWriteArrayList<>();

    // Failure simulation for demonstrating retries
    private final AtomicInteger providerFailuresLeft = new AtomicInteger();

    public NurturingActionHandlers(InMemoryLeadStore leads, Clock clock) {
        this.leads = leads;
        this.clock = clock;
    }

    /**
     * Register every nurturing action plus {@code call_webhook}.
     */
    public ActionHandlerRegistry registerAll(ActionHandlerRegistry registry, WebhookActionHandler webhook) {
        return registry
            .register(SEND_MESSAGE, this::sendMessage)
            .register(UPDATE_SCORE, this::updateScore)
            .register(ADD_TAG, this::addTag)
            .register(REMOVE_TAG, this::removeTag)
            .register(CHANGE_SEGMENT, this::changeSegment)
            .register(UPDATE_FIELD, this::updateField)
            .register(CREATE_TASK, this::createTask)
            .register(SEND_NOTIFICATION, this::sendNotification)
            .register(WebhookActionHandler.KIND, webhook);
    }

    /**
     * The next {@code count} sends fail as if the message provider were down.
     */
    public void failNextSends(int count) {
        providerFailuresLeft.set(count);
    }

    // ========== Messaging ==========

    /**
     * Send a templated message. Parameters: {@code channel} (email, whatsapp
     * or sms; default email), {@code template}, {@code subject}.
     */
    public ActionResult sendMessage(JsonNode parameters, ActionContext context) throws ActionException {
        String key = context.getIdempotencyKey();
        SentMessage already = sentByKey.get(key);
        if (already != null) {
            log.info("Message {} already sent for step {}, not sending again", already.messageId(), key);
            return ActionResult.success(messageOutput(context, already));
        }

        String channel = parameters.path("channel").asText(CHANNEL_EMAIL);
        if (!CHANNELS.contains(channel)) {
            throw ActionException.permanent("INVALID_PARAMETERS", "Unsupported channel: " + channel);
        }
        String template = parameters.path("template").asText("");
        if (template.isBlank()) {
            throw ActionException.permanent("INVALID_PARAMETERS", "send_message requires a template");
        }

        Map<String, Object> lead = requireLead(context.getEntityId());
        if (STATUS_UNSUBSCRIBED.equals(lead.get(LeadSchema.STATUS))) {
            return ActionResult.permanentFailure("UNSUBSCRIBED", "Lead " + context.getEntityId() + " unsubscribed");
        }
        String addressField = CHANNEL_EMAIL.equals(channel) ? LeadSchema.EMAIL : LeadSchema.PHONE;
        Object address = lead.get(addressField);
        if (address == null || address.toString().isBlank()) {
            String code = CHANNEL_EMAIL.equals(channel) ? "NO_EMAIL_ADDRESS" : "NO_PHONE_NUMBER";
            return ActionResult.permanentFailure(code, "Lead " + context.getEntityId() + " has no " + addressField);
        }

        if (providerFailuresLeft.getAndUpdate(left -> Math.max(0, left - 1)) > 0) {
            log.warn("Simulated {} provider outage for step {}", channel, key);
            return ActionResult.transientFailure("PROVIDER_UNAVAILABLE", channel + " provider unavailable");
        }

        SentMessage message = new SentMessage(
            "msg-" + (outbox.size() + 1),
            key,
            context.getEntityId(),
            channel,
            template,
            parameters.path("subject").asText(null),
            address.toString(),
            clock.instant());
        if (sentByKey.putIfAbsent(key, message) == null) {
            outbox.add(message);
            log.info("Sent {} '{}' to lead {} ({})", channel, template, message.leadId(), message.messageId());
        }
        return ActionResult.success(messageOutput(context, sentByKey.get(key)));
    }

    // ========== Lead Updates ==========

    /**
     * Add {@code delta} (or {@code score_change}) to the score, clamped to 0..100.
     */
    public ActionResult updateScore(JsonNode parameters, ActionContext context) throws ActionException {
        JsonNode deltaNode = parameters.has("delta") ? parameters.get("delta") : parameters.path("score_change");
        if (!deltaNode.isNumber()) {
            throw ActionException.permanent("INVALID_PARAMETERS", "update_score requires a numeric delta");
        }
        int delta = deltaNode.asInt();
        requireLead(context.getEntityId());

        ObjectNode output = context.getObjectMapper().createObjectNode();
        if (!appliedScoreChanges.add(context.getIdempotencyKey())) {
            output.put("applied", false);
            output.put("score", scoreOf(leads.attribute(context.getEntityId(), LeadSchema.SCORE)));
            return ActionResult.success(output);
        }

        int[] change = new int[2];
        leads.update(context.getEntityId(), lead -> {
            int from = scoreOf(lead.get(LeadSchema.SCORE));
            int to = Math.min(MAX_SCORE, Math.max(MIN_SCORE, from + delta));
            lead.put(LeadSchema.SCORE, to);
            change[0] = from;
            change[1] = to;
        });
        log.info("Score of lead {} changed {} -> {}", context.getEntityId(), change[0], change[1]);

        output.put("applied", true);
        output.put("from", change[0]);
        output.put("to", change[1]);
        output.put("change", delta);
        return ActionResult.success(output);
    }

    public ActionResult addTag(JsonNode parameters, ActionContext context) throws ActionException {
        String tag = requireText(parameters, "tag", ADD_TAG);
        requireLead(context.getEntityId());
        leads.update(context.getEntityId(), lead -> {
            List<Object> tags = tagsOf(lead);
            if (!tags.contains(tag)) {
                tags.add(tag);
            }
            lead.put(LeadSchema.TAGS, tags);
        });
        return ActionResult.success(tagOutput(context, tag));
    }

    public ActionResult removeTag(JsonNode parameters, ActionContext context) throws ActionException {
        String tag = requireText(parameters, "tag", REMOVE_TAG);
        requireLead(context.getEntityId());
        leads.update(context.getEntityId(), lead -> {
            List<Object> tags = tagsOf(lead);
            tags.remove(tag);
            lead.put(LeadSchema.TAGS, tags);
        });
        return ActionResult.success(tagOutput(context, tag));
    }

    public ActionResult changeSegment(JsonNode parameters, ActionContext context) throws ActionException {
        String segment = requireText(parameters, "segment", CHANGE_SEGMENT);
        Object previous = requireLead(context.getEntityId()).get(LeadSchema.SEGMENT);
        leads.update(context.getEntityId(), lead -> lead.put(LeadSchema.SEGMENT, segment));
        log.info("Lead {} moved from segment {} to {}", context.getEntityId(), previous, segment);

        ObjectNode output = context.getObjectMapper().createObjectNode();
        output.put("from", previous == null ? null : previous.toString());
        output.put("to", segment);
        return ActionResult.success(output);
    }

    /**
     * Set one scalar field declared by {@link LeadSchema}. Collections are
     * changed through the tag actions only.
     */
    public ActionResult updateField(JsonNode parameters, ActionContext context) throws ActionException {
        String field = requireText(parameters, "field", UPDATE_FIELD);
        FieldType type = LeadSchema.SCHEMA.typeOf(field)
            .orElseThrow(() -> ActionException.permanent("UNKNOWN_FIELD", "Lead has no field " + field));
        if (type == FieldType.COLLECTION) {
            throw ActionException.permanent("UNSUPPORTED_FIELD", "Field " + field + " is a collection");
        }
        Object value = toFieldValue(field, type, parameters.path("value"));
        requireLead(context.getEntityId());
        leads.update(context.getEntityId(), lead -> lead.put(field, value));

        ObjectNode output = context.getObjectMapper().createObjectNode();
        output.put("field", field);
        output.set("value", parameters.path("value"));
        return ActionResult.success(output);
    }

    // ========== Team Follow-up ==========

    /**
     * Create a follow-up task for the sales team. Parameters: {@code title},
     * {@code description}, {@code assignee}, {@code due_in} (ISO-8601 duration).
     */
    public ActionResult createTask(JsonNode parameters, ActionContext context) throws ActionException {
        requireLead(context.getEntityId());
        Instant dueAt = null;
        if (parameters.hasNonNull("due_in")) {
            try {
                dueAt = clock.instant().plus(Duration.parse(parameters.get("due_in").asText()));
            } catch (RuntimeException e) {
                throw new ActionException("INVALID_PARAMETERS", "Invalid due_in: " + parameters.get("due_in"), e, false);
            }
        }
        LeadTask task = new LeadTask(
            "task-" + (tasks.size() + 1),
            context.getIdempotencyKey(),
            context.getEntityId(),
            parameters.path("title").asText("Workflow task"),
            parameters.path("description").asText(""),
            parameters.path("assignee").asText(null),
            dueAt);
        if (tasks.stream().noneMatch(existing -> existing.stepKey().equals(task.stepKey()))) {
            tasks.add(task);
            log.info("Created task '{}' for lead {}", task.title(), task.leadId());
        }

        ObjectNode output = context.getObjectMapper().createObjectNode();
        output.put("taskId", taskFor(task.stepKey()).taskId());
        return ActionResult.success(output);
    }

    public ActionResult sendNotification(JsonNode parameters, ActionContext context) {
        Notification notification = new Notification(
            context.getIdempotencyKey(),
            context.getEntityId(),
            parameters.path("type").asText("workflow_notification"),
            parameters.path("message").asText(""),
            parameters.path("channel").asText("slack"),
            clock.instant());
        if (notifications.stream().noneMatch(existing -> existing.stepKey().equals(notification.stepKey()))) {
            notifications.add(notification);
            log.info("Notification on {} for lead {}: {}",
                notification.channel(), notification.leadId(), notification.message());
        }
        return ActionResult.succeeded();
    }

    // ========== Outboxes ==========

    public List<SentMessage> sentMessages() {
        return List.copyOf(outbox);
    }

    public List<SentMessage> sentTo(String leadId) {
        return outbox.stream().filter(message -> message.leadId().equals(leadId)).toList();
    }

    public List<LeadTask> tasks() {
        return List.copyOf(tasks);
    }

    public List<Notification> notifications() {
        return List.copyOf(notifications);
    }

    // ========== Internal Methods ==========

    private Map<String, Object> requireLead(String leadId) throws ActionException {
        return leads.find(leadId)
            .orElseThrow(() -> ActionException.permanent("LEAD_NOT_FOUND", "Lead not found: " + leadId));
    }

    private LeadTask taskFor(String stepKey) {
        return tasks.stream().filter(task -> task.stepKey().equals(stepKey)).findFirst().orElseThrow();
    }

    private static String requireText(JsonNode parameters, String name, String actionKind) throws ActionException {
        String value = parameters.path(name).asText("");
        if (value.isBlank()) {
            throw ActionException.permanent("INVALID_PARAMETERS", actionKind + " requires " + name);
        }
        return value;
    }

    private static List<Object> tagsOf(Map<String, Object> lead) {
        List<Object> tags = new ArrayList<>();
        if (lead.get(LeadSchema.TAGS) instanceof Collection<?> existing) {
            tags.addAll(existing);
        }
        return tags;
    }

    private static int scoreOf(Object value) {
        return value instanceof Number number ? number.intValue() : 0;
    }

    private static Object toFieldValue(String field, FieldType type, JsonNode value) throws ActionException {
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        switch (type) {
            case NUMBER:
                if (!value.isNumber()) {
                    throw ActionException.permanent("INVALID_PARAMETERS", field + " expects a number");
                }
                return value.numberValue();
            case BOOLEAN:
                if (!value.isBoolean()) {
                    throw ActionException.permanent("INVALID_PARAMETERS", field + " expects a boolean");
                }
                return value.booleanValue();
            case DATETIME:
                try {
                    return Instant.parse(value.asText());
                } catch (RuntimeException e) {
                    throw new ActionException("INVALID_PARAMETERS", field + " expects an ISO-8601 instant", e, false);
                }
            default:
                return value.asText();
        }
    }

    private static ObjectNode messageOutput(ActionContext context, SentMessage message) {
        ObjectNode output = context.getObjectMapper().createObjectNode();
        output.put("messageId", message.messageId());
        output.put("channel", message.channel());
        output.put("template", message.template());
        output.put("sentAt", message.sentAt().toString());
        return output;
    }

    private static ObjectNode tagOutput(ActionContext context, String tag) {
        ObjectNode output = context.getObjectMapper().createObjectNode();
        output.put("tag", tag);
        return output;
    }

    public record SentMessage(
        String messageId,
        String stepKey,
        String leadId,
        String channel,
        String template,
        String subject,
        String address,
        Instant sentAt
    ) {}

    public record LeadTask(
        String taskId,
        String stepKey,
        String leadId,
        String title,
        String description,
        String assignee,
        Instant dueAt
    ) {}

    public record Notification(
        String stepKey,
        String leadId,
        String type,
        String message,
        String channel,
        Instant sentAt
    ) {}
}
