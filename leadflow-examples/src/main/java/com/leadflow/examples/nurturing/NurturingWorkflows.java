package com.leadflow.examples.nurturing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.leadflow.core.model.RelativeTime;
import com.leadflow.core.model.RetryPolicy;
import com.leadflow.core.model.RuleSet;
import com.leadflow.core.model.StepDefinition;
import com.leadflow.core.model.WorkflowDefinition;

import java.time.Duration;
import java.util.List;

import static com.leadflow.examples.nurturing.NurturingActionHandlers.*;

/**
 * Predefined lead nurturing workflows.
 *
 * <ol>
 *   <li>new-lead-welcome: four messages over ten days after a lead is created</li>
 *   <li>hot-lead-alert: tags a lead crossing score 75 and hands it to sales</li>
 *   <li>demo-request-follow-up: confirms a demo request and reminds the next day</li>
 *   <li>re-engagement: wins back leads inactive for 30 days</li>
 * </ol>
 */
public final class NurturingWorkflows {

    private static final ObjectMapper mapper = new ObjectMapper();

    // Trigger kinds
    public static final String LEAD_CREATED = "lead_created";
    public static final String SCORE_CHANGED = "score_change";
    public static final String FORM_SUBMITTED = "form_submitted";
    public static final String LEAD_INACTIVE = "lead_inactive";

    public static final String NEW_LEAD_WELCOME = "new-lead-welcome";
    public static final String HOT_LEAD_ALERT = "hot-lead-alert";
    public static final String DEMO_REQUEST_FOLLOW_UP = "demo-request-follow-up";
    public static final String RE_ENGAGEMENT = "re-engagement";

    public static final String TAG_HOT = "hot";
    public static final String TAG_DEMO_REQUESTED = "demo_requested";
    public static final String TAG_DEMO_BOOKED = "demo_booked";

    private NurturingWorkflows() {
    }

    /**
     * Drafts of every predefined workflow, ready to publish.
     */
    public static List<WorkflowDefinition> all(RetryPolicy retryPolicy) {
        return List.of(
            newLeadWelcome(retryPolicy),
            hotLeadAlert(retryPolicy),
            demoRequestFollowUp(retryPolicy),
            reEngagement(retryPolicy));
    }

    public static WorkflowDefinition newLeadWelcome(RetryPolicy retryPolicy) {
        RuleSet converted = RuleSet.builder().rule(LeadSchema.CONVERTED, "eq", true).build();
        return WorkflowDefinition.builder(NEW_LEAD_WELCOME)
            .triggerKind(LEAD_CREATED)
            .description("Welcome sequence for new leads")
            .category("onboarding")
            .maxEntriesPerEntity(1)
            .retryPolicy(retryPolicy)
            .step(message(CHANNEL_EMAIL, "welcome", "Welcome aboard")
                .delay(Duration.ofDays(2)))
            .step(message(CHANNEL_EMAIL, "value_content", "Getting the most out of your trial")
                .skipIf(converted)
                .delay(Duration.ofDays(3)))
            .step(message(CHANNEL_WHATSAPP, "check_in", null)
                .skipIf(converted)
                .delay(Duration.ofDays(5)))
            .step(message(CHANNEL_EMAIL, "case_study", "How teams like yours grow")
                .skipIf(converted))
            .build();
    }

    public static WorkflowDefinition hotLeadAlert(RetryPolicy retryPolicy) {
        ObjectNode task = mapper.createObjectNode()
            .put("title", "Call hot lead")
            .put("description", "Lead crossed score 75")
            .put("assignee", "sales")
            .put("due_in", "PT4H");
        ObjectNode notification = mapper.createObjectNode()
            .put("type", "hot_lead")
            .put("message", "A lead just became hot")
            .put("channel", "slack");
        return WorkflowDefinition.builder(HOT_LEAD_ALERT)
            .triggerKind(SCORE_CHANGED)
            .description("Hand leads with a high score to sales")
            .category("sales")
            .entryRules(RuleSet.builder()
                .rule(LeadSchema.SCORE, "gte", 75)
                .build())
            .cooldown(Duration.ofDays(7))
            .retryPolicy(retryPolicy)
            .step(StepDefinition.builder(ADD_TAG).parameters(mapper.createObjectNode().put("tag", TAG_HOT)))
            .step(StepDefinition.builder(CHANGE_SEGMENT).parameters(mapper.createObjectNode().put("segment", "hot")))
            .step(StepDefinition.builder(CREATE_TASK).parameters(task))
            .step(StepDefinition.builder(SEND_NOTIFICATION).parameters(notification))
            .build();
    }

    public static WorkflowDefinition demoRequestFollowUp(RetryPolicy retryPolicy) {
        return WorkflowDefinition.builder(DEMO_REQUEST_FOLLOW_UP)
            .triggerKind(FORM_SUBMITTED)
            .description("Confirm demo requests and remind until booked")
            .category("sales")
            .entryRules(RuleSet.builder()
                .rule("trigger.form", "eq", "demo_request")
                .build())
            .retryPolicy(retryPolicy)
            .step(StepDefinition.builder(ADD_TAG)
                .parameters(mapper.createObjectNode().put("tag", TAG_DEMO_REQUESTED)))
            .step(StepDefinition.builder(UPDATE_SCORE)
                .parameters(mapper.createObjectNode().put("delta", 20)))
            .step(message(CHANNEL_EMAIL, "demo_confirmation", "Your demo request")
                .delay(Duration.ofDays(1)))
            .step(message(CHANNEL_EMAIL, "demo_reminder", "Pick a time for your demo")
                .skipIf(RuleSet.builder().rule(LeadSchema.TAGS, "contains", TAG_DEMO_BOOKED).build()))
            .build();
    }

    public static WorkflowDefinition reEngagement(RetryPolicy retryPolicy) {
        // Activity since entry means the lead came back on its own
        RuleSet active = RuleSet.builder().rule(LeadSchema.LAST_ACTIVITY_AT, "gte", RelativeTime.daysAgo(7)).build();
        return WorkflowDefinition.builder(RE_ENGAGEMENT)
            .triggerKind(LEAD_INACTIVE)
            .description("Reactivate leads that went quiet")
            .category("retention")
            .entryRules(RuleSet.builder()
                .rule(LeadSchema.DAYS_SINCE_LAST_ACTIVITY, "gte", 30)
                .rule(LeadSchema.CONVERTED, "eq", false)
                .build())
            .cooldown(Duration.ofDays(30))
            .retryPolicy(retryPolicy)
            .step(message(CHANNEL_EMAIL, "we_miss_you", "Still interested?")
                .delay(Duration.ofDays(7)))
            .step(message(CHANNEL_EMAIL, "last_chance", "Should we stop writing?")
                .skipIf(active))
            .step(StepDefinition.builder(UPDATE_SCORE)
                .parameters(mapper.createObjectNode().put("delta", -10))
                .skipIf(active))
            .build();
    }

    private static StepDefinition.Builder message(String channel, String template, String subject) {
        ObjectNode parameters = mapper.createObjectNode()
            .put("channel", channel)
            .put("template", template);
        if (subject != null) {
            parameters.put("subject", subject);
        }
        return StepDefinition.builder(SEND_MESSAGE).parameters(parameters);
    }
}
