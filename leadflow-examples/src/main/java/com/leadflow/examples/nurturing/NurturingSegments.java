package com.leadflow.examples.nurturing;

import com.leadflow.core.model.RelativeTime;
import com.leadflow.core.model.RuleSet;
import com.leadflow.core.model.SegmentDefinition;

import java.util.List;

/**
 * Predefined dynamic lead segments. Lower priority values are evaluated first.
 */
public final class NurturingSegments {

    public static final String HOT = "hot_leads";
    public static final String WARM = "warm_leads";
    public static final String COLD = "cold_leads";
    public static final String CHATBOT_ENGAGED = "chatbot_engaged";
    public static final String HIGH_VALUE_COMPANY = "high_value_company";
    public static final String DEMO_REQUESTED = "demo_requested";
    public static final String EMAIL_ENGAGED = "email_engaged";
    public static final String LONG_TERM_NURTURE = "long_term_nurture";
    public static final String UNRESPONSIVE = "unresponsive";

    private NurturingSegments() {
    }

    public static List<SegmentDefinition> all() {
        return List.of(
            SegmentDefinition.dynamic(HOT, "Hot Leads", "High score, qualified or in an opportunity",
                RuleSet.builder()
                    .rule(LeadSchema.SCORE, "gte", 75)
                    .rule(LeadSchema.STATUS, "in", List.of("qualified", "opportunity"))
                    .build(), 1),
            SegmentDefinition.dynamic(WARM, "Warm Leads", "Score between 40 and 74",
                RuleSet.builder()
                    .rule(LeadSchema.SCORE, "gte", 40)
                    .rule(LeadSchema.SCORE, "lt", 75)
                    .build(), 2),
            SegmentDefinition.dynamic(COLD, "Cold Leads", "Score below 40",
                RuleSet.builder()
                    .rule(LeadSchema.SCORE, "lt", 40)
                    .build(), 3),
            SegmentDefinition.dynamic(CHATBOT_ENGAGED, "Chatbot Engaged", "Came from the chatbot, talked this week",
                RuleSet.builder()
                    .rule(LeadSchema.SOURCE, "eq", "chatbot")
                    .rule(LeadSchema.LAST_INTERACTION_AT, "gte", RelativeTime.daysAgo(7))
                    .build(), 2),
            SegmentDefinition.dynamic(HIGH_VALUE_COMPANY, "High Value Company", "Companies with 100+ employees",
                RuleSet.builder()
                    .rule(LeadSchema.COMPANY_SIZE, "gte", 100)
                    .rule(LeadSchema.COMPANY, "not_eq", "")
                    .build(), 1),
            SegmentDefinition.dynamic(DEMO_REQUESTED, "Demo Requested", "Asked for a product demo",
                RuleSet.builder()
                    .rule(LeadSchema.TAGS, "contains", NurturingWorkflows.TAG_DEMO_REQUESTED)
                    .build(), 1),
            SegmentDefinition.dynamic(EMAIL_ENGAGED, "Email Engaged", "Opens and clicks in the last 30 days",
                RuleSet.builder()
                    .rule(LeadSchema.EMAIL_OPENS_LAST_30D, "gte", 3)
                    .rule(LeadSchema.EMAIL_CLICKS_LAST_30D, "gte", 1)
                    .build(), 2),
            SegmentDefinition.dynamic(LONG_TERM_NURTURE, "Long Term Nurture", "Low score leads older than a month",
                RuleSet.builder()
                    .rule(LeadSchema.SCORE, "gte", 20)
                    .rule(LeadSchema.SCORE, "lt", 40)
                    .rule(LeadSchema.CREATED_AT, "lt", RelativeTime.daysAgo(30))
                    .build(), 3),
            SegmentDefinition.dynamic(UNRESPONSIVE, "Unresponsive", "No activity or opens for 60 days",
                RuleSet.builder()
                    .rule(LeadSchema.LAST_ACTIVITY_AT, "lt", RelativeTime.daysAgo(60))
                    .rule(LeadSchema.EMAIL_OPENS_LAST_60D, "eq", 0)
                    .build(), 4));
    }
}
