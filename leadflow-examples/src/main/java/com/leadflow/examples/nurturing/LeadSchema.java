package com.leadflow.examples.nurturing;

import com.leadflow.core.model.FieldSchema;
import com.leadflow.core.model.RelativeTime;
import com.leadflow.core.rule.ComputedField;
import com.leadflow.core.rule.DaysSinceField;
import com.leadflow.core.rule.EventCountField;
import com.leadflow.core.rule.FieldResolver;

import java.util.List;

/**
 * Field names and types of a lead record, and the fields computed from them.
 */
public final class LeadSchema {

    public static final String NAME = "name";
    public static final String EMAIL = "email";
    public static final String PHONE = "phone";
    public static final String COMPANY = "company";
    public static final String COMPANY_SIZE = "company_size";
    public static final String SOURCE = "source";
    public static final String STATUS = "status";
    public static final String SCORE = "score";
    public static final String SEGMENT = "segment";
    public static final String TAGS = "tags";
    public static final String CONVERTED = "converted";
    public static final String CREATED_AT = "created_at";
    public static final String UPDATED_AT = "updated_at";
    public static final String LAST_ACTIVITY_AT = "last_activity_at";
    public static final String LAST_INTERACTION_AT = "last_interaction_at";
    public static final String EMAIL_OPENS = "email_opens";
    public static final String EMAIL_CLICKS = "email_clicks";

    public static final String DAYS_SINCE_LAST_ACTIVITY = "days_since_last_activity";
    public static final String EMAIL_OPENS_LAST_30D = "email_opens_last_30d";
    public static final String EMAIL_CLICKS_LAST_30D = "email_clicks_last_30d";
    public static final String EMAIL_OPENS_LAST_60D = "email_opens_last_60d";

    public static final FieldSchema SCHEMA = FieldSchema.builder()
        .string(NAME)
        .string(EMAIL)
        .string(PHONE)
        .string(COMPANY)
        .number(COMPANY_SIZE)
        .string(SOURCE)
        .string(STATUS)
        .number(SCORE)
        .string(SEGMENT)
        .collection(TAGS)
        .bool(CONVERTED)
        .datetime(CREATED_AT)
        .datetime(UPDATED_AT)
        .datetime(LAST_ACTIVITY_AT)
        .datetime(LAST_INTERACTION_AT)
        .collection(EMAIL_OPENS)
        .collection(EMAIL_CLICKS)
        .build();

    private LeadSchema() {
    }

    public static List<ComputedField> computedFields() {
        return List.of(
            new DaysSinceField(DAYS_SINCE_LAST_ACTIVITY, LAST_ACTIVITY_AT),
            new EventCountField(EMAIL_OPENS_LAST_30D, EMAIL_OPENS, RelativeTime.daysAgo(30)),
            new EventCountField(EMAIL_CLICKS_LAST_30D, EMAIL_CLICKS, RelativeTime.daysAgo(30)),
            new EventCountField(EMAIL_OPENS_LAST_60D, EMAIL_OPENS, RelativeTime.daysAgo(60))
        );
    }

    public static FieldResolver fieldResolver() {
        return new FieldResolver(computedFields());
    }
}
