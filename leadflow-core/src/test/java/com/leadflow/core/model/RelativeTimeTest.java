package com.leadflow.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RelativeTimeTest {

    private static final Instant NOW = Instant.parse("2024-03-15T12:00:00Z");

    @Test
    void parse_shouldReadSupportedUnits() {
        assertEquals(new RelativeTime(7, ChronoUnit.DAYS), RelativeTime.parse("7_days_ago").orElseThrow());
        assertEquals(new RelativeTime(12, ChronoUnit.HOURS), RelativeTime.parse("12_hours_ago").orElseThrow());
        assertEquals(new RelativeTime(30, ChronoUnit.MINUTES), RelativeTime.parse("30_minutes_ago").orElseThrow());
        assertEquals(new RelativeTime(2, ChronoUnit.WEEKS), RelativeTime.parse("2_weeks_ago").orElseThrow());
    }

    @Test
    void parse_shouldIgnoreOrdinaryText() {
        assertTrue(RelativeTime.parse("qualified").isEmpty());
        assertTrue(RelativeTime.parse("7 days ago").isEmpty());
        assertTrue(RelativeTime.parse("-3_days_ago").isEmpty());
        assertTrue(RelativeTime.parse(null).isEmpty());
    }

    @Test
    void resolve_shouldSubtractFromEvaluationTime() {
        assertEquals(Instant.parse("2024-03-08T12:00:00Z"), RelativeTime.daysAgo(7).resolve(NOW));
        assertEquals(Instant.parse("2024-03-15T06:00:00Z"), RelativeTime.hoursAgo(6).resolve(NOW));
        assertEquals(Instant.parse("2024-03-01T12:00:00Z"), RelativeTime.parse("2_weeks_ago").orElseThrow().resolve(NOW));
    }

    @Test
    void resolve_shouldFollowTheEvaluationTime() {
        RelativeTime sevenDays = RelativeTime.daysAgo(7);
        
        assertNotEquals(sevenDays.resolve(NOW), sevenDays.resolve(NOW.plusSeconds(60)));
    }

    @Test
    void ruleExpression_shouldConvertRelativeStrings() {
        RuleExpression rule = RuleExpression.of("last_activity", "lt", "60_days_ago");
        
        assertTrue(rule.hasRelativeValue());
        assertEquals(RelativeTime.daysAgo(60), rule.value());
        
        RuleExpression literal = RuleExpression.of("source", "in", List.of("chatbot", "web"));
        assertFalse(literal.hasRelativeValue());
        assertEquals(Operator.IN, literal.operator());
    }

    @Test
    void parse_shouldRejectAmountsBeyondTheMaximumSpan() {
        assertThrows(IllegalArgumentException.class, () -> RelativeTime.parse("1000000000000_days_ago"));
        assertThrows(IllegalArgumentException.class, () -> RelativeTime.parse("99999999999999999999_days_ago"));
        assertThrows(IllegalArgumentException.class, () -> RelativeTime.parse("1317624576693539401_weeks_ago"));
        assertThrows(IllegalArgumentException.class, () -> new RelativeTime(Long.MAX_VALUE, ChronoUnit.MINUTES));
    }

    @Test
    void resolve_shouldHandleTheLargestAllowedSpan() {
        RelativeTime days = new RelativeTime(RelativeTime.MAX_SPAN.toDays(), ChronoUnit.DAYS);
        RelativeTime weeks = new RelativeTime(RelativeTime.MAX_SPAN.toDays() / 7, ChronoUnit.WEEKS);

        assertEquals(NOW.minus(RelativeTime.MAX_SPAN), days.resolve(NOW));
        assertTrue(weeks.resolve(NOW).isAfter(days.resolve(NOW)));
    }

    @Test
    void ruleExpression_shouldRejectOutOfRangeRelativeStrings() {
        assertThrows(IllegalArgumentException.class,
            () -> RuleExpression.of("last_activity_at", "gte", "1000000000000_days_ago"));
    }
}
