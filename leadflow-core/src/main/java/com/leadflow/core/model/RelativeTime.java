package com.leadflow.core.model;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A symbolic offset into the past, written as {@code N_days_ago},
 * {@code N_hours_ago}, {@code N_minutes_ago} or {@code N_weeks_ago}.
 *
 * The concrete instant depends on the evaluation time and must be
 * resolved on every evaluation. Offsets are limited to {@link #MAX_SPAN}.
 */
public record RelativeTime(long amount, ChronoUnit unit) {

    public static final Duration MAX_SPAN = Duration.ofDays(3_652_425);

    private static final Pattern EXPRESSION = Pattern.compile("^(\\d+)_(minutes|hours|days|weeks)_ago$");

    public RelativeTime {
        if (amount < 0) {
            throw new IllegalArgumentException("Relative time amount must be >= 0");
        }
        if (unit != ChronoUnit.MINUTES && unit != ChronoUnit.HOURS
                && unit != ChronoUnit.DAYS && unit != ChronoUnit.WEEKS) {
            throw new IllegalArgumentException("Unsupported relative time unit: " + unit);
        }
        if (amount > MAX_SPAN.dividedBy(unit.getDuration())) {
            throw new IllegalArgumentException("Relative time exceeds " + MAX_SPAN.toDays() + " days: "
                + amount + " " + unit.name().toLowerCase(Locale.ROOT));
        }
    }

    public static RelativeTime daysAgo(long days) {
        return new RelativeTime(days, ChronoUnit.DAYS);
    }

    public static RelativeTime hoursAgo(long hours) {
        return new RelativeTime(hours, ChronoUnit.HOURS);
    }

    /**
     * Parse an expression such as {@code 7_days_ago}.
     *
     * @return empty if the text is not a relative time expression
     * @throws IllegalArgumentException if the expression is well-formed but out of range
     */
    public static Optional<RelativeTime> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = EXPRESSION.matcher(text.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        long amount;
        try {
            amount = Long.parseLong(matcher.group(1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Relative time amount out of range: " + text, e);
        }
        ChronoUnit unit = switch (matcher.group(2)) {
            case "minutes" -> ChronoUnit.MINUTES;
            case "hours" -> ChronoUnit.HOURS;
            case "weeks" -> ChronoUnit.WEEKS;
            default -> ChronoUnit.DAYS;
        };
        return Optional.of(new RelativeTime(amount, unit));
    }

    /**
     * Resolve against the given evaluation time.
     */
    public Instant resolve(Instant evaluationTime) {
        return evaluationTime.minus(toDuration());
    }

    public Duration toDuration() {
        // bounded by MAX_SPAN in the constructor
        return unit.getDuration().multipliedBy(amount);
    }

    /**
     * Expression form, e.g. {@code 7_days_ago}.
     */
    public String expression() {
        return amount + "_" + unit.name().toLowerCase(Locale.ROOT) + "_ago";
    }

    @Override
    public String toString() {
        return expression();
    }
}
