package com.leadflow.core.test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Clock for testing time-dependent behavior.
 * Engine components take a {@link Clock}; passing a TimeController lets tests
 * move time forward without actual waiting.
 * 
 * <p>Example usage:</p>
 * <pre>{@code
 * TimeController time = TimeController.frozenAt(Instant.parse("2024-01-15T10:00:00Z"));
 * 
 * Instant start = time.instant();
 * time.advance(Duration.ofMinutes(5));
 * 
 * assertThat(Duration.between(start, time.instant())).isEqualTo(Duration.ofMinutes(5));
 * }</pre>
 */
public class TimeController extends Clock {

    private final AtomicReference<Instant> currentTime;

    /**
     * Create a time controller starting at the current time.
     */
    public TimeController() {
        this(Instant.now());
    }

    /**
     * Create a time controller starting at a specific time.
     */
    public TimeController(Instant startTime) {
        this.currentTime = new AtomicReference<>(startTime);
    }

    @Override
    public Instant instant() {
        return currentTime.get();
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    /**
     * Get the current time.
     */
    public Instant now() {
        return currentTime.get();
    }

    /**
     * Advance time by a duration.
     */
    public void advance(Duration duration) {
        currentTime.updateAndGet(t -> t.plus(duration));
    }

    /**
     * Advance time by seconds.
     */
    public void advanceSeconds(long seconds) {
        advance(Duration.ofSeconds(seconds));
    }

    /**
     * Advance time by minutes.
     */
    public void advanceMinutes(long minutes) {
        advance(Duration.ofMinutes(minutes));
    }

    /**
     * Advance time by days.
     */
    public void advanceDays(long days) {
        advance(Duration.ofDays(days));
    }

    /**
     * Set time to a specific instant.
     */
    public void setTime(Instant newTime) {
        currentTime.set(newTime);
    }

    /**
     * Get the duration since an instant.
     */
    public Duration durationSince(Instant since) {
        return Duration.between(since, now());
    }

    /**
     * Create a frozen time controller at a specific time.
     */
    public static TimeController frozenAt(Instant time) {
        return new TimeController(time);
    }
}
