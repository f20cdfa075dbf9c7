package com.leadflow.core.model;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Backoff between re-dispatches of a failed step.
 * The number of retries is declared per step; this policy only decides how
 * long to wait and which error codes are never worth retrying.
 * 
 * Invariants:
 * - initialBackoff >= 0
 * - maxBackoff >= initialBackoff
 * - backoffMultiplier >= 1.0
 * - jitterFactor in [0.0, 1.0]
 */
public record RetryPolicy(
    Duration initialBackoff,
    Duration maxBackoff,
    double backoffMultiplier,
    double jitterFactor,
    Set<String> nonRetryableErrors
) {
    public RetryPolicy {
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must be >= 0");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be in [0.0, 1.0]");
        }
        nonRetryableErrors = nonRetryableErrors == null ? Set.of() : Set.copyOf(nonRetryableErrors);
    }

    /**
     * Default retry policy: exponential backoff starting at 30s, capped at 1h.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(
            Duration.ofSeconds(30),
            Duration.ofHours(1),
            2.0,
            0.1,
            Set.of()
        );
    }

    /**
     * Retries are re-dispatched on the next timer poll.
     */
    public static RetryPolicy immediate() {
        return new RetryPolicy(
            Duration.ZERO,
            Duration.ZERO,
            1.0,
            0.0,
            Set.of()
        );
    }

    /**
     * Compute the backoff duration before the given retry.
     * 
     * @param retryNumber 1-indexed retry number
     * @return Duration to wait before re-dispatching
     */
    public Duration computeBackoff(int retryNumber) {
        if (retryNumber < 1) {
            throw new IllegalArgumentException("Retry number must be >= 1");
        }
        
        // Base backoff: initialBackoff * (multiplier ^ (retry - 1))
        double baseBackoffMs = initialBackoff.toMillis() * 
            Math.pow(backoffMultiplier, retryNumber - 1);
        
        double cappedBackoffMs = Math.min(baseBackoffMs, maxBackoff.toMillis());
        
        // Apply jitter: backoff * (1 - jitter + random(0, 2*jitter))
        double jitterRange = cappedBackoffMs * jitterFactor;
        double jitteredBackoffMs = cappedBackoffMs - jitterRange + 
            ThreadLocalRandom.current().nextDouble() * 2 * jitterRange;
        
        return Duration.ofMillis((long) jitteredBackoffMs);
    }

    /**
     * Check if the given error code may be retried at all.
     * 
     * @param errorCode The error code reported by the action handler
     * @return false if the code is listed as non-retryable
     */
    public boolean shouldRetry(String errorCode) {
        return errorCode == null || !nonRetryableErrors.contains(errorCode);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration initialBackoff = Duration.ofSeconds(30);
        private Duration maxBackoff = Duration.ofHours(1);
        private double backoffMultiplier = 2.0;
        private double jitterFactor = 0.1;
        private Set<String> nonRetryableErrors = Set.of();

        public Builder initialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder jitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
            return this;
        }

        public Builder nonRetryableErrors(Set<String> nonRetryableErrors) {
            this.nonRetryableErrors = nonRetryableErrors;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(
                initialBackoff, maxBackoff,
                backoffMultiplier, jitterFactor,
                nonRetryableErrors
            );
        }
    }
}
