package com.leadflow.app.config;

import com.leadflow.core.model.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

/**
 * Configuration properties for the engine host.
 *
 * <p>Example YAML:
 * <pre>{@code
 * leadflow:
 *   persistence:
 *     mode: jdbc
 *   cache:
 *     ttl: 5m
 *     max-size: 1000
 *   retry:
 *     initial-backoff: 30s
 *     max-backoff: 1h
 *   timer:
 *     poll-interval: 1s
 *     batch-size: 100
 *   recovery:
 *     stuck-threshold: 15m
 *     check-interval: 1m
 * }</pre>
 */
@ConfigurationProperties(prefix = "leadflow")
public class LeadflowProperties {

    private final Persistence persistence = new Persistence();
    private final Cache cache = new Cache();
    private final Retry retry = new Retry();
    private final Timer timer = new Timer();
    private final Recovery recovery = new Recovery();
    private final Metrics metrics = new Metrics();
    private final Webhook webhook = new Webhook();
    private final Examples examples = new Examples();

    public Persistence getPersistence() { return persistence; }
    public Cache getCache() { return cache; }
    public Retry getRetry() { return retry; }
    public Timer getTimer() { return timer; }
    public Recovery getRecovery() { return recovery; }
    public Metrics getMetrics() { return metrics; }
    public Webhook getWebhook() { return webhook; }
    public Examples getExamples() { return examples; }

    public enum PersistenceMode {
        MEMORY,
        JDBC
    }

    public static class Persistence {
        private PersistenceMode mode = PersistenceMode.MEMORY;

        public PersistenceMode getMode() { return mode; }
        public void setMode(PersistenceMode mode) { this.mode = mode; }
    }

    public static class Cache {
        private Duration ttl = Duration.ofMinutes(5);
        private long maxSize = 1000;

        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }
        public long getMaxSize() { return maxSize; }
        public void setMaxSize(long maxSize) { this.maxSize = maxSize; }
    }

    /**
     * Retry policy given to the predefined workflows.
     */
    public static class Retry {
        private Duration initialBackoff = Duration.ofSeconds(30);
        private Duration maxBackoff = Duration.ofHours(1);
        private double backoffMultiplier = 2.0;
        private double jitterFactor = 0.1;
        private Set<String> nonRetryableErrors = new HashSet<>();

        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }
        public Duration getMaxBackoff() { return maxBackoff; }
        public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }
        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
        public double getJitterFactor() { return jitterFactor; }
        public void setJitterFactor(double jitterFactor) { this.jitterFactor = jitterFactor; }
        public Set<String> getNonRetryableErrors() { return nonRetryableErrors; }
        public void setNonRetryableErrors(Set<String> nonRetryableErrors) { this.nonRetryableErrors = nonRetryableErrors; }

        public RetryPolicy toPolicy() {
            return RetryPolicy.builder()
                .initialBackoff(initialBackoff)
                .maxBackoff(maxBackoff)
                .backoffMultiplier(backoffMultiplier)
                .jitterFactor(jitterFactor)
                .nonRetryableErrors(nonRetryableErrors)
                .build();
        }
    }

    public static class Timer {
        private Duration pollInterval = Duration.ofSeconds(1);
        private int batchSize = 100;

        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
    }

    public static class Recovery {
        private boolean enabled = true;
        private Duration stuckThreshold = Duration.ofMinutes(15);
        private Duration checkInterval = Duration.ofMinutes(1);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getStuckThreshold() { return stuckThreshold; }
        public void setStuckThreshold(Duration stuckThreshold) { this.stuckThreshold = stuckThreshold; }
        public Duration getCheckInterval() { return checkInterval; }
        public void setCheckInterval(Duration checkInterval) { this.checkInterval = checkInterval; }
    }

    public static class Metrics {
        private Duration gaugeRefreshInterval = Duration.ofSeconds(30);

        public Duration getGaugeRefreshInterval() { return gaugeRefreshInterval; }
        public void setGaugeRefreshInterval(Duration gaugeRefreshInterval) { this.gaugeRefreshInterval = gaugeRefreshInterval; }
    }

    public static class Webhook {
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration requestTimeout = Duration.ofSeconds(10);

        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
    }

    /**
     * Publishing of the predefined nurturing workflows and segments on startup.
     */
    public static class Examples {
        private boolean installDefaults = false;

        public boolean isInstallDefaults() { return installDefaults; }
        public void setInstallDefaults(boolean installDefaults) { this.installDefaults = installDefaults; }
    }
}
