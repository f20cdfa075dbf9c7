package com.leadflow.scheduler;

import com.leadflow.core.port.TimerService;
import com.leadflow.core.port.WakeListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Durable timer service that polls the timer store for due wakes.
 * 
 * Responsibilities:
 * - Persist one pending wake per suspended execution
 * - Fire due wakes to the registered listener, each at most once
 * - Survive restarts: wakes that came due while the process was down fire on
 *   the first poll
 */
public class PollingTimerService implements TimerService {

    private static final Logger log = LoggerFactory.getLogger(PollingTimerService.class);

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(5);
    public static final int DEFAULT_BATCH_SIZE = 100;

    private final TimerRepository timerRepository;
    private final Clock clock;
    private final Duration pollInterval;
    private final int batchSize;

    private ScheduledExecutorService scheduler;
    private volatile WakeListener listener;
    private volatile boolean running = false;

    public PollingTimerService(TimerRepository timerRepository, Clock clock) {
        this(timerRepository, clock, DEFAULT_POLL_INTERVAL, DEFAULT_BATCH_SIZE);
    }

    public PollingTimerService(
            TimerRepository timerRepository,
            Clock clock,
            Duration pollInterval,
            int batchSize) {
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("Poll interval must be positive");
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be at least 1");
        }
        this.timerRepository = timerRepository;
        this.clock = clock;
        this.pollInterval = pollInterval;
        this.batchSize = batchSize;
    }

    /**
     * Register the wake listener without starting the polling thread.
     * Used when polling is driven externally through {@link #pollDueTimers()}.
     */
    public void setListener(WakeListener listener) {
        this.listener = listener;
    }

    /**
     * Start polling.
     */
    public synchronized void start(WakeListener wakeListener) {
        if (running) {
            log.warn("Timer service already running");
            return;
        }
        
        this.listener = wakeListener;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "leadflow-timer");
            thread.setDaemon(true);
            return thread;
        });
        running = true;
        
        scheduler.scheduleWithFixedDelay(
            this::pollSafely,
            0,
            pollInterval.toMillis(),
            TimeUnit.MILLISECONDS
        );
        
        log.info("Timer service started (poll interval {}, batch size {}, {} wakes pending)",
            pollInterval, batchSize, timerRepository.countPending());
    }

    /**
     * Stop polling. Pending wakes stay in the store.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Timer service stopped");
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public void scheduleWake(UUID executionId, Duration delay) {
        Instant now = clock.instant();
        Duration effective = delay.isNegative() ? Duration.ZERO : delay;
        ScheduledWake wake = ScheduledWake.pending(executionId, now.plus(effective), now);
        
        timerRepository.upsert(wake);
        
        log.debug("Scheduled wake {} for execution {} at {}", wake.wakeId(), executionId, wake.fireAt());
    }

    @Override
    public void cancelWakes(UUID executionId) {
        int removed = timerRepository.cancelForExecution(executionId);
        if (removed > 0) {
            log.debug("Cancelled pending wake for execution {}", executionId);
        }
    }

    /**
     * Fire every due wake once.
     * 
     * @return the number of wakes delivered to the listener
     */
    public int pollDueTimers() {
        WakeListener target = listener;
        if (target == null) {
            log.warn("No wake listener registered, skipping poll");
            return 0;
        }
        
        Instant now = clock.instant();
        List<ScheduledWake> due = timerRepository.findDue(now, batchSize);
        int fired = 0;
        
        for (ScheduledWake wake : due) {
            try {
                if (!timerRepository.claim(wake.wakeId())) {
                    log.debug("Wake {} was replaced or fired elsewhere", wake.wakeId());
                    continue;
                }
                log.info("Firing wake for execution {} (due {})", wake.executionId(), wake.fireAt());
                fired++;
                target.onWake(wake.executionId());
            } catch (Exception e) {
                log.error("Failed to fire wake {} for execution {}", wake.wakeId(), wake.executionId(), e);
            }
        }
        return fired;
    }

    // ========== Internal Methods ==========

    private void pollSafely() {
        if (!running) return;
        
        try {
            pollDueTimers();
        } catch (Exception e) {
            log.error("Error polling timers", e);
        }
    }
}
