package com.leadflow.core.port;

import java.util.UUID;

/**
 * Callback invoked by a {@link TimerService} when a wake is due.
 */
@FunctionalInterface
public interface WakeListener {

    void onWake(UUID executionId);
}
