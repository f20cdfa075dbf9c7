package com.leadflow.core.model;

/**
 * What an execution does when its pending wake fires.
 */
public enum WakeAction {
    /**
     * The current step finished; move to the next one.
     */
    ADVANCE,

    /**
     * The current step failed with retries left; dispatch it again.
     */
    RETRY
}
