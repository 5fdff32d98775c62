package com.nanik.finhub.ledger;

/**
 * Lifecycle of one invocation attempt. RUNNING is the only non-terminal state.
 */
public enum ExecutionStatus {
    RUNNING,
    SUCCEEDED,
    FAILED,
    TIMED_OUT,
    CANCELLED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
