package com.phonepe.memoria.core.runlog;

public enum RunStatus {
    RUNNING,
    SUCCEEDED,
    /**
     * Finished with partial results after a degradable step failed
     */
    DEGRADED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
