package com.phonepe.memoria.core.runlog;

public enum StepStatus {
    COMPLETED,
    /**
     * Step ran but decided there was nothing to do, e.g. a sufficiency check already stopped the descent
     */
    SKIPPED,
    FAILED,
    /**
     * Never ran because an earlier step failed or the run was cancelled
     */
    NOT_RUN
}
