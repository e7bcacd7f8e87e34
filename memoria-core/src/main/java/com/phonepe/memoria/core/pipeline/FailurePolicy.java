package com.phonepe.memoria.core.pipeline;

/**
 * What happens to a run when a step fails after its retries are exhausted
 */
public enum FailurePolicy {
    /**
     * Run fails. Nothing after the step runs.
     */
    ABORT,
    /**
     * Run is marked degraded and jumps to its finalizer steps
     */
    DEGRADE
}
