package com.phonepe.memoria.core.pipeline;

import com.phonepe.memoria.core.capability.Capability;
import com.phonepe.memoria.core.runlog.StepStatus;

import java.util.Set;

/**
 * A unit of work in an operation pipeline. Steps talk to each other only through the {@link PipelineState} keys
 * they declare, which lets the registry validate a sequence before accepting it and lets the durable runner run
 * independent steps side by side.
 * <p>
 * A step may be attempted more than once, so it must not leave side effects behind when it fails.
 */
public interface PipelineStep {
    /**
     * Identifier, unique within a pipeline
     */
    String id();

    StepRole role();

    /**
     * State keys that must be present before the step runs
     */
    Set<String> requires();

    /**
     * State keys the step writes
     */
    Set<String> produces();

    /**
     * Config keys the step reads from its binding. A binding carrying any other key is rejected.
     */
    default Set<String> options() {
        return Set.of();
    }

    default Set<Capability> capabilities() {
        return role().defaultCapabilities();
    }

    /**
     * Run the step
     *
     * @return {@link StepStatus#COMPLETED} or {@link StepStatus#SKIPPED}. Failures are thrown as
     * {@link com.phonepe.memoria.core.errors.MemoriaException}.
     */
    StepStatus execute(StepContext context, PipelineState state);
}
