package com.phonepe.memoria.core.pipeline;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

import java.util.Map;
import java.util.Objects;

/**
 * A step placed in a pipeline revision, with its configuration overrides and failure handling
 */
@Value
@With
public class StepBinding {
    @NonNull
    PipelineStep step;
    /**
     * Overrides read by the step through {@link StepContext}. Immutable.
     */
    Map<String, Object> config;
    FailurePolicy failurePolicy;
    /**
     * Finalizers run at the end of the pipeline even when a degradable step has failed
     */
    boolean finalizer;

    @Builder
    public StepBinding(
            @NonNull PipelineStep step,
            Map<String, Object> config,
            FailurePolicy failurePolicy,
            boolean finalizer) {
        this.step = step;
        this.config = Map.copyOf(Objects.requireNonNullElse(config, Map.of()));
        this.failurePolicy = Objects.requireNonNullElse(failurePolicy, FailurePolicy.ABORT);
        this.finalizer = finalizer;
    }

    public static StepBinding abort(PipelineStep step) {
        return new StepBinding(step, Map.of(), FailurePolicy.ABORT, false);
    }

    public static StepBinding degrade(PipelineStep step) {
        return new StepBinding(step, Map.of(), FailurePolicy.DEGRADE, false);
    }

    public static StepBinding finalizer(PipelineStep step) {
        return new StepBinding(step, Map.of(), FailurePolicy.ABORT, true);
    }

    public String id() {
        return step.id();
    }
}
