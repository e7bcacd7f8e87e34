package com.phonepe.memoria.core.pipeline.runner;

import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaError;
import com.phonepe.memoria.core.pipeline.FailurePolicy;
import com.phonepe.memoria.core.pipeline.PipelineState;
import com.phonepe.memoria.core.pipeline.RunContext;
import com.phonepe.memoria.core.pipeline.StepBinding;
import com.phonepe.memoria.core.runlog.RunStatus;
import com.phonepe.memoria.core.runlog.StepRecord;
import com.phonepe.memoria.core.runlog.StepStatus;

import java.util.List;

/**
 * Failure bookkeeping of a run, shared by the runners
 */
class RunProgress {
    private boolean failed;
    private boolean cancelled;
    private boolean degraded;
    private MemoriaError error;

    RunProgress(boolean degraded) {
        this.degraded = degraded;
    }

    /**
     * Whether the step may still run
     */
    boolean admits(StepBinding binding) {
        if (failed || cancelled) {
            return false;
        }
        return !degraded || binding.isFinalizer();
    }

    /**
     * Stops the run if the caller cancelled it
     *
     * @return true if the run is cancelled
     */
    boolean checkCancelled(RunContext context, StepBinding next) {
        if (!cancelled && context.getCancellation().isCancelled()) {
            cancelled = true;
            error = MemoriaError.error(ErrorType.CANCELLED, next.id())
                    .withRunId(context.getRunId())
                    .withStepId(next.id())
                    .withScope(context.scopeDescription());
        }
        return cancelled;
    }

    void record(StepBinding binding, StepRecord record, PipelineState state) {
        if (record.getStatus() != StepStatus.FAILED) {
            return;
        }
        error = record.getError();
        if (binding.getFailurePolicy() == FailurePolicy.DEGRADE && !binding.isFinalizer()) {
            degraded = true;
            state.markDegraded();
        }
        else {
            failed = true;
        }
    }

    RunOutcome outcome(PipelineState state, List<StepRecord> records) {
        final RunStatus status;
        if (cancelled) {
            status = RunStatus.CANCELLED;
        }
        else if (failed) {
            status = RunStatus.FAILED;
        }
        else if (degraded) {
            status = RunStatus.DEGRADED;
        }
        else {
            status = RunStatus.SUCCEEDED;
        }
        return new RunOutcome(state, status, List.copyOf(records), error);
    }
}
