package com.phonepe.memoria.core.pipeline.runner;

import com.phonepe.memoria.core.errors.MemoriaError;
import com.phonepe.memoria.core.pipeline.PipelineState;
import com.phonepe.memoria.core.runlog.RunStatus;
import com.phonepe.memoria.core.runlog.StepRecord;
import lombok.Value;

import java.util.List;

/**
 * What a runner hands back once a run stops
 */
@Value
public class RunOutcome {
    PipelineState state;
    RunStatus status;
    List<StepRecord> steps;
    /**
     * Error that stopped or degraded the run
     */
    MemoriaError error;
}
