package com.phonepe.memoria.core.pipeline.runner;

import com.phonepe.memoria.core.pipeline.PipelineRevision;
import com.phonepe.memoria.core.pipeline.PipelineState;
import com.phonepe.memoria.core.pipeline.RunContext;

/**
 * Executes the steps of a pipeline revision. Callers cannot tell runners apart from the outcome: the same steps
 * run with the same failure handling, only scheduling and durability differ.
 */
public interface PipelineRunner {
    RunOutcome run(RunContext context, PipelineRevision revision, PipelineState state);
}
