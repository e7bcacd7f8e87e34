package com.phonepe.memoria.core.pipeline.runner;

import com.google.common.base.Stopwatch;
import com.phonepe.memoria.core.pipeline.PipelineRevision;
import com.phonepe.memoria.core.pipeline.PipelineState;
import com.phonepe.memoria.core.pipeline.RunContext;
import com.phonepe.memoria.core.pipeline.StepContext;
import com.phonepe.memoria.core.runlog.StepRecord;
import dev.failsafe.Failsafe;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the steps one after the other on the calling thread
 */
@Slf4j
public class InlinePipelineRunner extends AbstractPipelineRunner {

    public InlinePipelineRunner() {
        this(RetrySetup.DEFAULT);
    }

    public InlinePipelineRunner(RetrySetup retrySetup) {
        super(retrySetup);
    }

    @Override
    public RunOutcome run(RunContext context, PipelineRevision revision, PipelineState state) {
        log.debug("Running {} inline for run {}", revision, context.getRunId());
        final var progress = new RunProgress(state.isDegraded());
        final var records = new ArrayList<StepRecord>();
        for (var binding : revision.getSteps()) {
            if (!progress.admits(binding) || progress.checkCancelled(context, binding)) {
                records.add(notRun(binding));
                continue;
            }
            final var attempts = new AtomicInteger();
            final var stopwatch = Stopwatch.createStarted();
            StepRecord record;
            try {
                final var status = Failsafe.with(buildRetryPolicy(binding, false))
                        .get(() -> {
                            attempts.incrementAndGet();
                            return binding.getStep().execute(new StepContext(context, binding), state);
                        });
                record = completed(binding, status, attempts.get(), stopwatch);
            }
            catch (RuntimeException e) {
                record = failed(context, binding, e, attempts.get(), stopwatch);
            }
            records.add(record);
            progress.record(binding, record, state);
        }
        return progress.outcome(state, records);
    }
}
