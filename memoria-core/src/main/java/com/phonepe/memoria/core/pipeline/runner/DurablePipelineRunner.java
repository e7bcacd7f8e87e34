package com.phonepe.memoria.core.pipeline.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Stopwatch;
import com.google.common.collect.Sets;
import com.phonepe.memoria.core.capability.Capability;
import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;
import com.phonepe.memoria.core.pipeline.PipelineRevision;
import com.phonepe.memoria.core.pipeline.PipelineState;
import com.phonepe.memoria.core.pipeline.RunContext;
import com.phonepe.memoria.core.pipeline.StepBinding;
import com.phonepe.memoria.core.pipeline.StepContext;
import com.phonepe.memoria.core.runlog.StepRecord;
import com.phonepe.memoria.core.runlog.StepStatus;
import dev.failsafe.Failsafe;
import dev.failsafe.Timeout;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a pipeline in waves. A wave is a run of consecutive steps that do not depend on each other; its steps are
 * executed in parallel on the executor, each with retries, exponential backoff and a timeout. State is
 * checkpointed after every wave so that a run interrupted by a restart can be resumed from the last finished wave.
 */
@Slf4j
public class DurablePipelineRunner extends AbstractPipelineRunner {
    private static final Duration DEFAULT_STEP_TIMEOUT = Duration.ofSeconds(60);

    private final RunCheckpointStore checkpointStore;
    private final ExecutorService executorService;
    private final ObjectMapper mapper;
    private final Duration stepTimeout;
    private final int maxParallelSteps;
    private final Clock clock;

    @Builder
    public DurablePipelineRunner(
            RetrySetup retrySetup,
            @NonNull RunCheckpointStore checkpointStore,
            @NonNull ExecutorService executorService,
            @NonNull ObjectMapper mapper,
            Duration stepTimeout,
            int maxParallelSteps,
            Clock clock) {
        super(retrySetup);
        this.checkpointStore = checkpointStore;
        this.executorService = executorService;
        this.mapper = mapper;
        this.stepTimeout = Objects.requireNonNullElse(stepTimeout, DEFAULT_STEP_TIMEOUT);
        this.maxParallelSteps = Math.max(1, maxParallelSteps);
        this.clock = Objects.requireNonNullElse(clock, Clock.systemUTC());
    }

    @Override
    public RunOutcome run(RunContext context, PipelineRevision revision, PipelineState state) {
        return execute(context, revision, state, List.of());
    }

    /**
     * Continue a run from its checkpoint. The revision must be the one the run started with.
     */
    public RunOutcome resume(RunCheckpoint checkpoint, RunContext context, PipelineRevision revision) {
        if (!revision.getToken().equals(checkpoint.getRevisionToken())) {
            throw MemoriaException.of(ErrorType.INTERNAL_ERROR,
                                      "run %s was checkpointed with revision %s, not %s"
                                              .formatted(checkpoint.getRunId(),
                                                         checkpoint.getRevisionToken(),
                                                         revision.getToken()));
        }
        log.info("Resuming run {} of {} after steps {}",
                 checkpoint.getRunId(), revision,
                 checkpoint.getSteps().stream().map(StepRecord::getStepId).toList());
        final var state = PipelineState.restore(mapper, checkpoint.getState(), checkpoint.isDegraded());
        return execute(context, revision, state, checkpoint.getSteps());
    }

    public List<RunCheckpoint> incompleteRuns() {
        return checkpointStore.incomplete();
    }

    /**
     * Forget a run that cannot be resumed
     */
    public void discard(String runId) {
        checkpointStore.delete(runId);
    }

    /**
     * Splits steps into waves. Writers and finalizers always run alone; other steps share a wave unless one needs
     * or overwrites a key another one of the wave produces.
     */
    static List<List<StepBinding>> waves(List<StepBinding> steps, int maxParallelSteps) {
        final var waves = new ArrayList<List<StepBinding>>();
        var current = new ArrayList<StepBinding>();
        final var produced = new HashSet<String>();
        final var required = new HashSet<String>();
        for (var binding : steps) {
            if (!current.isEmpty() && !fits(current, produced, required, binding, maxParallelSteps)) {
                waves.add(List.copyOf(current));
                current = new ArrayList<>();
                produced.clear();
                required.clear();
            }
            current.add(binding);
            produced.addAll(binding.getStep().produces());
            required.addAll(binding.getStep().requires());
        }
        if (!current.isEmpty()) {
            waves.add(List.copyOf(current));
        }
        return waves;
    }

    private RunOutcome execute(
            RunContext context,
            PipelineRevision revision,
            PipelineState state,
            List<StepRecord> alreadyDone) {
        final var progress = new RunProgress(state.isDegraded());
        final var records = new LinkedHashMap<String, StepRecord>();
        for (var record : alreadyDone) {
            records.put(record.getStepId(), record);
            revision.step(record.getStepId()).ifPresent(binding -> progress.record(binding, record, state));
        }
        final var pending = revision.getSteps()
                .stream()
                .filter(binding -> !records.containsKey(binding.id()))
                .toList();
        for (var wave : waves(pending, maxParallelSteps)) {
            final var admitted = new ArrayList<StepBinding>();
            for (var binding : wave) {
                if (!progress.admits(binding) || progress.checkCancelled(context, binding)) {
                    records.put(binding.id(), notRun(binding));
                }
                else {
                    admitted.add(binding);
                }
            }
            if (admitted.isEmpty()) {
                continue;
            }
            log.debug("Run {} executing wave {}", context.getRunId(), admitted.stream().map(StepBinding::id).toList());
            final var futures = admitted.stream()
                    .map(binding -> executeAsync(context, binding, state))
                    .toList();
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
            for (int i = 0; i < admitted.size(); i++) {
                final var record = futures.get(i).join();
                records.put(admitted.get(i).id(), record);
                progress.record(admitted.get(i), record, state);
            }
            checkpoint(context, revision, state, records);
        }
        checkpointStore.delete(context.getRunId());
        final var ordered = revision.getSteps()
                .stream()
                .map(binding -> records.getOrDefault(binding.id(), notRun(binding)))
                .toList();
        return progress.outcome(state, ordered);
    }

    private CompletableFuture<StepRecord> executeAsync(RunContext context, StepBinding binding, PipelineState state) {
        final var attempts = new AtomicInteger();
        final var stopwatch = Stopwatch.createStarted();
        return Failsafe.with(buildRetryPolicy(binding, true),
                             Timeout.builder(stepTimeout).withInterrupt().build())
                .with(executorService)
                .getAsync(() -> {
                    attempts.incrementAndGet();
                    return binding.getStep().execute(new StepContext(context, binding), state);
                })
                .handle((status, error) -> error == null
                                           ? completed(binding, status, attempts.get(), stopwatch)
                                           : failed(context, binding, error, attempts.get(), stopwatch));
    }

    private void checkpoint(
            RunContext context,
            PipelineRevision revision,
            PipelineState state,
            Map<String, StepRecord> records) {
        final var done = records.values()
                .stream()
                .filter(record -> record.getStatus() != StepStatus.NOT_RUN)
                .toList();
        checkpointStore.save(RunCheckpoint.builder()
                                     .runId(context.getRunId())
                                     .operation(context.getOperation())
                                     .pipeline(revision.getPipeline())
                                     .revision(revision.getRevision())
                                     .revisionToken(revision.getToken())
                                     .scope(context.getScope())
                                     .selector(context.getSelector())
                                     .steps(done)
                                     .state(state.snapshot())
                                     .degraded(state.isDegraded())
                                     .startedAt(context.getStartedAt())
                                     .updatedAt(clock.instant())
                                     .build());
    }

    private static boolean fits(
            List<StepBinding> wave,
            Set<String> produced,
            Set<String> required,
            StepBinding candidate,
            int maxParallelSteps) {
        if (wave.size() >= maxParallelSteps || isExclusive(candidate) || isExclusive(wave.get(0))) {
            return false;
        }
        final var step = candidate.getStep();
        return Sets.intersection(step.requires(), produced).isEmpty()
                && Sets.intersection(step.produces(), produced).isEmpty()
                && Sets.intersection(step.produces(), required).isEmpty();
    }

    private static boolean isExclusive(StepBinding binding) {
        return binding.isFinalizer() || binding.getStep().capabilities().contains(Capability.METADATA_WRITE);
    }
}
