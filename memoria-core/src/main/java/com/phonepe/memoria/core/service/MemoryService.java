package com.phonepe.memoria.core.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.google.common.util.concurrent.Striped;
import com.phonepe.memoria.core.capability.BlobStore;
import com.phonepe.memoria.core.capability.EmbeddingCapability;
import com.phonepe.memoria.core.capability.ExtractionCapability;
import com.phonepe.memoria.core.capability.LocalFileBlobStore;
import com.phonepe.memoria.core.capability.heuristic.HashingEmbeddingCapability;
import com.phonepe.memoria.core.capability.heuristic.HeuristicExtractionCapability;
import com.phonepe.memoria.core.config.MemoriaConfig;
import com.phonepe.memoria.core.config.RunnerMode;
import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaError;
import com.phonepe.memoria.core.errors.MemoriaException;
import com.phonepe.memoria.core.model.MemoryCategory;
import com.phonepe.memoria.core.model.MemoryItem;
import com.phonepe.memoria.core.model.OperationType;
import com.phonepe.memoria.core.pipeline.CancellationSignal;
import com.phonepe.memoria.core.pipeline.GuardedCalls;
import com.phonepe.memoria.core.pipeline.MemoriaServices;
import com.phonepe.memoria.core.pipeline.PipelineRegistry;
import com.phonepe.memoria.core.pipeline.PipelineRevision;
import com.phonepe.memoria.core.pipeline.PipelineState;
import com.phonepe.memoria.core.pipeline.RunContext;
import com.phonepe.memoria.core.pipeline.StateKey;
import com.phonepe.memoria.core.pipeline.StepBinding;
import com.phonepe.memoria.core.pipeline.runner.DurablePipelineRunner;
import com.phonepe.memoria.core.pipeline.runner.InMemoryRunCheckpointStore;
import com.phonepe.memoria.core.pipeline.runner.InlinePipelineRunner;
import com.phonepe.memoria.core.pipeline.runner.PipelineRunner;
import com.phonepe.memoria.core.pipeline.runner.RetrySetup;
import com.phonepe.memoria.core.pipeline.runner.RunCheckpoint;
import com.phonepe.memoria.core.pipeline.runner.RunCheckpointStore;
import com.phonepe.memoria.core.pipeline.runner.RunOutcome;
import com.phonepe.memoria.core.pipeline.steps.DefaultPipelines;
import com.phonepe.memoria.core.pipeline.steps.StateKeys;
import com.phonepe.memoria.core.pipeline.steps.retrieve.RetrievalProgress;
import com.phonepe.memoria.core.pipeline.steps.retrieve.RetrieveRequest;
import com.phonepe.memoria.core.policy.PolicyDecision;
import com.phonepe.memoria.core.policy.RetrievalPolicyEngine;
import com.phonepe.memoria.core.runlog.InMemoryRunLogStore;
import com.phonepe.memoria.core.runlog.RunListener;
import com.phonepe.memoria.core.runlog.RunLog;
import com.phonepe.memoria.core.runlog.RunLogStore;
import com.phonepe.memoria.core.runlog.RunStatus;
import com.phonepe.memoria.core.scope.Scope;
import com.phonepe.memoria.core.scope.ScopeSchema;
import com.phonepe.memoria.core.scope.ScopeSelector;
import com.phonepe.memoria.core.store.ItemFilter;
import com.phonepe.memoria.core.store.MetadataStore;
import com.phonepe.memoria.core.tenancy.ServiceMetadata;
import com.phonepe.memoria.core.tenancy.TenancyManager;
import com.phonepe.memoria.core.utils.JsonUtils;
import com.phonepe.memoria.core.utils.TextUtils;
import com.phonepe.memoria.core.vector.VectorIndex;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.locks.Lock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Entry point of the engine. Provisions the scope schema on construction, registers the built in pipelines and
 * runs memorize, retrieve and evolve as pipeline runs. Scopes, selectors and retrieval policy are checked before
 * anything touches a store. Every run is logged, whatever its outcome.
 * <p>
 * Thread safe. Runs of different scopes proceed in parallel; writers of the same scope serialise only for their
 * final commit.
 */
@Slf4j
public class MemoryService implements AutoCloseable {
    private static final int MAX_SUMMARY_LENGTH = 120;
    private static final int SCOPE_LOCK_STRIPES = 64;

    @Getter
    private final MemoriaServices services;
    @Getter
    private final PipelineRegistry registry;
    private final PipelineRunner runner;
    private final RunLogStore runLogStore;
    private final RetrievalPolicyEngine policyEngine;
    private final List<RunListener> listeners;
    private final ExecutorService executorService;
    private final boolean ownsExecutor;

    @Builder
    public MemoryService(
            @NonNull MetadataStore metadataStore,
            @NonNull ScopeSchema schema,
            VectorIndex vectorIndex,
            ExtractionCapability extraction,
            EmbeddingCapability embedding,
            BlobStore blobStore,
            MemoriaConfig config,
            RunLogStore runLogStore,
            RunCheckpointStore checkpointStore,
            ObjectMapper mapper,
            ExecutorService executorService,
            Clock clock,
            @Singular List<RunListener> listeners) {
        final var effectiveConfig = Objects.requireNonNullElse(config, MemoriaConfig.DEFAULT);
        final var effectiveClock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
        final var effectiveMapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
        final var effectiveEmbedding = vectorIndex != null
                                       ? Objects.requireNonNullElseGet(embedding, HashingEmbeddingCapability::new)
                                       : embedding;
        final var tenancy = new TenancyManager(metadataStore,
                                               vectorIndex,
                                               effectiveEmbedding == null ? 0 : effectiveEmbedding.dimension(),
                                               effectiveClock);
        tenancy.provision(schema);
        final var runnerConfig = effectiveConfig.getRunner();
        this.services = MemoriaServices.builder()
                .metadataStore(metadataStore)
                .vectorIndex(vectorIndex)
                .extraction(Objects.requireNonNullElseGet(extraction, HeuristicExtractionCapability::new))
                .embedding(effectiveEmbedding)
                .blobStore(Objects.requireNonNullElseGet(blobStore, () -> new LocalFileBlobStore(Path.of("."))))
                .tenancy(tenancy)
                .config(effectiveConfig)
                .mapper(effectiveMapper)
                .clock(effectiveClock)
                .calls(new GuardedCalls(runnerConfig.getCapabilityTimeout(), runnerConfig.getStoreTimeout()))
                .scopeLocks(Striped.lock(SCOPE_LOCK_STRIPES))
                .build();
        this.runLogStore = Objects.requireNonNullElseGet(
                runLogStore,
                () -> metadataStore instanceof RunLogStore store ? store : new InMemoryRunLogStore());
        this.policyEngine = new RetrievalPolicyEngine(effectiveConfig.getPolicy());
        this.listeners = List.copyOf(Objects.requireNonNullElseGet(listeners, List::<RunListener>of));
        this.ownsExecutor = executorService == null;
        this.executorService = Objects.requireNonNullElseGet(executorService, Executors::newCachedThreadPool);
        final var retrySetup = RetrySetup.from(runnerConfig);
        this.runner = runnerConfig.getMode() == RunnerMode.DURABLE
                      ? DurablePipelineRunner.builder()
                              .retrySetup(retrySetup)
                              .checkpointStore(Objects.requireNonNullElseGet(checkpointStore,
                                                                             InMemoryRunCheckpointStore::new))
                              .executorService(this.executorService)
                              .mapper(effectiveMapper)
                              .stepTimeout(runnerConfig.getStepTimeout())
                              .maxParallelSteps(runnerConfig.getMaxParallelSteps())
                              .clock(effectiveClock)
                              .build()
                      : new InlinePipelineRunner(retrySetup);
        this.registry = new PipelineRegistry(services.availableCapabilities(), effectiveClock)
                .onPublish(revision -> tenancy.recordPipelineRevision(revision.getPipeline(), revision.getToken()));
        DefaultPipelines.registerAll(registry);
        log.info("Memory service ready: schema {}, {} runner, vector search {}",
                 schema.fieldNames(), runnerConfig.getMode(),
                 services.vectorSearchAvailable() ? "enabled" : "disabled");
    }

    public OperationOutput<MemorizeResult> memorize(Scope scope, ResourceInput input) {
        return memorize(scope, input, MemorizeOptions.DEFAULT);
    }

    /**
     * Ingest a resource into a scope and extract memories from it
     */
    public OperationOutput<MemorizeResult> memorize(Scope scope, ResourceInput input, MemorizeOptions options) {
        final var runId = newRunId();
        final var startedAt = services.getClock().instant();
        final var summary = describe(input);
        final Scope validated;
        try {
            validated = services.getTenancy().validate(scope);
            checkInput(input);
        }
        catch (MemoriaException e) {
            return rejected(runId, OperationType.MEMORIZE, String.valueOf(scope), summary, e, startedAt);
        }
        final var state = new PipelineState(services.getMapper())
                .put(StateKeys.RESOURCE_INPUT, input)
                .put(StateKeys.MEMORIZE_OPTIONS, Objects.requireNonNullElse(options, MemorizeOptions.DEFAULT));
        final var context = RunContext.builder()
                .runId(runId)
                .operation(OperationType.MEMORIZE)
                .scope(validated)
                .selector(ScopeSelector.exact(validated))
                .services(services)
                .cancellation(CancellationSignal.create())
                .startedAt(startedAt)
                .build();
        return execute(context, state, summary, StateKeys.MEMORIZE_RESULT, result -> result);
    }

    public OperationOutput<RetrieveResult> retrieve(Scope scope, String query) {
        return retrieve(scope == null ? null : ScopeSelector.exact(scope), query, RetrieveOptions.DEFAULT);
    }

    public OperationOutput<RetrieveResult> retrieve(ScopeSelector selector, String query) {
        return retrieve(selector, query, RetrieveOptions.DEFAULT);
    }

    /**
     * Gather the context relevant to a query from every scope the selector addresses. Selectors spanning several
     * scopes go through the retrieval policy first.
     */
    public OperationOutput<RetrieveResult> retrieve(ScopeSelector selector, String query, RetrieveOptions options) {
        final var runId = newRunId();
        final var startedAt = services.getClock().instant();
        final var summary = "query=" + TextUtils.truncate(Strings.nullToEmpty(query), MAX_SUMMARY_LENGTH);
        final var effectiveOptions = Objects.requireNonNullElse(options, RetrieveOptions.DEFAULT);
        final ScopeSelector validated;
        final PolicyDecision policy;
        try {
            if (Strings.isNullOrEmpty(query) || query.isBlank()) {
                throw MemoriaException.of(ErrorType.INVALID_INPUT, "query is empty");
            }
            if (selector == null) {
                throw MemoriaException.of(ErrorType.SCOPE_SCHEMA_MISMATCH, "selector is missing");
            }
            validated = services.getTenancy().validate(selector);
            policy = policyEngine.evaluate(validated, services.vectorSearchAvailable());
        }
        catch (MemoriaException e) {
            return rejected(runId, OperationType.RETRIEVE, String.valueOf(selector), summary, e, startedAt);
        }
        final var state = new PipelineState(services.getMapper())
                .put(StateKeys.RETRIEVE_REQUEST,
                     RetrieveRequest.resolve(query, effectiveOptions, services.getConfig().getRetrieve()))
                .put(StateKeys.PROGRESS, RetrievalProgress.DESCEND);
        final var context = RunContext.builder()
                .runId(runId)
                .operation(OperationType.RETRIEVE)
                .scope(validated.isSingleExact() ? validated.toExactScope() : null)
                .selector(validated)
                .services(services)
                .cancellation(Objects.requireNonNullElseGet(effectiveOptions.getCancellation(),
                                                            CancellationSignal::create))
                .policy(policy)
                .startedAt(startedAt)
                .build();
        return execute(context, state, summary, StateKeys.RETRIEVE_RESULT, result -> result);
    }

    public OperationOutput<EvolveResult> evolve(Scope scope) {
        return evolve(scope, EvolveOptions.DEFAULT);
    }

    /**
     * Refresh, consolidate and re-cluster the memories of a scope
     */
    public OperationOutput<EvolveResult> evolve(Scope scope, EvolveOptions options) {
        final var runId = newRunId();
        final var startedAt = services.getClock().instant();
        final var effectiveOptions = Objects.requireNonNullElse(options, EvolveOptions.DEFAULT);
        final var summary = "refreshAll=%s maxTargets=%d".formatted(effectiveOptions.isRefreshAll(),
                                                                    effectiveOptions.getMaxTargets());
        final Scope validated;
        try {
            validated = services.getTenancy().validate(scope);
        }
        catch (MemoriaException e) {
            return rejected(runId, OperationType.EVOLVE, String.valueOf(scope), summary, e, startedAt);
        }
        final var state = new PipelineState(services.getMapper())
                .put(StateKeys.EVOLVE_OPTIONS, effectiveOptions);
        final var context = RunContext.builder()
                .runId(runId)
                .operation(OperationType.EVOLVE)
                .scope(validated)
                .selector(ScopeSelector.exact(validated))
                .services(services)
                .cancellation(CancellationSignal.create())
                .startedAt(startedAt)
                .build();
        return execute(context, state, summary, StateKeys.EVOLUTION_DIFF, EvolveResult::new);
    }

    /**
     * Categories of a scope by name. Summaries are left out unless asked for.
     */
    public OperationOutput<List<MemoryCategory>> listCategories(Scope scope, boolean includeSummary) {
        return guarded(scope, () -> {
            final var validated = services.getTenancy().validate(scope);
            return services.getCalls()
                    .store("list categories",
                           () -> services.getMetadataStore().listCategories(ScopeSelector.exact(validated)))
                    .stream()
                    .sorted(Comparator.comparing(MemoryCategory::getName, String.CASE_INSENSITIVE_ORDER))
                    .map(category -> includeSummary ? category : category.withSummary(null))
                    .toList();
        });
    }

    /**
     * Category by id or, failing that, by name
     */
    public OperationOutput<MemoryCategory> getCategory(Scope scope, String categoryKey) {
        return guarded(scope, () -> {
            final var validated = services.getTenancy().validate(scope);
            if (Strings.isNullOrEmpty(categoryKey)) {
                throw MemoriaException.of(ErrorType.INVALID_INPUT, "category id or name is empty");
            }
            final var store = services.getMetadataStore();
            return services.getCalls()
                    .store("get category", () -> store.getCategory(validated, categoryKey))
                    .or(() -> services.getCalls()
                            .store("find category", () -> store.findCategoryByName(validated, categoryKey)))
                    .orElseThrow(() -> MemoriaException.of(ErrorType.NOT_FOUND,
                                                           "category %s in scope %s".formatted(categoryKey,
                                                                                               validated)));
        });
    }

    public OperationOutput<List<MemoryItem>> listItems(Scope scope) {
        return listItems(scope, ItemFilter.LIVE);
    }

    public OperationOutput<List<MemoryItem>> listItems(Scope scope, ItemFilter filter) {
        return guarded(scope, () -> {
            final var validated = services.getTenancy().validate(scope);
            return services.getCalls()
                    .store("list items",
                           () -> services.getMetadataStore().listItems(ScopeSelector.exact(validated),
                                                                       Objects.requireNonNullElse(filter,
                                                                                                  ItemFilter.LIVE)));
        });
    }

    /**
     * Delete everything stored for a scope, vectors included
     *
     * @return Number of metadata rows and vectors removed
     */
    public OperationOutput<Integer> purge(Scope scope) {
        return guarded(scope, () -> {
            final var validated = services.getTenancy().validate(scope);
            final Lock lock = services.scopeLock(validated);
            lock.lock();
            try {
                var removed = services.getCalls()
                        .store("purge", () -> services.getMetadataStore().purge(validated));
                final var index = services.getVectorIndex();
                if (index != null) {
                    removed += services.getCalls().store("purge vectors", () -> index.deleteScope(validated));
                }
                log.warn("Purged scope {}: {} rows and vectors removed", validated, removed);
                return removed;
            }
            finally {
                lock.unlock();
            }
        });
    }

    public Optional<RunLog> runLog(String runId) {
        return runLogStore.get(runId);
    }

    public List<RunLog> recentRuns(int count) {
        return runLogStore.recent(count);
    }

    public ServiceMetadata metadata() {
        return services.getTenancy().metadata();
    }

    /**
     * Continue runs a durable runner checkpointed before a restart. Runs whose pipeline revision is gone are
     * logged as failed and dropped.
     *
     * @return Logs of the resumed runs
     */
    public List<RunLog> resumeIncompleteRuns() {
        if (!(runner instanceof DurablePipelineRunner durable)) {
            return List.of();
        }
        final var resumed = new ArrayList<RunLog>();
        for (var checkpoint : durable.incompleteRuns()) {
            resumed.add(resume(durable, checkpoint));
        }
        log.info("Resumed {} incomplete runs", resumed.size());
        return resumed;
    }

    public OperationOutput<PipelineRevision> configureStep(
            OperationType operation,
            String stepId,
            Map<String, Object> config) {
        return guarded(null, () -> registry.configureStep(operation.pipelineName(), stepId, config));
    }

    public OperationOutput<PipelineRevision> insertStepBefore(
            OperationType operation,
            String targetStepId,
            StepBinding binding) {
        return guarded(null, () -> registry.insertBefore(operation.pipelineName(), targetStepId, binding));
    }

    public OperationOutput<PipelineRevision> insertStepAfter(
            OperationType operation,
            String targetStepId,
            StepBinding binding) {
        return guarded(null, () -> registry.insertAfter(operation.pipelineName(), targetStepId, binding));
    }

    public OperationOutput<PipelineRevision> replaceStep(OperationType operation, String stepId, StepBinding binding) {
        return guarded(null, () -> registry.replaceStep(operation.pipelineName(), stepId, binding));
    }

    public OperationOutput<PipelineRevision> removeStep(OperationType operation, String stepId) {
        return guarded(null, () -> registry.removeStep(operation.pipelineName(), stepId));
    }

    public OperationOutput<PipelineRevision> rollbackPipeline(OperationType operation, int revision) {
        return guarded(null, () -> registry.rollback(operation.pipelineName(), revision));
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executorService.shutdownNow();
        }
    }

    private RunLog resume(DurablePipelineRunner durable, RunCheckpoint checkpoint) {
        final var startedAt = Objects.requireNonNullElseGet(checkpoint.getStartedAt(), services.getClock()::instant);
        final var runLog = RunLog.builder()
                .runId(checkpoint.getRunId())
                .operation(checkpoint.getOperation())
                .pipeline(checkpoint.getPipeline())
                .revision(checkpoint.getRevision())
                .revisionToken(checkpoint.getRevisionToken())
                .scope(checkpoint.getScope() != null
                       ? checkpoint.getScope().key()
                       : String.valueOf(checkpoint.getSelector()))
                .status(RunStatus.RUNNING)
                .inputSummary("resumed")
                .steps(checkpoint.getSteps())
                .startedAt(startedAt)
                .build();
        try {
            final var revision = registry.revision(checkpoint.getPipeline(), checkpoint.getRevision());
            final var selector = checkpoint.getSelector();
            final var context = RunContext.builder()
                    .runId(checkpoint.getRunId())
                    .operation(checkpoint.getOperation())
                    .scope(checkpoint.getScope())
                    .selector(selector)
                    .services(services)
                    .cancellation(CancellationSignal.create())
                    .policy(checkpoint.getOperation() == OperationType.RETRIEVE
                            ? policyEngine.evaluate(selector, services.vectorSearchAvailable())
                            : null)
                    .startedAt(startedAt)
                    .build();
            final var outcome = durable.resume(checkpoint, context, revision);
            return finish(runLog, outcome);
        }
        catch (MemoriaException e) {
            log.error("Could not resume run {}: {}", checkpoint.getRunId(), e.getMessage());
            durable.discard(checkpoint.getRunId());
            return finish(runLog.withStatus(RunStatus.FAILED).withError(e.getError()), null);
        }
    }

    private <S, T> OperationOutput<T> execute(
            RunContext context,
            PipelineState state,
            String inputSummary,
            StateKey<S> resultKey,
            Function<S, T> toResult) {
        final var revision = registry.current(context.getOperation().pipelineName());
        var runLog = RunLog.builder()
                .runId(context.getRunId())
                .operation(context.getOperation())
                .pipeline(revision.getPipeline())
                .revision(revision.getRevision())
                .revisionToken(revision.getToken())
                .scope(context.scopeDescription())
                .status(RunStatus.RUNNING)
                .inputSummary(inputSummary)
                .steps(List.of())
                .startedAt(context.getStartedAt())
                .build();
        runLogStore.save(runLog);
        log.debug("Run {} started: {} on {}", context.getRunId(), revision, context.scopeDescription());
        final RunOutcome outcome;
        try {
            outcome = runner.run(context, revision, state);
        }
        catch (RuntimeException e) {
            log.error("Run {} failed unexpectedly", context.getRunId(), e);
            final var error = MemoriaError.error(ErrorType.INTERNAL_ERROR, e)
                    .withRunId(context.getRunId())
                    .withScope(context.scopeDescription());
            finish(runLog.withStatus(RunStatus.FAILED).withError(error), null);
            return OperationOutput.error(error, context.getRunId());
        }
        runLog = finish(runLog, outcome);
        if (runLog.getStatus() != RunStatus.SUCCEEDED && runLog.getStatus() != RunStatus.DEGRADED) {
            return OperationOutput.error(runLog.getError(), context.getRunId());
        }
        final var result = state.get(resultKey);
        if (result.isEmpty()) {
            final var error = MemoriaError.error(ErrorType.INTERNAL_ERROR,
                                                 "pipeline %s produced no %s".formatted(revision, resultKey))
                    .withRunId(context.getRunId())
                    .withScope(context.scopeDescription());
            return OperationOutput.error(error, context.getRunId());
        }
        return OperationOutput.success(toResult.apply(result.get()), context.getRunId());
    }

    private RunLog finish(RunLog runLog, RunOutcome outcome) {
        var finished = runLog.withFinishedAt(services.getClock().instant());
        if (outcome != null) {
            finished = finished.withStatus(outcome.getStatus())
                    .withSteps(outcome.getSteps())
                    .withError(outcome.getError())
                    .withDiff(outcome.getState().get(StateKeys.EVOLUTION_DIFF).orElse(null));
        }
        runLogStore.save(finished);
        log.info("Run {} of {} on {} finished: {}",
                 finished.getRunId(), finished.getPipeline(), finished.getScope(), finished.getStatus());
        notifyListeners(finished);
        return finished;
    }

    private <T> OperationOutput<T> rejected(
            String runId,
            OperationType operation,
            String target,
            String inputSummary,
            MemoriaException e,
            Instant startedAt) {
        final var error = e.getError().withRunId(runId).withScope(target);
        log.warn("Rejected {} on {}: {}", operation, target, error.getMessage());
        final var runLog = RunLog.builder()
                .runId(runId)
                .operation(operation)
                .pipeline(operation.pipelineName())
                .scope(target)
                .status(RunStatus.FAILED)
                .inputSummary(inputSummary)
                .steps(List.of())
                .error(error)
                .startedAt(startedAt)
                .finishedAt(services.getClock().instant())
                .build();
        runLogStore.save(runLog);
        notifyListeners(runLog);
        return OperationOutput.error(error, runId);
    }

    private <T> OperationOutput<T> guarded(Scope scope, Supplier<T> call) {
        try {
            return OperationOutput.success(call.get(), null);
        }
        catch (MemoriaException e) {
            log.warn("Call on {} failed: {}", scope, e.getMessage());
            return OperationOutput.error(e.getError().withScope(scope == null ? null : scope.toString()), null);
        }
    }

    private void notifyListeners(RunLog runLog) {
        for (var listener : listeners) {
            try {
                listener.onRunFinished(runLog);
            }
            catch (RuntimeException e) {
                log.warn("Run listener {} failed for run {}: {}",
                         listener.getClass().getSimpleName(), runLog.getRunId(), e.getMessage());
            }
        }
    }

    private static void checkInput(ResourceInput input) {
        if (input == null) {
            throw MemoriaException.of(ErrorType.INVALID_INPUT, "resource input is missing");
        }
        if (Strings.isNullOrEmpty(input.getContent()) && Strings.isNullOrEmpty(input.getUri())) {
            throw MemoriaException.of(ErrorType.INVALID_INPUT, "resource needs inline content or a uri");
        }
        if (input.getModality() == null) {
            throw MemoriaException.of(ErrorType.INVALID_INPUT, "resource modality is missing");
        }
    }

    private static String describe(ResourceInput input) {
        if (input == null) {
            return "no input";
        }
        return "modality=%s uri=%s chars=%d".formatted(input.getModality(),
                                                       input.getUri(),
                                                       Strings.nullToEmpty(input.getContent()).length());
    }

    private static String newRunId() {
        return UUID.randomUUID().toString();
    }
}
