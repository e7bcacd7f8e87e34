package com.phonepe.memoria.core.service;

import com.phonepe.memoria.core.capability.CapabilityResponse;
import com.phonepe.memoria.core.capability.EmbeddingCapability;
import com.phonepe.memoria.core.capability.ExtractedFact;
import com.phonepe.memoria.core.capability.heuristic.HeuristicExtractionCapability;
import com.phonepe.memoria.core.config.MemoriaConfig;
import com.phonepe.memoria.core.config.RecallMethod;
import com.phonepe.memoria.core.config.RunnerConfig;
import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;
import com.phonepe.memoria.core.model.MemoryItem;
import com.phonepe.memoria.core.model.OperationType;
import com.phonepe.memoria.core.pipeline.BaseStep;
import com.phonepe.memoria.core.pipeline.PipelineState;
import com.phonepe.memoria.core.pipeline.StepBinding;
import com.phonepe.memoria.core.pipeline.StepContext;
import com.phonepe.memoria.core.pipeline.StepRole;
import com.phonepe.memoria.core.runlog.StepStatus;
import com.phonepe.memoria.core.model.Scored;
import com.phonepe.memoria.core.runlog.RunStatus;
import com.phonepe.memoria.core.scope.Scope;
import com.phonepe.memoria.core.scope.ScopeSchema;
import com.phonepe.memoria.core.scope.ScopeSelector;
import com.phonepe.memoria.core.store.InMemoryMetadataStore;
import com.phonepe.memoria.core.store.ItemFilter;
import com.phonepe.memoria.core.store.MetadataStore;
import com.phonepe.memoria.core.store.ResourceFilter;
import com.phonepe.memoria.core.vector.BruteForceVectorIndex;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class MemoryServiceTest {
    private static final ScopeSchema SCHEMA = ScopeSchema.parse("project:string, agent:string");
    private static final Scope P1 = Scope.of("project", "p1", "agent", "a1");
    private static final Scope P2 = Scope.of("project", "p2", "agent", "a1");

    private InMemoryMetadataStore store;
    private MemoryService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryMetadataStore();
        service = MemoryService.builder()
                .metadataStore(store)
                .vectorIndex(new BruteForceVectorIndex())
                .schema(SCHEMA)
                .build();
    }

    @AfterEach
    void tearDown() {
        service.close();
    }

    @Test
    void testFavoriteColorIsRecalledOnlyInItsScope() {
        final var memorized = service.memorize(P1, ResourceInput.conversation("My favorite color is blue"));
        assertTrue(memorized.isSuccess(), () -> memorized.getError().getMessage());
        final var result = memorized.getData();
        assertNotNull(result.getResource());
        assertFalse(result.isDeduplicated());
        assertFalse(result.getItems().isEmpty());
        final var item = result.getItems()
                .stream()
                .filter(i -> i.getContent().contains("blue"))
                .findFirst()
                .orElseThrow();
        assertEquals(result.getResource().getId(), item.getEvidence().getResourceId());
        assertEquals(result.getResource().getId(), item.getResourceId());
        assertEquals(P1, item.getScope());
        assertFalse(result.getCategories().isEmpty());
        final var linked = result.getCategories()
                .stream()
                .anyMatch(category -> !store.listLinks(P1, category.getId(), item.getId()).isEmpty());
        assertTrue(linked);
        assertEquals(1, store.listResources(ScopeSelector.exact(P1), ResourceFilter.LIVE).size());

        final var recalled = service.retrieve(P1, "what color do they like");
        assertTrue(recalled.isSuccess(), () -> recalled.getError().getMessage());
        assertTrue(itemIds(recalled.getData().getItems()).contains(item.getId()));

        final var other = service.retrieve(P2, "what color do they like");
        assertTrue(other.isSuccess());
        assertTrue(other.getData().getItems().isEmpty());
        assertTrue(other.getData().getCategories().isEmpty());
    }

    @Test
    void testSameContentIsIngestedOnce() {
        final var first = service.memorize(P1, ResourceInput.conversation("My favorite color is blue"));
        final var second = service.memorize(P1, ResourceInput.conversation("My favorite color is blue"));
        assertTrue(first.isSuccess());
        assertTrue(second.isSuccess());
        assertTrue(second.getData().isDeduplicated());
        assertEquals(first.getData().getResource().getId(), second.getData().getResource().getId());
        assertEquals(itemIdsOf(first.getData().getItems()), itemIdsOf(second.getData().getItems()));
        assertEquals(1, store.listResources(ScopeSelector.exact(P1), ResourceFilter.LIVE).size());
        assertEquals(first.getData().getItems().size(),
                     store.listItems(ScopeSelector.exact(P1), ItemFilter.ALL).size());
    }

    @Test
    void testRepeatedFactIsReinforced() {
        service.memorize(P1, ResourceInput.conversation("My favorite color is blue."));
        final var second = service.memorize(P1, ResourceInput.conversation("Hello there. My favorite color is blue!"));
        assertTrue(second.isSuccess());
        final var live = store.listItems(ScopeSelector.exact(P1), ItemFilter.LIVE);
        assertEquals(1, live.size());
        assertEquals(1, live.get(0).getReinforcementCount());
        assertEquals(2, store.listResources(ScopeSelector.exact(P1), ResourceFilter.LIVE).size());
    }

    @Test
    void testNewerFactSupersedesOlderVersion() {
        service.memorize(P1, ResourceInput.conversation("My favorite color is blue"));
        service.memorize(P1, ResourceInput.conversation("My favorite color is green"));
        final var live = store.listItems(ScopeSelector.exact(P1), ItemFilter.LIVE);
        assertEquals(1, live.size());
        assertTrue(live.get(0).getContent().contains("green"));
        assertEquals(2, live.get(0).getVersion());
        final var all = store.listItems(ScopeSelector.exact(P1), ItemFilter.ALL);
        assertEquals(2, all.size());
        final var previous = all.stream().filter(i -> !i.isLive()).findFirst().orElseThrow();
        assertEquals(live.get(0).getId(), previous.getSupersededBy());
        assertEquals(previous.getLineageId(), live.get(0).getLineageId());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testLessConfidentVersionIsRejected() {
        final var extraction = spy(new HeuristicExtractionCapability());
        final var local = new InMemoryMetadataStore();
        try (var guarded = MemoryService.builder()
                .metadataStore(local)
                .vectorIndex(new BruteForceVectorIndex())
                .schema(SCHEMA)
                .extraction(extraction)
                .build()) {
            assertTrue(guarded.memorize(P1, ResourceInput.conversation("My favorite color is blue")).isSuccess());
            doAnswer(invocation -> {
                final var real = (CapabilityResponse<List<ExtractedFact>>) invocation.callRealMethod();
                return CapabilityResponse.success(real.getData()
                                                          .stream()
                                                          .map(fact -> fact.withConfidence(0.01))
                                                          .toList());
            }).when(extraction).extract(any());
            final var output = guarded.memorize(P1, ResourceInput.conversation("My favorite color is green"));
            assertTrue(output.isSuccess(), () -> output.getError().getMessage());
            assertTrue(output.getData().getRejectedCandidates().stream().anyMatch(c -> c.contains("green")));
            final var live = local.listItems(ScopeSelector.exact(P1), ItemFilter.LIVE);
            assertEquals(1, live.size());
            assertTrue(live.get(0).getContent().contains("blue"));
            assertEquals(1, live.get(0).getVersion());
        }
    }

    @Test
    void testScopeWithWrongFieldsIsRejectedBeforeWriting() {
        final var output = service.memorize(Scope.of("project", "p1"),
                                            ResourceInput.conversation("My favorite color is blue"));
        assertFalse(output.isSuccess());
        assertEquals(ErrorType.SCOPE_SCHEMA_MISMATCH, output.getError().getErrorType());
        assertNotNull(output.getRunId());
        final var runLog = service.runLog(output.getRunId()).orElseThrow();
        assertEquals(RunStatus.FAILED, runLog.getStatus());
        assertTrue(store.listItems(ScopeSelector.builder()
                                           .anyOf("project", "p1")
                                           .wildcard("agent")
                                           .build(), ItemFilter.ALL).isEmpty());
    }

    @Test
    void testEmptyInputIsRejected() {
        final var output = service.memorize(P1, ResourceInput.builder().build());
        assertEquals(ErrorType.INVALID_INPUT, output.getError().getErrorType());
        final var retrieve = service.retrieve(P1, "  ");
        assertEquals(ErrorType.INVALID_INPUT, retrieve.getError().getErrorType());
    }

    @Test
    void testSchemaIsLockedAfterProvisioning() {
        final var error = assertThrows(MemoriaException.class,
                                       () -> MemoryService.builder()
                                               .metadataStore(store)
                                               .schema(ScopeSchema.parse("org:string, user:string"))
                                               .build());
        assertEquals(ErrorType.SCOPE_SCHEMA_MISMATCH, error.getErrorType());
        try (var again = MemoryService.builder().metadataStore(store).schema(SCHEMA).build()) {
            assertEquals(SCHEMA.fingerprint(), again.metadata().getSchemaFingerprint());
        }
    }

    @Test
    void testCrossScopeRetrieveSpansSelectedScopes() {
        service.memorize(P1, ResourceInput.conversation("My favorite color is blue"));
        service.memorize(P2, ResourceInput.conversation("My favorite color is green"));
        service.memorize(Scope.of("project", "p3", "agent", "a1"),
                         ResourceInput.conversation("My favorite color is red"));
        final var selector = ScopeSelector.builder()
                .anyOf("project", "p1", "p2")
                .exact("agent", "a1")
                .build();
        final var output = service.retrieve(selector, "what color do they like");
        assertTrue(output.isSuccess(), () -> output.getError().getMessage());
        final var scopes = output.getData()
                .getItems()
                .stream()
                .map(scored -> scored.getValue().getScope().get("project"))
                .distinct()
                .sorted()
                .toList();
        assertEquals(List.of("p1", "p2"), scopes);
    }

    @Test
    void testUnboundedSelectorIsRejectedBeforeStoreAccess() {
        final var mockStore = mock(MetadataStore.class);
        try (var guarded = MemoryService.builder().metadataStore(mockStore).schema(SCHEMA).build()) {
            final var wildcard = ScopeSelector.builder().wildcard("project").wildcard("agent").build();
            final var output = guarded.retrieve(wildcard, "what color do they like");
            assertEquals(ErrorType.POLICY_VIOLATION, output.getError().getErrorType());

            final var values = new ArrayList<String>();
            for (int i = 0; i < 70; i++) {
                values.add("p" + i);
            }
            final var tooWide = ScopeSelector.builder().anyOf("project", values).exact("agent", "a1").build();
            assertEquals(ErrorType.POLICY_VIOLATION,
                         guarded.retrieve(tooWide, "favorite color").getError().getErrorType());

            verify(mockStore, never()).listItems(any(), any());
            verify(mockStore, never()).listCategories(any());
            verify(mockStore, never()).listIntentions(any());
            verify(mockStore, never()).listResources(any(), any());
            assertEquals(RunStatus.FAILED, guarded.recentRuns(1).get(0).getStatus());
        }
    }

    @Test
    void testCommitFailureLeavesNothingBehind() {
        final var failing = spy(new InMemoryMetadataStore());
        try (var guarded = MemoryService.builder()
                .metadataStore(failing)
                .vectorIndex(new BruteForceVectorIndex())
                .schema(SCHEMA)
                .config(fastRetries())
                .build()) {
            doThrow(MemoriaException.of(ErrorType.STORE_FAILURE, "disk full")).when(failing).commit(any());
            final var output = guarded.memorize(P1, ResourceInput.conversation("My favorite color is blue"));
            assertFalse(output.isSuccess());
            assertEquals(ErrorType.STORE_FAILURE, output.getError().getErrorType());
            assertEquals("persist_memories", output.getError().getStepId());
            assertTrue(failing.listItems(ScopeSelector.exact(P1), ItemFilter.ALL).isEmpty());
            assertTrue(failing.listResources(ScopeSelector.exact(P1), ResourceFilter.LIVE).isEmpty());
            assertTrue(failing.listCategories(ScopeSelector.exact(P1)).isEmpty());
        }
    }

    @Test
    void testTransientCommitFailureIsRetried() {
        final var flaky = spy(new InMemoryMetadataStore());
        try (var guarded = MemoryService.builder()
                .metadataStore(flaky)
                .schema(SCHEMA)
                .config(fastRetries())
                .build()) {
            doThrow(MemoriaException.of(ErrorType.TRANSIENT_STORE_ERROR, "connection reset"))
                    .doCallRealMethod()
                    .when(flaky).commit(any());
            final var output = guarded.memorize(P1, ResourceInput.conversation("My favorite color is blue"));
            assertTrue(output.isSuccess(), () -> output.getError().getMessage());
            final var persist = guarded.runLog(output.getRunId())
                    .orElseThrow()
                    .getSteps()
                    .stream()
                    .filter(step -> step.getStepId().equals("persist_memories"))
                    .findFirst()
                    .orElseThrow();
            assertEquals(2, persist.getAttempts());
            assertEquals(1, flaky.listItems(ScopeSelector.exact(P1), ItemFilter.LIVE).size());
        }
    }

    @Test
    void testEvolveRevisesReinforcedItems() {
        service.memorize(P1, ResourceInput.conversation("My favorite color is blue."));
        service.memorize(P1, ResourceInput.conversation("Hi. My favorite color is blue!"));
        final var evolved = service.evolve(P1, EvolveOptions.builder().refreshAll(true).build());
        assertTrue(evolved.isSuccess(), () -> evolved.getError().getMessage());
        final var diff = evolved.getData().getDiff();
        assertEquals(1, diff.getRevisedItems().size());
        final var revision = diff.getRevisedItems().get(0);
        assertTrue(revision.getCurrentConfidence() > revision.getPreviousConfidence());

        final var live = store.listItems(ScopeSelector.exact(P1), ItemFilter.LIVE);
        assertEquals(1, live.size());
        assertEquals(revision.getCurrentId(), live.get(0).getId());
        final var previous = store.getItem(P1, revision.getPreviousId()).orElseThrow();
        assertEquals(revision.getCurrentId(), previous.getSupersededBy());
        assertTrue(store.listLinks(P1, null, previous.getId()).isEmpty());
        assertFalse(store.listLinks(P1, null, revision.getCurrentId()).isEmpty());
        assertNotNull(service.runLog(evolved.getRunId()).orElseThrow().getDiff());

        final var again = service.evolve(P1, EvolveOptions.builder().refreshAll(true).build());
        assertTrue(again.isSuccess());
        assertTrue(again.getData().getDiff().getRevisedItems().isEmpty());
    }

    @Test
    void testEvolveAbortsWhenScopeChangesUnderIt() {
        service.memorize(P1, ResourceInput.conversation("My favorite color is blue."));
        service.memorize(P1, ResourceInput.conversation("Hi. My favorite color is blue!"));
        final var before = store.listItems(ScopeSelector.exact(P1), ItemFilter.LIVE);
        assertTrue(service.insertStepBefore(OperationType.EVOLVE,
                                            "persist_evolution",
                                            StepBinding.abort(new TouchItemsStep(store)))
                           .isSuccess());

        final var evolved = service.evolve(P1, EvolveOptions.builder().refreshAll(true).build());
        assertFalse(evolved.isSuccess());
        assertEquals(ErrorType.CONCURRENT_MODIFICATION, evolved.getError().getErrorType());
        assertEquals("persist_evolution", evolved.getError().getStepId());
        final var after = store.listItems(ScopeSelector.exact(P1), ItemFilter.LIVE);
        assertEquals(itemIdsOf(before), itemIdsOf(after));
        assertEquals(before.size(), store.listItems(ScopeSelector.exact(P1), ItemFilter.ALL).size());
    }

    @Test
    void testEvolveLinksRelatedItemsWithinTheScope() {
        try (var linked = MemoryService.builder()
                .metadataStore(new InMemoryMetadataStore())
                .vectorIndex(new BruteForceVectorIndex())
                .embedding(new KeywordEmbedding())
                .schema(SCHEMA)
                .build()) {
            linked.memorize(P1, ResourceInput.conversation(
                    "My favorite color is blue. My favorite paint is matte. I want to learn the piano."));
            linked.memorize(P2, ResourceInput.conversation("My favorite color is green."));

            final var evolved = linked.evolve(P1, EvolveOptions.DEFAULT);
            assertTrue(evolved.isSuccess(), () -> evolved.getError().getMessage());
            final var items = linked.listItems(P1).getData();
            final var color = withContent(items, "blue");
            final var paint = withContent(items, "matte");
            final var piano = withContent(items, "piano");
            assertEquals(List.of(paint.getId()), color.getRelatedItemIds());
            assertEquals(List.of(color.getId()), paint.getRelatedItemIds());
            assertTrue(piano.getRelatedItemIds().isEmpty());
            assertEquals(Set.of(color.getId(), paint.getId()),
                         Set.copyOf(evolved.getData().getDiff().getRelinkedItemIds()));
            assertTrue(withContent(linked.listItems(P2).getData(), "green").getRelatedItemIds().isEmpty());

            final var recalled = linked.retrieve(ScopeSelector.exact(P1), "blue", RetrieveOptions.builder()
                    .itemTopK(1)
                    .method(RecallMethod.LEXICAL)
                    .sufficiencyCheck(false)
                    .verify(false)
                    .build());
            assertTrue(recalled.isSuccess(), () -> recalled.getError().getMessage());
            assertEquals(List.of(color.getId()), itemIds(recalled.getData().getItems()));
            assertEquals(List.of(paint.getId()), itemIds(recalled.getData().getRelatedItems()));

            final var again = linked.evolve(P1, EvolveOptions.DEFAULT);
            assertTrue(again.isSuccess());
            assertTrue(again.getData().getDiff().getRelinkedItemIds().isEmpty());
        }
    }

    @Test
    void testCategoriesAndPurge() {
        service.memorize(P1, ResourceInput.conversation("My favorite color is blue"));
        final var categories = service.listCategories(P1, false);
        assertTrue(categories.isSuccess());
        assertFalse(categories.getData().isEmpty());
        assertTrue(categories.getData().stream().allMatch(category -> category.getSummary() == null));
        final var name = categories.getData().get(0).getName();
        final var byName = service.getCategory(P1, name.toUpperCase());
        assertTrue(byName.isSuccess());
        assertEquals(ErrorType.NOT_FOUND, service.getCategory(P1, "no_such_category").getError().getErrorType());
        assertEquals(ErrorType.NOT_FOUND, service.getCategory(P2, name).getError().getErrorType());

        final var purged = service.purge(P1);
        assertTrue(purged.getData() > 0);
        assertTrue(service.listItems(P1).getData().isEmpty());
        assertTrue(service.listCategories(P1, true).getData().isEmpty());
    }

    @Test
    void testPipelineEditsCreateNewRevisions() {
        final var before = service.getRegistry().current(OperationType.RETRIEVE.pipelineName());
        final var edited = service.configureStep(OperationType.RETRIEVE, "recall_items", Map.of("topK", 3));
        assertTrue(edited.isSuccess());
        assertEquals(before.getRevision() + 1, edited.getData().getRevision());
        assertNotEquals(before.getToken(), edited.getData().getToken());
        assertTrue(before.step("recall_items").orElseThrow().getConfig().isEmpty());
        assertEquals(edited.getData().getToken(),
                     service.metadata().getPipelineRevisions().get(OperationType.RETRIEVE.pipelineName()));

        final var invalid = service.removeStep(OperationType.RETRIEVE, "route_category");
        assertEquals(ErrorType.VALIDATION_ERROR, invalid.getError().getErrorType());

        final var rolledBack = service.rollbackPipeline(OperationType.RETRIEVE, before.getRevision());
        assertTrue(rolledBack.isSuccess());
        assertEquals(before.stepIds(), rolledBack.getData().stepIds());
    }

    @Test
    void testStepOptionsChangeRetrieval() {
        service.memorize(P1, ResourceInput.conversation(
                "My favorite color is blue. My favorite food is pizza. My favorite sport is tennis."));
        final var options = RetrieveOptions.builder()
                .method(RecallMethod.LEXICAL)
                .sufficiencyCheck(false)
                .verify(false)
                .build();
        final var before = service.retrieve(ScopeSelector.exact(P1), "favorite", options);
        assertTrue(before.isSuccess(), () -> before.getError().getMessage());
        assertEquals(3, before.getData().getItems().size());

        assertTrue(service.configureStep(OperationType.RETRIEVE, "recall_items", Map.of("topK", 1)).isSuccess());
        final var after = service.retrieve(ScopeSelector.exact(P1), "favorite", options);
        assertTrue(after.isSuccess(), () -> after.getError().getMessage());
        assertEquals(1, after.getData().getItems().size());

        final var revision = service.getRegistry().current(OperationType.RETRIEVE.pipelineName()).getRevision();
        final var unknown = service.configureStep(OperationType.RETRIEVE, "recall_items", Map.of("noSuchKey", "x"));
        assertEquals(ErrorType.VALIDATION_ERROR, unknown.getError().getErrorType());
        assertEquals(revision, service.getRegistry().current(OperationType.RETRIEVE.pipelineName()).getRevision());
    }

    @Test
    void testIntentionAloneCanAnswerTheQuery() {
        final var watched = spy(new InMemoryMetadataStore());
        try (var guarded = MemoryService.builder()
                .metadataStore(watched)
                .vectorIndex(new BruteForceVectorIndex())
                .schema(SCHEMA)
                .build()) {
            assertTrue(guarded.memorize(P1, ResourceInput.conversation("I want to learn the piano")).isSuccess());
            clearInvocations(watched);

            final var output = guarded.retrieve(ScopeSelector.exact(P1),
                                                "learn piano",
                                                RetrieveOptions.builder().sufficiencyCheck(true).build());
            assertTrue(output.isSuccess(), () -> output.getError().getMessage());
            final var result = output.getData();
            assertEquals(1, result.getIntentions().size());
            assertTrue(result.getIntentions().get(0).getSummary().contains("learn the piano"));
            assertTrue(result.getCategories().isEmpty());
            assertTrue(result.getItems().isEmpty());
            assertTrue(result.getResources().isEmpty());
            verify(watched, never()).listCategories(any());
            verify(watched, never()).listItems(any(), any());

            final var statuses = new HashMap<String, StepStatus>();
            guarded.runLog(output.getRunId())
                    .orElseThrow()
                    .getSteps()
                    .forEach(step -> statuses.put(step.getStepId(), step.getStatus()));
            assertEquals(StepStatus.COMPLETED, statuses.get("sufficiency_after_intention"));
            assertEquals(StepStatus.SKIPPED, statuses.get("route_category"));
            assertEquals(StepStatus.SKIPPED, statuses.get("recall_items"));
        }
    }

    @Test
    void testListenersSeeEveryRun() {
        final var seen = new ArrayList<RunStatus>();
        try (var observed = MemoryService.builder()
                .metadataStore(new InMemoryMetadataStore())
                .schema(SCHEMA)
                .listener(runLog -> seen.add(runLog.getStatus()))
                .listener(runLog -> {
                    throw new IllegalStateException("listener failure");
                })
                .build()) {
            observed.memorize(P1, ResourceInput.conversation("My favorite color is blue"));
            observed.retrieve(P1, "");
            assertEquals(List.of(RunStatus.SUCCEEDED, RunStatus.FAILED), seen);
            assertEquals(2, observed.recentRuns(10).size());
        }
    }

    /**
     * Simulates a writer that updates the scope between planning and commit
     */
    private static class TouchItemsStep extends BaseStep {
        private final MetadataStore target;

        TouchItemsStep(MetadataStore target) {
            super("touch_items", StepRole.PLANNING, Set.of(), Set.of());
            this.target = target;
        }

        @Override
        public StepStatus execute(StepContext context, PipelineState state) {
            target.listItems(ScopeSelector.exact(context.scope()), ItemFilter.LIVE)
                    .forEach(item -> target.putItem(item.withUpdatedAt(item.getUpdatedAt().plusSeconds(1))));
            return StepStatus.COMPLETED;
        }
    }

    /**
     * Places colour and paint facts close together and everything else far away
     */
    private static class KeywordEmbedding implements EmbeddingCapability {
        @Override
        public float[] embed(String input) {
            final var text = input.toLowerCase();
            if (text.contains("color")) {
                return new float[]{1.0f, 0.0f, 0.0f};
            }
            if (text.contains("paint")) {
                return new float[]{0.9f, 0.1f, 0.0f};
            }
            return new float[]{0.0f, 0.0f, 1.0f};
        }

        @Override
        public int dimension() {
            return 3;
        }
    }

    private static MemoryItem withContent(List<MemoryItem> items, String text) {
        return items.stream().filter(item -> item.getContent().contains(text)).findFirst().orElseThrow();
    }

    private static MemoriaConfig fastRetries() {
        return MemoriaConfig.builder()
                .runner(RunnerConfig.builder()
                                .maxAttempts(3)
                                .retryDelay(Duration.ofMillis(1))
                                .maxRetryDelay(Duration.ofMillis(5))
                                .build())
                .build();
    }

    private static List<String> itemIds(List<Scored<MemoryItem>> items) {
        return items.stream().map(scored -> scored.getValue().getId()).toList();
    }

    private static List<String> itemIdsOf(List<MemoryItem> items) {
        return items.stream().map(MemoryItem::getId).sorted().toList();
    }
}
