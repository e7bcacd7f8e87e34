package com.phonepe.memoria.core.service;

import com.phonepe.memoria.core.config.MemoriaConfig;
import com.phonepe.memoria.core.config.RunnerConfig;
import com.phonepe.memoria.core.config.RunnerMode;
import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;
import com.phonepe.memoria.core.pipeline.runner.InMemoryRunCheckpointStore;
import com.phonepe.memoria.core.pipeline.runner.RunCheckpoint;
import com.phonepe.memoria.core.runlog.RunStatus;
import com.phonepe.memoria.core.scope.Scope;
import com.phonepe.memoria.core.scope.ScopeSchema;
import com.phonepe.memoria.core.scope.ScopeSelector;
import com.phonepe.memoria.core.store.InMemoryMetadataStore;
import com.phonepe.memoria.core.store.ItemFilter;
import com.phonepe.memoria.core.vector.BruteForceVectorIndex;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class DurableMemoryServiceTest {
    private static final ScopeSchema SCHEMA = ScopeSchema.parse("project:string, agent:string");
    private static final Scope P1 = Scope.of("project", "p1", "agent", "a1");

    private static final class RecordingCheckpointStore extends InMemoryRunCheckpointStore {
        private final List<RunCheckpoint> saved = new CopyOnWriteArrayList<>();

        @Override
        public void save(RunCheckpoint checkpoint) {
            saved.add(checkpoint);
            super.save(checkpoint);
        }
    }

    @Test
    void testDurableRunsBehaveLikeInlineRuns() {
        final var checkpoints = new RecordingCheckpointStore();
        try (var service = service(new InMemoryMetadataStore(), checkpoints)) {
            final var memorized = service.memorize(P1, ResourceInput.conversation("My favorite color is blue"));
            assertTrue(memorized.isSuccess(), () -> memorized.getError().getMessage());
            final var recalled = service.retrieve(P1, "what color do they like");
            assertTrue(recalled.isSuccess(), () -> recalled.getError().getMessage());
            assertFalse(recalled.getData().getItems().isEmpty());
            assertFalse(checkpoints.saved.isEmpty());
            assertTrue(checkpoints.incomplete().isEmpty());
            assertTrue(service.resumeIncompleteRuns().isEmpty());
        }
    }

    @Test
    void testInterruptedRunIsResumedFromCheckpoint() {
        final var store = spy(new InMemoryMetadataStore());
        final var checkpoints = new RecordingCheckpointStore();
        final String runId;
        try (var crashing = service(store, checkpoints)) {
            doThrow(MemoriaException.of(ErrorType.STORE_FAILURE, "disk full")).when(store).commit(any());
            final var output = crashing.memorize(P1, ResourceInput.conversation("My favorite color is blue"));
            assertFalse(output.isSuccess());
            runId = output.getRunId();
        }
        assertTrue(store.listItems(ScopeSelector.exact(P1), ItemFilter.ALL).isEmpty());

        // last checkpoint written before the commit step, as if the process had died there
        final var beforeCommit = checkpoints.saved
                .stream()
                .filter(checkpoint -> checkpoint.getSteps()
                        .stream()
                        .noneMatch(step -> step.getStepId().equals("persist_memories")))
                .reduce((first, second) -> second)
                .orElseThrow();
        final var restarted = new InMemoryRunCheckpointStore();
        restarted.save(beforeCommit);
        doCallRealMethod().when(store).commit(any());

        try (var service = service(store, restarted)) {
            final var resumed = service.resumeIncompleteRuns();
            assertEquals(1, resumed.size());
            assertEquals(runId, resumed.get(0).getRunId());
            assertEquals(RunStatus.SUCCEEDED, resumed.get(0).getStatus());
            assertTrue(restarted.incomplete().isEmpty());
            final var items = store.listItems(ScopeSelector.exact(P1), ItemFilter.LIVE);
            assertEquals(1, items.size());
            assertTrue(items.get(0).getContent().contains("blue"));
        }
    }

    @Test
    void testCheckpointOfUnknownRevisionIsDiscarded() {
        final var store = new InMemoryMetadataStore();
        final var checkpoints = new RecordingCheckpointStore();
        try (var service = service(store, checkpoints)) {
            service.memorize(P1, ResourceInput.conversation("My favorite color is blue"));
            final var stale = checkpoints.saved.get(0).withRunId("stale-run").withRevisionToken("0000");
            checkpoints.save(stale);
            final var resumed = service.resumeIncompleteRuns();
            assertEquals(1, resumed.size());
            assertEquals(RunStatus.FAILED, resumed.get(0).getStatus());
            assertEquals(ErrorType.INTERNAL_ERROR, resumed.get(0).getError().getErrorType());
            assertTrue(checkpoints.incomplete().isEmpty());
            assertTrue(service.runLog("stale-run").isPresent());
        }
    }

    private static MemoryService service(InMemoryMetadataStore store, InMemoryRunCheckpointStore checkpoints) {
        return MemoryService.builder()
                .metadataStore(store)
                .vectorIndex(new BruteForceVectorIndex())
                .schema(SCHEMA)
                .checkpointStore(checkpoints)
                .config(MemoriaConfig.builder()
                                .runner(RunnerConfig.builder()
                                                .mode(RunnerMode.DURABLE)
                                                .maxAttempts(2)
                                                .retryDelay(Duration.ofMillis(1))
                                                .maxRetryDelay(Duration.ofMillis(5))
                                                .stepTimeout(Duration.ofSeconds(10))
                                                .build())
                                .build())
                .build();
    }
}
