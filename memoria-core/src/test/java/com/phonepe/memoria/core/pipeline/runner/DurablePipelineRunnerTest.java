package com.phonepe.memoria.core.pipeline.runner;

import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;
import com.phonepe.memoria.core.pipeline.MemoriaServices;
import com.phonepe.memoria.core.pipeline.PipelineRevision;
import com.phonepe.memoria.core.pipeline.StepBinding;
import com.phonepe.memoria.core.pipeline.TestSteps;
import com.phonepe.memoria.core.runlog.RunStatus;
import com.phonepe.memoria.core.runlog.StepStatus;
import com.phonepe.memoria.core.utils.JsonUtils;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.phonepe.memoria.core.pipeline.TestSteps.*;
import static org.junit.jupiter.api.Assertions.*;

class DurablePipelineRunnerTest {

    /**
     * Keeps every checkpoint ever written, including the ones of finished runs
     */
    private static final class RecordingCheckpointStore extends InMemoryRunCheckpointStore {
        private final List<RunCheckpoint> saved = new CopyOnWriteArrayList<>();

        @Override
        public void save(RunCheckpoint checkpoint) {
            saved.add(checkpoint);
            super.save(checkpoint);
        }
    }

    private MemoriaServices services;
    private ExecutorService executorService;
    private RecordingCheckpointStore checkpointStore;

    @BeforeEach
    void setUp() {
        services = TestSteps.services();
        executorService = Executors.newCachedThreadPool();
        checkpointStore = new RecordingCheckpointStore();
    }

    @AfterEach
    void tearDown() {
        executorService.shutdownNow();
    }

    @Test
    void testIndependentStepsShareAWave() {
        final var left = StepBinding.abort(new MapStep("left", SEED, LEFT, v -> v + 1));
        final var right = StepBinding.abort(new MapStep("right", SEED, RIGHT, v -> v + 2));
        final var sum = StepBinding.finalizer(new SumStep());
        assertEquals(List.of(List.of(left, right), List.of(sum)),
                     DurablePipelineRunner.waves(List.of(left, right, sum), 4));
        assertEquals(3, DurablePipelineRunner.waves(List.of(left, right, sum), 1).size());

        final var dependent = StepBinding.abort(new MapStep("dependent", LEFT, RIGHT, v -> v));
        assertEquals(2, DurablePipelineRunner.waves(List.of(left, dependent), 4).size());
    }

    @Test
    void testRunCompletesAndDropsCheckpoint() {
        final var outcome = runner().run(context(services), pipeline(), seeded(services, 1));
        assertEquals(RunStatus.SUCCEEDED, outcome.getStatus());
        assertEquals(5, outcome.getState().require(SUM));
        assertEquals(List.of(StepStatus.COMPLETED, StepStatus.COMPLETED, StepStatus.COMPLETED),
                     outcome.getSteps().stream().map(step -> step.getStatus()).toList());
        assertEquals(2, checkpointStore.saved.size());
        assertTrue(checkpointStore.incomplete().isEmpty());
    }

    @Test
    void testResumeSkipsFinishedSteps() {
        final var context = context(services);
        runner().run(context, pipeline(), seeded(services, 1));
        final var afterFirstWave = checkpointStore.saved.get(0);
        assertEquals(List.of("left", "right"),
                     afterFirstWave.getSteps().stream().map(step -> step.getStepId()).toList());

        final var left = new MapStep("left", SEED, LEFT, v -> v + 1);
        final var right = new MapStep("right", SEED, RIGHT, v -> v + 2);
        final var revision = TestSteps.revision(StepBinding.abort(left),
                                                StepBinding.abort(right),
                                                StepBinding.finalizer(new SumStep()));
        final var outcome = runner().resume(afterFirstWave, context, revision);
        assertEquals(RunStatus.SUCCEEDED, outcome.getStatus());
        assertEquals(5, outcome.getState().require(SUM));
        assertEquals(0, left.executions());
        assertEquals(0, right.executions());
    }

    @Test
    void testCheckpointIsVisibleWhileRunIsInFlight() throws Exception {
        final var gate = new CountDownLatch(1);
        final var blocked = StepBinding.abort(new MapStep("blocked", LEFT, RIGHT, v -> {
            try {
                gate.await(10, TimeUnit.SECONDS);
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return v + 2;
        }));
        final var revision = TestSteps.revision(StepBinding.abort(new MapStep("left", SEED, LEFT, v -> v + 1)),
                                                blocked,
                                                StepBinding.finalizer(new SumStep()));
        final var running = executorService.submit(
                () -> runner().run(context(services), revision, seeded(services, 1)));

        Awaitility.await()
                .pollDelay(Duration.ofMillis(10))
                .atMost(Duration.ofSeconds(10))
                .until(() -> !checkpointStore.incomplete().isEmpty());
        final var inFlight = checkpointStore.incomplete().get(0);
        assertEquals(List.of("left"), inFlight.getSteps().stream().map(step -> step.getStepId()).toList());
        assertEquals(revision.getToken(), inFlight.getRevisionToken());

        gate.countDown();
        final var outcome = running.get(10, TimeUnit.SECONDS);
        assertEquals(RunStatus.SUCCEEDED, outcome.getStatus());
        assertEquals(6, outcome.getState().require(SUM));
        Awaitility.await()
                .atMost(Duration.ofSeconds(5))
                .until(() -> checkpointStore.incomplete().isEmpty());
    }

    @Test
    void testResumeRefusesAnotherRevision() {
        final var context = context(services);
        runner().run(context, pipeline(), seeded(services, 1));
        final var checkpoint = checkpointStore.saved.get(0).withRevisionToken("somethingelse");
        final var error = assertThrows(MemoriaException.class,
                                       () -> runner().resume(checkpoint, context, pipeline()));
        assertEquals(ErrorType.INTERNAL_ERROR, error.getErrorType());
    }

    @Test
    void testStepTimeoutIsRetriedThenFails() {
        final var slow = StepBinding.abort(new MapStep("slow", SEED, LEFT, v -> {
            try {
                Thread.sleep(2_000);
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return v;
        }));
        final var timed = DurablePipelineRunner.builder()
                .retrySetup(RetrySetup.builder()
                                    .stopAfterAttempt(2)
                                    .delayAfterFailedAttempt(Duration.ofMillis(1))
                                    .build())
                .checkpointStore(checkpointStore)
                .executorService(executorService)
                .mapper(JsonUtils.createMapper())
                .stepTimeout(Duration.ofMillis(50))
                .maxParallelSteps(2)
                .build();
        final var outcome = timed.run(context(services), TestSteps.revision(slow), seeded(services, 1));
        assertEquals(RunStatus.FAILED, outcome.getStatus());
        assertEquals(ErrorType.TRANSIENT_CAPABILITY_ERROR, outcome.getError().getErrorType());
        assertEquals(2, outcome.getSteps().get(0).getAttempts());
    }

    private DurablePipelineRunner runner() {
        return DurablePipelineRunner.builder()
                .retrySetup(RetrySetup.builder().delayAfterFailedAttempt(Duration.ofMillis(1)).build())
                .checkpointStore(checkpointStore)
                .executorService(executorService)
                .mapper(JsonUtils.createMapper())
                .maxParallelSteps(4)
                .build();
    }

    private static PipelineRevision pipeline() {
        return TestSteps.revision(StepBinding.abort(new MapStep("left", SEED, LEFT, v -> v + 1)),
                                  StepBinding.abort(new MapStep("right", SEED, RIGHT, v -> v + 2)),
                                  StepBinding.finalizer(new SumStep()));
    }
}
