package com.phonepe.memoria.core.pipeline;

import com.phonepe.memoria.core.capability.Capability;
import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;
import com.phonepe.memoria.core.model.OperationType;
import com.phonepe.memoria.core.pipeline.steps.DefaultPipelines;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.phonepe.memoria.core.pipeline.TestSteps.*;
import static org.junit.jupiter.api.Assertions.*;

class PipelineRegistryTest {

    @Test
    void testDefaultPipelinesAreValid() {
        final var published = new ArrayList<PipelineRevision>();
        final var registry = new PipelineRegistry(EnumSet.allOf(Capability.class), Clock.systemUTC())
                .onPublish(published::add);
        DefaultPipelines.registerAll(registry);
        assertEquals(Set.of("memorize", "retrieve", "evolve"), registry.pipelines());
        assertEquals(3, published.size());
        assertEquals(List.of("route_intention", "sufficiency_after_intention", "route_category",
                             "sufficiency_after_category", "recall_items", "verify_items", "sufficiency_after_items",
                             "recall_resources", "expand_related", "build_context"),
                     registry.current(OperationType.RETRIEVE.pipelineName()).stepIds());
        assertEquals(List.of("select_targets", "refresh_items", "recluster_categories", "adjust_intention",
                             "link_related_items", "persist_evolution", "emit_diff"),
                     registry.current(OperationType.EVOLVE.pipelineName()).stepIds());
    }

    @Test
    void testMissingCapabilityIsRejected() {
        final var registry = new PipelineRegistry(EnumSet.of(Capability.METADATA_WRITE), Clock.systemUTC());
        final var error = assertThrows(MemoriaException.class, () -> DefaultPipelines.registerAll(registry));
        assertEquals(ErrorType.CAPABILITY_UNAVAILABLE, error.getErrorType());
    }

    @Test
    void testEditsPublishNewRevisionsAndKeepOldOnes() {
        final var registry = new PipelineRegistry(EnumSet.allOf(Capability.class), Clock.systemUTC());
        final var first = registry.register("test",
                                            List.of(StepBinding.abort(new MapStep("left", SEED, LEFT, v -> v)),
                                                    StepBinding.finalizer(new MapStep("right", LEFT, RIGHT, v -> v))),
                                            Set.of(SEED.getName()));
        final var second = registry.insertAfter("test",
                                                "left",
                                                StepBinding.abort(new MapStep("extra", SEED, SUM, v -> v)));
        final var third = registry.configureStep("test", "extra", Map.of("factor", 2));

        assertEquals(List.of(1, 2, 3), registry.history("test").stream().map(PipelineRevision::getRevision).toList());
        assertEquals(List.of("left", "right"), first.stepIds());
        assertEquals(List.of("left", "extra", "right"), second.stepIds());
        assertEquals(Map.of("factor", 2), third.step("extra").orElseThrow().getConfig());
        assertTrue(second.step("extra").orElseThrow().getConfig().isEmpty());
        assertNotEquals(second.getToken(), third.getToken());
        assertSame(first, registry.revision("test", 1));

        final var rolledBack = registry.rollback("test", 1);
        assertEquals(4, rolledBack.getRevision());
        assertEquals(first.stepIds(), rolledBack.stepIds());
        assertNotEquals(first.getToken(), rolledBack.getToken());
    }

    @Test
    void testInvalidEditsAreRejected() {
        final var registry = new PipelineRegistry(EnumSet.allOf(Capability.class), Clock.systemUTC());
        registry.register("test",
                          List.of(StepBinding.abort(new MapStep("left", SEED, LEFT, v -> v)),
                                  StepBinding.abort(new MapStep("right", LEFT, RIGHT, v -> v))),
                          Set.of(SEED.getName()));
        assertEquals(ErrorType.VALIDATION_ERROR,
                     assertThrows(MemoriaException.class, () -> registry.removeStep("test", "left")).getErrorType());
        assertEquals(ErrorType.VALIDATION_ERROR,
                     assertThrows(MemoriaException.class,
                                  () -> registry.insertBefore("test", "left",
                                                              StepBinding.abort(new MapStep("left", SEED, SUM,
                                                                                            v -> v))))
                             .getErrorType());
        assertEquals(ErrorType.VALIDATION_ERROR,
                     assertThrows(MemoriaException.class,
                                  () -> registry.insertBefore("test", "right",
                                                              StepBinding.finalizer(new MapStep("final", SEED, SUM,
                                                                                                v -> v))))
                             .getErrorType());
        assertEquals(ErrorType.VALIDATION_ERROR,
                     assertThrows(MemoriaException.class, () -> registry.removeStep("test", "missing"))
                             .getErrorType());
        assertEquals(ErrorType.VALIDATION_ERROR,
                     assertThrows(MemoriaException.class,
                                  () -> registry.configureStep("test", "left", Map.of("divisor", 2)))
                             .getErrorType());
        assertEquals(ErrorType.NOT_FOUND,
                     assertThrows(MemoriaException.class, () -> registry.current("unknown")).getErrorType());
        assertEquals(1, registry.history("test").size());
    }
}
