package com.phonepe.memoria.core.pipeline.steps;

import com.phonepe.memoria.core.model.OperationType;
import com.phonepe.memoria.core.pipeline.PipelineRegistry;
import com.phonepe.memoria.core.pipeline.StateKey;
import com.phonepe.memoria.core.pipeline.StepBinding;
import com.phonepe.memoria.core.pipeline.steps.evolve.AdjustIntentionStep;
import com.phonepe.memoria.core.pipeline.steps.evolve.EmitDiffStep;
import com.phonepe.memoria.core.pipeline.steps.evolve.LinkRelatedItemsStep;
import com.phonepe.memoria.core.pipeline.steps.evolve.PersistEvolutionStep;
import com.phonepe.memoria.core.pipeline.steps.evolve.ReclusterCategoriesStep;
import com.phonepe.memoria.core.pipeline.steps.evolve.RefreshItemsStep;
import com.phonepe.memoria.core.pipeline.steps.evolve.SelectTargetsStep;
import com.phonepe.memoria.core.pipeline.steps.memorize.CategorizeItemsStep;
import com.phonepe.memoria.core.pipeline.steps.memorize.DedupeItemsStep;
import com.phonepe.memoria.core.pipeline.steps.memorize.ExtractItemsStep;
import com.phonepe.memoria.core.pipeline.steps.memorize.IngestResourceStep;
import com.phonepe.memoria.core.pipeline.steps.memorize.PersistMemoriesStep;
import com.phonepe.memoria.core.pipeline.steps.memorize.PreprocessStep;
import com.phonepe.memoria.core.pipeline.steps.memorize.UpdateIntentionStep;
import com.phonepe.memoria.core.pipeline.steps.retrieve.BuildContextStep;
import com.phonepe.memoria.core.pipeline.steps.retrieve.ExpandRelatedStep;
import com.phonepe.memoria.core.pipeline.steps.retrieve.RecallItemsStep;
import com.phonepe.memoria.core.pipeline.steps.retrieve.RecallResourcesStep;
import com.phonepe.memoria.core.pipeline.steps.retrieve.RouteCategoryStep;
import com.phonepe.memoria.core.pipeline.steps.retrieve.RouteIntentionStep;
import com.phonepe.memoria.core.pipeline.steps.retrieve.SufficiencyCheckStep;
import com.phonepe.memoria.core.pipeline.steps.retrieve.VerifyItemsStep;
import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The built in step sequences of the three operations and the state keys the facade seeds them with
 */
@UtilityClass
public class DefaultPipelines {

    public static List<StepBinding> memorize() {
        return List.of(StepBinding.abort(new IngestResourceStep()),
                       StepBinding.abort(new PreprocessStep()),
                       StepBinding.abort(new ExtractItemsStep()),
                       StepBinding.abort(new DedupeItemsStep()),
                       StepBinding.abort(new CategorizeItemsStep()),
                       StepBinding.abort(new UpdateIntentionStep()),
                       StepBinding.abort(new PersistMemoriesStep()));
    }

    /**
     * Each layer is followed by a sufficiency check that can stop the descent. The checks and the steps
     * after category routing degrade: their failure ends the descent and the context is built from the layers
     * gathered so far.
     */
    public static List<StepBinding> retrieve() {
        return List.of(StepBinding.abort(new RouteIntentionStep()),
                       StepBinding.degrade(SufficiencyCheckStep.afterIntention()),
                       StepBinding.abort(new RouteCategoryStep()),
                       StepBinding.degrade(SufficiencyCheckStep.afterCategory()),
                       StepBinding.degrade(new RecallItemsStep()),
                       StepBinding.degrade(new VerifyItemsStep()),
                       StepBinding.degrade(SufficiencyCheckStep.afterItems()),
                       StepBinding.degrade(new RecallResourcesStep()),
                       StepBinding.degrade(new ExpandRelatedStep()),
                       StepBinding.finalizer(new BuildContextStep()));
    }

    public static List<StepBinding> evolve() {
        return List.of(StepBinding.abort(new SelectTargetsStep()),
                       StepBinding.abort(new RefreshItemsStep()),
                       StepBinding.abort(new ReclusterCategoriesStep()),
                       StepBinding.abort(new AdjustIntentionStep()),
                       StepBinding.degrade(new LinkRelatedItemsStep()),
                       StepBinding.abort(new PersistEvolutionStep()),
                       StepBinding.abort(new EmitDiffStep()));
    }

    public static Set<String> initialKeys(OperationType operation) {
        return names(switch (operation) {
            case MEMORIZE -> Stream.<StateKey<?>>of(StateKeys.RESOURCE_INPUT, StateKeys.MEMORIZE_OPTIONS);
            case RETRIEVE -> Stream.<StateKey<?>>of(StateKeys.RETRIEVE_REQUEST, StateKeys.PROGRESS);
            case EVOLVE -> Stream.<StateKey<?>>of(StateKeys.EVOLVE_OPTIONS);
        });
    }

    public static List<StepBinding> steps(OperationType operation) {
        return switch (operation) {
            case MEMORIZE -> memorize();
            case RETRIEVE -> retrieve();
            case EVOLVE -> evolve();
        };
    }

    /**
     * Register the three pipelines with their built in steps
     */
    public static void registerAll(PipelineRegistry registry) {
        for (var operation : OperationType.values()) {
            registry.register(operation.pipelineName(), steps(operation), initialKeys(operation));
        }
    }

    private static Set<String> names(Stream<StateKey<?>> keys) {
        return keys.map(StateKey::getName).collect(Collectors.toUnmodifiableSet());
    }
}
