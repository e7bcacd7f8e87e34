package com.phonepe.memoria.core.pipeline.steps.retrieve;

import com.phonepe.memoria.core.model.Resource;
import com.phonepe.memoria.core.model.Scored;
import com.phonepe.memoria.core.pipeline.BaseStep;
import com.phonepe.memoria.core.pipeline.PipelineState;
import com.phonepe.memoria.core.pipeline.StepContext;
import com.phonepe.memoria.core.pipeline.StepRole;
import com.phonepe.memoria.core.pipeline.steps.StateKeys;
import com.phonepe.memoria.core.runlog.StepStatus;
import com.phonepe.memoria.core.scope.Scope;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * Loads the resources the top items were extracted from, scored by their best item
 */
public class RecallResourcesStep extends BaseStep {
    public static final String ID = "recall_resources";
    public static final String RESOURCE_TOP_K = "resourceTopK";

    private record Source(Scope scope, String resourceId) {
    }

    public RecallResourcesStep() {
        super(ID,
              StepRole.RECALL,
              Set.of(StateKeys.RETRIEVE_REQUEST, StateKeys.PROGRESS, StateKeys.RECALLED_ITEMS),
              Set.of(StateKeys.RECALLED_RESOURCES));
    }

    @Override
    public Set<String> options() {
        return Set.of(RESOURCE_TOP_K);
    }

    @Override
    public StepStatus execute(StepContext context, PipelineState state) {
        final var request = state.require(StateKeys.RETRIEVE_REQUEST);
        if (!request.isIncludeResources() || !state.require(StateKeys.PROGRESS).isProceedToResources()) {
            state.put(StateKeys.RECALLED_RESOURCES, List.of());
            return StepStatus.SKIPPED;
        }
        final var sources = new LinkedHashMap<Source, Double>();
        state.require(StateKeys.RECALLED_ITEMS)
                .stream()
                .limit(request.getItemTopK())
                .filter(scored -> scored.getValue().getResourceId() != null)
                .forEach(scored -> sources.merge(new Source(scored.getValue().getScope(),
                                                            scored.getValue().getResourceId()),
                                                 scored.getScore(),
                                                 Math::max));
        final int resourceTopK = context.option(RESOURCE_TOP_K, request.getResourceTopK());
        final var store = context.services().getMetadataStore();
        final var resources = new ArrayList<Scored<Resource>>();
        for (var entry : sources.entrySet()) {
            if (resources.size() >= resourceTopK) {
                break;
            }
            final var source = entry.getKey();
            context.calls()
                    .store("get resource", () -> store.getResource(source.scope(), source.resourceId()))
                    .filter(resource -> context.selector().matches(resource.getScope()))
                    .ifPresent(resource -> resources.add(Scored.of(resource, entry.getValue())));
        }
        state.put(StateKeys.RECALLED_RESOURCES, List.copyOf(resources));
        return StepStatus.COMPLETED;
    }
}
