package com.phonepe.memoria.core.pipeline.steps.retrieve;

import com.phonepe.memoria.core.pipeline.BaseStep;
import com.phonepe.memoria.core.pipeline.PipelineState;
import com.phonepe.memoria.core.pipeline.StepContext;
import com.phonepe.memoria.core.pipeline.StepRole;
import com.phonepe.memoria.core.pipeline.steps.StateKeys;
import com.phonepe.memoria.core.runlog.StepStatus;
import com.phonepe.memoria.core.service.RetrieveResult;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Set;

/**
 * Assembles the final context from whatever layers ran. Bound as a finalizer so that it also runs after a deeper
 * layer failed.
 */
@Slf4j
public class BuildContextStep extends BaseStep {
    public static final String ID = "build_context";

    public BuildContextStep() {
        super(ID,
              StepRole.REPORTING,
              Set.of(StateKeys.RETRIEVE_REQUEST),
              Set.of(StateKeys.RETRIEVE_RESULT));
    }

    @Override
    public StepStatus execute(StepContext context, PipelineState state) {
        final var request = state.require(StateKeys.RETRIEVE_REQUEST);
        final var progress = state.getOrDefault(StateKeys.PROGRESS, RetrievalProgress.DESCEND);
        final var items = state.getOrDefault(StateKeys.RECALLED_ITEMS, List.of())
                .stream()
                .limit(request.getItemTopK())
                .toList();
        final var result = RetrieveResult.builder()
                .intentions(state.getOrDefault(StateKeys.INTENTIONS, List.of()))
                .categories(state.getOrDefault(StateKeys.ROUTED_CATEGORIES, List.of()))
                .items(items)
                .relatedItems(state.getOrDefault(StateKeys.RELATED_ITEMS, List.of()))
                .resources(state.getOrDefault(StateKeys.RECALLED_RESOURCES, List.of()))
                .rewrittenQuery(progress.getRewrittenQuery())
                .nextStepQuery(progress.getNextStepQuery())
                .degraded(state.isDegraded())
                .vectorSearchUsed(state.getOrDefault(StateKeys.VECTOR_SEARCH_USED, false)
                                          || state.getOrDefault(StateKeys.CATEGORIES_BY_VECTOR, false))
                .build();
        log.debug("Built context with {} categories, {} items and {} resources (degraded: {})",
                  result.getCategories().size(), result.getItems().size(), result.getResources().size(),
                  result.isDegraded());
        state.put(StateKeys.RETRIEVE_RESULT, result);
        return StepStatus.COMPLETED;
    }
}
