package com.phonepe.memoria.core.pipeline.steps.memorize;

import com.phonepe.memoria.core.model.MemoryItem;
import com.phonepe.memoria.core.model.MemoryType;
import com.phonepe.memoria.core.pipeline.BaseStep;
import com.phonepe.memoria.core.pipeline.PipelineState;
import com.phonepe.memoria.core.pipeline.StepContext;
import com.phonepe.memoria.core.pipeline.StepRole;
import com.phonepe.memoria.core.pipeline.steps.IntentionSupport;
import com.phonepe.memoria.core.pipeline.steps.StateKeys;
import com.phonepe.memoria.core.runlog.StepStatus;
import com.phonepe.memoria.core.scope.ScopeSelector;
import com.phonepe.memoria.core.store.ItemFilter;

import java.util.ArrayList;
import java.util.Set;

/**
 * Recomputes the scope intention when the run adds or replaces goal items
 */
public class UpdateIntentionStep extends BaseStep {
    public static final String ID = "update_intention";

    public UpdateIntentionStep() {
        super(ID,
              StepRole.PLANNING,
              Set.of(StateKeys.ITEM_PLAN),
              Set.of(StateKeys.INTENTION_UPDATE));
    }

    @Override
    public StepStatus execute(StepContext context, PipelineState state) {
        final var plan = state.require(StateKeys.ITEM_PLAN);
        final var touchesGoals = plan.getCreated()
                .stream()
                .anyMatch(candidate -> candidate.getItem().getMemoryType() == MemoryType.GOAL);
        if (!touchesGoals) {
            return StepStatus.SKIPPED;
        }
        final var scope = context.scope();
        final var store = context.services().getMetadataStore();
        final var superseded = plan.getSuccessors().keySet();
        final var goals = new ArrayList<MemoryItem>();
        context.calls()
                .store("list goal items",
                       () -> store.listItems(ScopeSelector.exact(scope),
                                             ItemFilter.builder().memoryTypes(Set.of(MemoryType.GOAL)).build()))
                .stream()
                .filter(item -> !superseded.contains(item.getId()))
                .forEach(goals::add);
        plan.getCreated().forEach(candidate -> goals.add(candidate.getItem()));
        final var existing = context.calls().store("get intention", () -> store.getIntention(scope)).orElse(null);
        IntentionSupport.derive(scope, goals, existing, context.services().getClock().instant())
                .ifPresent(intention -> state.put(StateKeys.INTENTION_UPDATE, intention));
        return StepStatus.COMPLETED;
    }
}
