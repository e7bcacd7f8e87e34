package com.phonepe.memoria.core.pipeline.steps.retrieve;

import com.phonepe.memoria.core.model.MemoryItem;
import com.phonepe.memoria.core.model.Scored;
import com.phonepe.memoria.core.pipeline.BaseStep;
import com.phonepe.memoria.core.pipeline.PipelineState;
import com.phonepe.memoria.core.pipeline.StepContext;
import com.phonepe.memoria.core.pipeline.StepRole;
import com.phonepe.memoria.core.pipeline.steps.StateKeys;
import com.phonepe.memoria.core.runlog.StepStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Follows the relations evolve recorded on the returned items and adds the related live items the result does
 * not already hold. A related item carries the score of the item that led to it.
 * <p>
 * Config: <code>relatedTopK</code>
 */
@Slf4j
public class ExpandRelatedStep extends BaseStep {
    public static final String ID = "expand_related";
    public static final String RELATED_TOP_K = "relatedTopK";

    public ExpandRelatedStep() {
        super(ID,
              StepRole.RECALL,
              Set.of(StateKeys.RETRIEVE_REQUEST, StateKeys.RECALLED_ITEMS),
              Set.of(StateKeys.RELATED_ITEMS));
    }

    @Override
    public Set<String> options() {
        return Set.of(RELATED_TOP_K);
    }

    @Override
    public StepStatus execute(StepContext context, PipelineState state) {
        final var request = state.require(StateKeys.RETRIEVE_REQUEST);
        final int relatedTopK = context.option(RELATED_TOP_K, request.getRelatedTopK());
        final var returned = state.require(StateKeys.RECALLED_ITEMS)
                .stream()
                .limit(request.getItemTopK())
                .toList();
        if (relatedTopK <= 0 || returned.isEmpty()) {
            state.put(StateKeys.RELATED_ITEMS, List.of());
            return StepStatus.SKIPPED;
        }
        final var seen = new HashSet<String>();
        returned.forEach(scored -> seen.add(RetrieveSupport.entityKey(scored.getValue().getScope(),
                                                                      scored.getValue().getId())));
        final var store = context.services().getMetadataStore();
        final var related = new ArrayList<Scored<MemoryItem>>();
        for (var scored : returned) {
            final var item = scored.getValue();
            for (var relatedId : Objects.requireNonNullElse(item.getRelatedItemIds(), List.<String>of())) {
                if (related.size() >= relatedTopK) {
                    break;
                }
                if (!seen.add(RetrieveSupport.entityKey(item.getScope(), relatedId))) {
                    continue;
                }
                context.calls()
                        .store("get related item", () -> store.getItem(item.getScope(), relatedId))
                        .filter(MemoryItem::isLive)
                        .filter(candidate -> context.selector().matches(candidate.getScope()))
                        .filter(candidate -> request.getMemoryTypes().isEmpty()
                                || request.getMemoryTypes().contains(candidate.getMemoryType()))
                        .ifPresent(candidate -> related.add(Scored.of(candidate, scored.getScore())));
            }
        }
        log.debug("Expanded {} returned items with {} related items", returned.size(), related.size());
        state.put(StateKeys.RELATED_ITEMS, List.copyOf(related));
        return StepStatus.COMPLETED;
    }
}
