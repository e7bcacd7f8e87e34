package com.phonepe.memoria.core.pipeline.steps.retrieve;

import com.phonepe.memoria.core.model.MemoryItem;
import com.phonepe.memoria.core.model.Scored;
import com.phonepe.memoria.core.pipeline.BaseStep;
import com.phonepe.memoria.core.pipeline.PipelineState;
import com.phonepe.memoria.core.pipeline.StepContext;
import com.phonepe.memoria.core.pipeline.StepRole;
import com.phonepe.memoria.core.pipeline.steps.StateKeys;
import com.phonepe.memoria.core.runlog.StepStatus;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * Reranks the head of the recalled list with the extraction capability. Only reorders: candidates the capability
 * leaves out keep their place after the reranked ones.
 * <p>
 * Config: <code>rerankTopK</code> replaces the configured head size. The policy cap still applies.
 */
public class VerifyItemsStep extends BaseStep {
    public static final String ID = "verify_items";
    public static final String RERANK_TOP_K = "rerankTopK";

    public VerifyItemsStep() {
        super(ID,
              StepRole.VERIFICATION,
              Set.of(StateKeys.RETRIEVE_REQUEST, StateKeys.RECALLED_ITEMS),
              Set.of(StateKeys.RECALLED_ITEMS));
    }

    @Override
    public Set<String> options() {
        return Set.of(RERANK_TOP_K);
    }

    @Override
    public StepStatus execute(StepContext context, PipelineState state) {
        final var request = state.require(StateKeys.RETRIEVE_REQUEST);
        final var recalled = state.require(StateKeys.RECALLED_ITEMS);
        if (!request.isVerify() || recalled.isEmpty()) {
            return StepStatus.SKIPPED;
        }
        final var policyCap = RetrieveSupport.policy(context).getRerankCap();
        final int rerankTopK = context.option(RERANK_TOP_K, request.getRerankTopK());
        final var cap = Math.min(recalled.size(), Math.max(1, Math.min(policyCap, rerankTopK)));
        final var head = new LinkedHashMap<String, Scored<MemoryItem>>();
        final var candidates = new LinkedHashMap<String, String>();
        for (var scored : recalled.subList(0, cap)) {
            final var key = RetrieveSupport.entityKey(scored.getValue().getScope(), scored.getValue().getId());
            head.put(key, scored);
            candidates.put(key, scored.getValue().getContent());
        }
        final var query = RetrieveSupport.effectiveQuery(state);
        final var ranking = context.calls()
                .capability("rank items", () -> context.services().getExtraction().rank(query, candidates));
        final var reordered = new ArrayList<Scored<MemoryItem>>(recalled.size());
        final var placed = new HashSet<String>();
        for (var ranked : ranking) {
            final var original = head.get(ranked.getValue());
            if (original != null && placed.add(ranked.getValue())) {
                reordered.add(Scored.of(original.getValue(), ranked.getScore()));
            }
        }
        head.forEach((key, original) -> {
            if (placed.add(key)) {
                reordered.add(original);
            }
        });
        reordered.addAll(recalled.subList(cap, recalled.size()));
        state.put(StateKeys.RECALLED_ITEMS, List.copyOf(reordered));
        return StepStatus.COMPLETED;
    }
}
