package com.phonepe.memoria.core.pipeline.steps.memorize;

import com.phonepe.memoria.core.model.MemoryItem;
import com.phonepe.memoria.core.pipeline.BaseStep;
import com.phonepe.memoria.core.pipeline.PipelineState;
import com.phonepe.memoria.core.pipeline.StepContext;
import com.phonepe.memoria.core.pipeline.StepRole;
import com.phonepe.memoria.core.pipeline.steps.ItemCandidate;
import com.phonepe.memoria.core.pipeline.steps.ItemPlan;
import com.phonepe.memoria.core.pipeline.steps.StateKeys;
import com.phonepe.memoria.core.runlog.StepStatus;
import com.phonepe.memoria.core.scope.ScopeSelector;
import com.phonepe.memoria.core.store.ItemFilter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Merges candidates into the live items of the scope.
 * <ol>
 *     <li>Same type and normalised content as a live item: the live item is reinforced, nothing new is written</li>
 *     <li>Same type and key as a live item: the candidate becomes the next version of the fact if its confidence
 *     is at least that of the live version, otherwise it is rejected</li>
 *     <li>Anything else is a new fact</li>
 * </ol>
 */
@Slf4j
public class DedupeItemsStep extends BaseStep {
    public static final String ID = "dedupe_items";

    public DedupeItemsStep() {
        super(ID,
              StepRole.MERGING,
              Set.of(StateKeys.CANDIDATES),
              Set.of(StateKeys.ITEM_PLAN));
    }

    @Override
    public StepStatus execute(StepContext context, PipelineState state) {
        final var candidates = state.require(StateKeys.CANDIDATES);
        if (candidates.isEmpty()) {
            state.put(StateKeys.ITEM_PLAN, ItemPlan.EMPTY);
            return StepStatus.SKIPPED;
        }
        final var scope = context.scope();
        final var live = context.calls()
                .store("list live items",
                       () -> context.services().getMetadataStore().listItems(ScopeSelector.exact(scope),
                                                                             ItemFilter.LIVE));
        final var merge = new Merge(context.services().getClock().instant());
        live.forEach(merge::index);
        candidates.forEach(merge::apply);
        final var plan = merge.plan();
        log.info("Merge in scope {}: {} new rows, {} reinforced, {} superseded, {} rejected",
                 scope, plan.getCreated().size(), plan.getReinforcedIds().size(),
                 plan.getSuccessors().size(), plan.getRejectedContents().size());
        state.put(StateKeys.ITEM_PLAN, plan);
        return StepStatus.COMPLETED;
    }

    /**
     * Candidates compete with live rows and with each other
     */
    private static final class Merge {
        private final Instant now;
        private final Map<String, MemoryItem> byHash = new HashMap<>();
        private final Map<String, MemoryItem> byKey = new HashMap<>();
        private final Map<String, ItemCandidate> created = new LinkedHashMap<>();
        private final Map<String, MemoryItem> updated = new LinkedHashMap<>();
        private final Map<String, String> successors = new LinkedHashMap<>();
        private final ItemPlan.ItemPlanBuilder plan = ItemPlan.builder();

        private Merge(Instant now) {
            this.now = now;
        }

        void index(MemoryItem item) {
            byHash.put(item.getContentHash(), item);
            if (item.getKey() != null) {
                byKey.put(keyOf(item), item);
            }
        }

        void apply(ItemCandidate candidate) {
            final var item = candidate.getItem();
            final var sameContent = byHash.get(item.getContentHash());
            if (sameContent != null) {
                reinforce(sameContent);
                return;
            }
            final var sameKey = item.getKey() == null ? null : byKey.get(keyOf(item));
            if (sameKey == null) {
                created.put(item.getId(), candidate);
                index(item);
                return;
            }
            if (item.getConfidence() < sameKey.getConfidence()) {
                log.debug("Rejected '{}': live version of {} is more confident", item.getContent(), item.getKey());
                plan.rejectedContent(item.getContent());
                return;
            }
            if (created.containsKey(sameKey.getId())) {
                replaceNewRow(sameKey, candidate);
                return;
            }
            final var next = item.withLineageId(sameKey.getLineageId()).withVersion(sameKey.getVersion() + 1);
            created.put(next.getId(), candidate.withItem(next));
            updated.put(sameKey.getId(), sameKey.withSupersededBy(next.getId()).withUpdatedAt(now));
            successors.put(sameKey.getId(), next.getId());
            byHash.remove(sameKey.getContentHash());
            index(next);
        }

        ItemPlan plan() {
            created.values().forEach(plan::createdItem);
            updated.values().forEach(plan::updatedItem);
            successors.forEach(plan::successor);
            return plan.build();
        }

        private void reinforce(MemoryItem item) {
            if (created.containsKey(item.getId())) {
                return;
            }
            final var current = updated.getOrDefault(item.getId(), item);
            final var reinforced = current.withReinforcementCount(current.getReinforcementCount() + 1)
                    .withUpdatedAt(now);
            updated.put(item.getId(), reinforced);
            plan.reinforcedId(item.getId());
            index(reinforced);
        }

        /**
         * Two candidates of the same run compete for one key: the later, at least as confident one takes over the
         * row the earlier one would have written.
         */
        private void replaceNewRow(MemoryItem previous, ItemCandidate candidate) {
            final var next = candidate.getItem()
                    .withLineageId(previous.getLineageId())
                    .withVersion(previous.getVersion());
            created.remove(previous.getId());
            created.put(next.getId(), candidate.withItem(next));
            plan.rejectedContent(previous.getContent());
            successors.replaceAll((oldId, newId) -> newId.equals(previous.getId()) ? next.getId() : newId);
            updated.replaceAll((id, row) -> previous.getId().equals(row.getSupersededBy())
                                            ? row.withSupersededBy(next.getId())
                                            : row);
            byHash.remove(previous.getContentHash());
            index(next);
        }

        private static String keyOf(MemoryItem item) {
            return item.getMemoryType() + ":" + item.getKey();
        }
    }
}
