/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.memoria.core.pipeline.steps.evolve;

import com.phonepe.memoria.core.model.EvolutionDiff;
import com.phonepe.memoria.core.model.MemoryItem;
import com.phonepe.memoria.core.model.Resource;
import com.phonepe.memoria.core.pipeline.BaseStep;
import com.phonepe.memoria.core.pipeline.PipelineState;
import com.phonepe.memoria.core.pipeline.StepContext;
import com.phonepe.memoria.core.pipeline.StepRole;
import com.phonepe.memoria.core.pipeline.steps.ItemCandidate;
import com.phonepe.memoria.core.pipeline.steps.ItemPlan;
import com.phonepe.memoria.core.pipeline.steps.StateKeys;
import com.phonepe.memoria.core.runlog.StepStatus;
import com.phonepe.memoria.core.scope.Scope;
import com.phonepe.memoria.core.utils.TextUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Plans item revisions for an evolve run.
 * <ul>
 *     <li>Live items with the same content are folded into the oldest one, which takes over their reinforcement</li>
 *     <li>Stale items are re-scored against their source; a changed fact or a confidence shift of at least the
 *     configured delta becomes a new version</li>
 * </ul>
 */
@Slf4j
public class RefreshItemsStep extends BaseStep {
    public static final String ID = "refresh_items";

    public RefreshItemsStep() {
        super(ID,
              StepRole.EXTRACTION,
              Set.of(StateKeys.EVOLVE_TARGETS),
              Set.of(StateKeys.ITEM_PLAN));
    }

    @Override
    public StepStatus execute(StepContext context, PipelineState state) {
        final var targets = state.require(StateKeys.EVOLVE_TARGETS);
        final var now = context.services().getClock().instant();
        final var rows = new LinkedHashMap<String, MemoryItem>();
        final var plan = ItemPlan.builder();
        final var successors = new LinkedHashMap<String, String>();

        consolidate(targets.getLiveItems(), rows, successors, plan, now);

        final var minDelta = context.config().getEvolve().getMinConfidenceDelta();
        final var resourceTexts = new HashMap<String, String>();
        for (var stale : targets.getStaleItems()) {
            if (successors.containsKey(stale.getId())) {
                continue;
            }
            final var item = rows.getOrDefault(stale.getId(), stale);
            final var evidence = evidenceText(context, item, resourceTexts);
            final var refined = context.calls()
                    .capability("refine item", () -> context.services().getExtraction().refine(item, evidence));
            final var content = refined.getContent() == null || refined.getContent().isBlank()
                                ? item.getContent()
                                : refined.getContent().trim();
            final var contentChanged = !TextUtils.normalize(content).equals(TextUtils.normalize(item.getContent()));
            final var delta = Math.abs(refined.getConfidence() - item.getConfidence());
            if (!contentChanged && delta < minDelta) {
                continue;
            }
            final var next = nextVersion(item, content, refined.getConfidence(), refined.isStable(), now);
            plan.createdItem(ItemCandidate.builder().item(next).build());
            rows.put(item.getId(), item.withSupersededBy(next.getId()).withUpdatedAt(now));
            successors.put(item.getId(), next.getId());
            plan.revision(EvolutionDiff.ItemRevision.builder()
                                  .previousId(item.getId())
                                  .currentId(next.getId())
                                  .key(item.getKey())
                                  .previousContent(item.getContent())
                                  .currentContent(next.getContent())
                                  .previousConfidence(item.getConfidence())
                                  .currentConfidence(next.getConfidence())
                                  .build());
        }
        rows.values().forEach(plan::updatedItem);
        successors.forEach(plan::successor);
        final var itemPlan = plan.build();
        log.info("Refresh planned {} new versions and {} consolidations",
                 itemPlan.getRevisions().size(), itemPlan.getConsolidatedIds().size());
        state.put(StateKeys.ITEM_PLAN, itemPlan);
        return itemPlan.isEmpty() ? StepStatus.SKIPPED : StepStatus.COMPLETED;
    }

    private static void consolidate(
            List<MemoryItem> live,
            Map<String, MemoryItem> rows,
            Map<String, String> successors,
            ItemPlan.ItemPlanBuilder plan,
            Instant now) {
        final var byHash = new LinkedHashMap<String, List<MemoryItem>>();
        live.forEach(item -> byHash.computeIfAbsent(item.getContentHash(), h -> new ArrayList<>()).add(item));
        for (var group : byHash.values()) {
            if (group.size() < 2) {
                continue;
            }
            final var sorted = group.stream()
                    .sorted(Comparator.comparing(MemoryItem::getCreatedAt,
                                                 Comparator.nullsLast(Comparator.naturalOrder()))
                                    .thenComparing(MemoryItem::getId))
                    .toList();
            final var keeper = sorted.get(0);
            var reinforcement = keeper.getReinforcementCount();
            var confidence = keeper.getConfidence();
            for (var duplicate : sorted.subList(1, sorted.size())) {
                reinforcement += duplicate.getReinforcementCount() + 1;
                confidence = Math.max(confidence, duplicate.getConfidence());
                rows.put(duplicate.getId(), duplicate.withSupersededBy(keeper.getId()).withUpdatedAt(now));
                successors.put(duplicate.getId(), keeper.getId());
                plan.consolidatedId(duplicate.getId());
            }
            rows.put(keeper.getId(), keeper.withReinforcementCount(reinforcement)
                    .withConfidence(confidence)
                    .withUpdatedAt(now));
        }
    }

    private static MemoryItem nextVersion(
            MemoryItem item,
            String content,
            double confidence,
            boolean stable,
            Instant now) {
        return item.withId(UUID.randomUUID().toString())
                .withContent(content)
                .withContentHash(TextUtils.itemContentHash(item.getMemoryType(), content))
                .withConfidence(Math.max(0.0, Math.min(1.0, confidence)))
                .withStable(stable)
                .withVersion(item.getVersion() + 1)
                .withSupersededBy(null)
                .withReinforcementCount(0)
                .withEmbedding(null)
                .withCreatedAt(now)
                .withUpdatedAt(now);
    }

    /**
     * Evidence excerpt of the item, or the whole resource text if the pointer does not fit it
     */
    private static String evidenceText(StepContext context, MemoryItem item, Map<String, String> cache) {
        if (item.getResourceId() == null) {
            return "";
        }
        final var text = cache.computeIfAbsent(item.getResourceId(), id -> resourceText(context, item.getScope(), id));
        final var evidence = item.getEvidence();
        if (evidence == null || evidence.getLength() <= 0
                || evidence.getOffset() < 0 || evidence.getOffset() + evidence.getLength() > text.length()) {
            return text;
        }
        return text.substring(evidence.getOffset(), evidence.getOffset() + evidence.getLength());
    }

    private static String resourceText(StepContext context, Scope scope, String resourceId) {
        return context.calls()
                .store("get resource", () -> context.services().getMetadataStore().getResource(scope, resourceId))
                .map(Resource::text)
                .orElse("");
    }
}
