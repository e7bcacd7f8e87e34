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

import com.phonepe.memoria.core.model.EntityType;
import com.phonepe.memoria.core.model.MemoryItem;
import com.phonepe.memoria.core.pipeline.BaseStep;
import com.phonepe.memoria.core.pipeline.PipelineState;
import com.phonepe.memoria.core.pipeline.StepContext;
import com.phonepe.memoria.core.pipeline.StepRole;
import com.phonepe.memoria.core.pipeline.steps.StateKeys;
import com.phonepe.memoria.core.runlog.StepStatus;
import com.phonepe.memoria.core.scope.ScopeSelector;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Relates every live item to its nearest neighbours in the same scope by embedding similarity. Neighbours that
 * this run supersedes are replaced by their successors. A new version has no vector yet, so it keeps the relations
 * of the row it replaces.
 * <p>
 * Config: <code>relatedTopK</code>, <code>minSimilarity</code>
 */
@Slf4j
public class LinkRelatedItemsStep extends BaseStep {
    public static final String ID = "link_related_items";
    public static final String RELATED_TOP_K = "relatedTopK";
    public static final String MIN_SIMILARITY = "minSimilarity";

    public LinkRelatedItemsStep() {
        super(ID,
              StepRole.PLANNING,
              Set.of(StateKeys.EVOLVE_OPTIONS, StateKeys.EVOLVE_TARGETS, StateKeys.ITEM_PLAN),
              Set.of(StateKeys.ITEM_RELATIONS));
    }

    @Override
    public Set<String> options() {
        return Set.of(RELATED_TOP_K, MIN_SIMILARITY);
    }

    @Override
    public StepStatus execute(StepContext context, PipelineState state) {
        final var config = context.config().getEvolve();
        final int topK = context.option(RELATED_TOP_K, config.getRelatedTopK());
        final double minSimilarity = context.option(MIN_SIMILARITY, config.getMinRelatedSimilarity());
        if (topK <= 0 || !context.services().vectorSearchAvailable()) {
            state.put(StateKeys.ITEM_RELATIONS, Map.of());
            return StepStatus.SKIPPED;
        }
        final var options = state.require(StateKeys.EVOLVE_OPTIONS);
        final var targets = state.require(StateKeys.EVOLVE_TARGETS);
        final var plan = state.require(StateKeys.ITEM_PLAN);
        final var live = EvolveSupport.liveAfter(targets, plan);
        final var successors = plan.getSuccessors();
        final var touched = new LinkedHashSet<String>();
        plan.getCreated().forEach(candidate -> touched.add(candidate.getItem().getId()));
        plan.getUpdated().forEach(row -> touched.add(row.getId()));
        final var budget = options.getMaxTargets() > 0 ? options.getMaxTargets() : config.getMaxTargets();

        final var relations = new LinkedHashMap<String, List<String>>();
        live.values()
                .stream()
                .sorted(Comparator.comparing((MemoryItem item) -> !touched.contains(item.getId()))
                                .thenComparing(MemoryItem::getUpdatedAt,
                                               Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(budget)
                .forEach(item -> {
                    final var related = item.getEmbedding() == null
                                        ? resolved(item.getRelatedItemIds(), item, successors, live, topK)
                                        : neighbours(context, item, successors, live, topK, minSimilarity);
                    if (!related.equals(Objects.requireNonNullElse(item.getRelatedItemIds(), List.of()))) {
                        relations.put(item.getId(), related);
                    }
                });
        log.info("Relations of {} items in scope {} changed", relations.size(), context.scope());
        state.put(StateKeys.ITEM_RELATIONS, relations);
        return relations.isEmpty() ? StepStatus.SKIPPED : StepStatus.COMPLETED;
    }

    private static List<String> neighbours(
            StepContext context,
            MemoryItem item,
            Map<String, String> successors,
            Map<String, MemoryItem> live,
            int topK,
            double minSimilarity) {
        final var hits = context.calls()
                .store("query related items",
                       () -> context.services()
                               .getVectorIndex()
                               .query(ScopeSelector.exact(item.getScope()),
                                      EntityType.ITEM,
                                      item.getEmbedding(),
                                      topK * 2 + 1));
        final var ids = hits.stream()
                .filter(hit -> hit.getScore() >= minSimilarity)
                .map(hit -> hit.getEntityId())
                .toList();
        return resolved(ids, item, successors, live, topK);
    }

    private static List<String> resolved(
            List<String> ids,
            MemoryItem item,
            Map<String, String> successors,
            Map<String, MemoryItem> live,
            int topK) {
        if (ids == null) {
            return List.of();
        }
        return ids.stream()
                .map(id -> EvolveSupport.resolve(successors, id))
                .filter(id -> !id.equals(item.getId()) && live.containsKey(id))
                .distinct()
                .limit(topK)
                .toList();
    }
}
