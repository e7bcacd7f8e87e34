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

import com.phonepe.memoria.core.model.CategoryItem;
import com.phonepe.memoria.core.model.MemoryCategory;
import com.phonepe.memoria.core.model.MemoryItem;
import com.phonepe.memoria.core.pipeline.BaseStep;
import com.phonepe.memoria.core.pipeline.PipelineState;
import com.phonepe.memoria.core.pipeline.StepContext;
import com.phonepe.memoria.core.pipeline.StepRole;
import com.phonepe.memoria.core.pipeline.steps.StateKeys;
import com.phonepe.memoria.core.runlog.StepStatus;
import com.phonepe.memoria.core.scope.ScopeSelector;
import com.phonepe.memoria.core.store.ItemFilter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Snapshots the scope and picks what evolve should work on: items not touched for a while or reinforced since
 * their last version, items without a category, and categories whose summary lags behind their items.
 * <p>
 * Config: <code>maxTargets</code>
 */
@Slf4j
public class SelectTargetsStep extends BaseStep {
    public static final String ID = "select_targets";
    public static final String MAX_TARGETS = "maxTargets";

    public SelectTargetsStep() {
        super(ID,
              StepRole.PLANNING,
              Set.of(StateKeys.EVOLVE_OPTIONS),
              Set.of(StateKeys.EVOLVE_TARGETS));
    }

    @Override
    public Set<String> options() {
        return Set.of(MAX_TARGETS);
    }

    @Override
    public StepStatus execute(StepContext context, PipelineState state) {
        final var options = state.require(StateKeys.EVOLVE_OPTIONS);
        final var config = context.config().getEvolve();
        final var scope = context.scope();
        final var store = context.services().getMetadataStore();
        final var now = context.services().getClock().instant();
        final var live = context.calls()
                .store("list live items", () -> store.listItems(ScopeSelector.exact(scope), ItemFilter.LIVE));
        final var categories = context.calls()
                .store("list categories", () -> store.listCategories(ScopeSelector.exact(scope)));
        final var links = context.calls().store("list links", () -> store.listLinks(scope, null, null));
        final var intention = context.calls().store("get intention", () -> store.getIntention(scope)).orElse(null);

        final var staleBefore = now.minus(config.getStaleAfter());
        final var maxTargets = context.option(MAX_TARGETS,
                                              options.getMaxTargets() > 0
                                              ? options.getMaxTargets()
                                              : config.getMaxTargets());
        final var stale = live.stream()
                .filter(item -> options.isRefreshAll()
                        || item.getReinforcementCount() > 0
                        || item.getUpdatedAt() == null
                        || item.getUpdatedAt().isBefore(staleBefore))
                .sorted(Comparator.comparing(MemoryItem::getUpdatedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                .limit(maxTargets)
                .toList();
        final var linked = links.stream().map(CategoryItem::getItemId).collect(Collectors.toSet());
        final var unlinked = live.stream()
                .map(MemoryItem::getId)
                .filter(id -> !linked.contains(id))
                .toList();
        final var liveById = live.stream().collect(Collectors.toMap(MemoryItem::getId, Function.identity()));
        final var staleCategories = categories.stream()
                .filter(category -> summaryLags(category, links, liveById))
                .map(MemoryCategory::getId)
                .toList();
        log.info("Evolve targets in scope {}: {} of {} items to refresh, {} unlinked, {} stale categories",
                 scope, stale.size(), live.size(), unlinked.size(), staleCategories.size());
        state.put(StateKeys.EVOLVE_TARGETS, EvolveTargets.builder()
                .staleItems(stale)
                .liveItems(live)
                .categories(categories)
                .links(links)
                .staleCategoryIds(staleCategories)
                .unlinkedItemIds(unlinked)
                .intention(intention)
                .build());
        return StepStatus.COMPLETED;
    }

    private static boolean summaryLags(
            MemoryCategory category,
            Collection<CategoryItem> links,
            Map<String, MemoryItem> liveById) {
        final var summarizedAt = category.getSummarizedAt();
        final List<MemoryItem> members = links.stream()
                .filter(link -> link.getCategoryId().equals(category.getId()))
                .map(link -> liveById.get(link.getItemId()))
                .filter(Objects::nonNull)
                .toList();
        if (summarizedAt == null) {
            return !members.isEmpty();
        }
        final var anchors = category.getAnchorItemIds() == null ? List.<String>of() : category.getAnchorItemIds();
        return members.stream().anyMatch(item -> isAfter(item.getUpdatedAt(), summarizedAt))
                || anchors.stream().anyMatch(id -> !liveById.containsKey(id))
                || links.stream().anyMatch(link -> link.getCategoryId().equals(category.getId())
                        && !liveById.containsKey(link.getItemId()));
    }

    private static boolean isAfter(Instant instant, Instant reference) {
        return instant != null && instant.isAfter(reference);
    }
}
