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

import com.google.common.base.Strings;
import com.phonepe.memoria.core.capability.SummaryRequest;
import com.phonepe.memoria.core.model.CategoryItem;
import com.phonepe.memoria.core.model.MemoryCategory;
import com.phonepe.memoria.core.model.MemoryItem;
import com.phonepe.memoria.core.pipeline.BaseStep;
import com.phonepe.memoria.core.pipeline.PipelineState;
import com.phonepe.memoria.core.pipeline.StepContext;
import com.phonepe.memoria.core.pipeline.StepRole;
import com.phonepe.memoria.core.pipeline.steps.CategoryPlan;
import com.phonepe.memoria.core.pipeline.steps.StateKeys;
import com.phonepe.memoria.core.pipeline.steps.TaxonomySupport;
import com.phonepe.memoria.core.runlog.StepStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Brings the taxonomy in line with the item plan. Links of replaced items move to their successors, items without
 * a category get the one of their memory type, and every category whose membership changed or whose summary lags
 * is summarised again from its live items. Categories outside the catalog that end up empty are removed.
 */
@Slf4j
public class ReclusterCategoriesStep extends BaseStep {
    public static final String ID = "recluster_categories";

    public ReclusterCategoriesStep() {
        super(ID,
              StepRole.CLUSTERING,
              Set.of(StateKeys.EVOLVE_TARGETS, StateKeys.ITEM_PLAN),
              Set.of(StateKeys.CATEGORY_PLAN));
    }

    @Override
    public StepStatus execute(StepContext context, PipelineState state) {
        final var targets = state.require(StateKeys.EVOLVE_TARGETS);
        final var itemPlan = state.require(StateKeys.ITEM_PLAN);
        final var scope = context.scope();
        final var taxonomy = context.config().getTaxonomy();
        final var now = context.services().getClock().instant();
        final var live = EvolveSupport.liveAfter(targets, itemPlan);
        final var successors = itemPlan.getSuccessors();

        final var categories = new LinkedHashMap<String, MemoryCategory>();
        final var byName = new HashMap<String, MemoryCategory>();
        targets.getCategories().forEach(category -> {
            categories.put(category.getId(), category);
            byName.put(TaxonomySupport.normalizeName(category.getName()), category);
        });
        final var existingLinks = new HashMap<String, CategoryItem>();
        targets.getLinks().forEach(link -> existingLinks.put(link.getId(), link));

        final var members = new LinkedHashMap<String, Set<String>>();
        final var touched = new LinkedHashSet<>(targets.getStaleCategoryIds());
        final var added = new LinkedHashMap<String, CategoryItem>();
        final var removed = new LinkedHashMap<String, CategoryItem>();
        final var created = new LinkedHashSet<String>();

        for (var link : targets.getLinks()) {
            if (live.containsKey(link.getItemId())) {
                members.computeIfAbsent(link.getCategoryId(), id -> new LinkedHashSet<>()).add(link.getItemId());
                continue;
            }
            removed.put(link.getId(), link);
            touched.add(link.getCategoryId());
            final var target = EvolveSupport.resolve(successors, link.getItemId());
            if (live.containsKey(target)) {
                final var moved = CategoryItem.link(scope, link.getCategoryId(), target, now);
                if (!existingLinks.containsKey(moved.getId())) {
                    added.put(moved.getId(), moved);
                }
                members.computeIfAbsent(link.getCategoryId(), id -> new LinkedHashSet<>()).add(target);
            }
        }
        for (var unlinkedId : targets.getUnlinkedItemIds()) {
            final var item = live.get(EvolveSupport.resolve(successors, unlinkedId));
            if (item == null || members.values().stream().anyMatch(ids -> ids.contains(item.getId()))) {
                continue;
            }
            final var name = TaxonomySupport.fallbackCategory(item.getMemoryType());
            final var category = byName.computeIfAbsent(name, missing -> {
                final var fresh = TaxonomySupport.newCategory(taxonomy, scope, missing, now);
                categories.put(fresh.getId(), fresh);
                created.add(fresh.getId());
                return fresh;
            });
            final var link = CategoryItem.link(scope, category.getId(), item.getId(), now);
            added.put(link.getId(), link);
            members.computeIfAbsent(category.getId(), id -> new LinkedHashSet<>()).add(item.getId());
            touched.add(category.getId());
        }

        final var plan = CategoryPlan.builder()
                .addedLinks(added.values())
                .removedLinks(removed.values());
        for (var categoryId : touched) {
            final var category = categories.get(categoryId);
            if (category == null) {
                continue;
            }
            final var memberItems = members.getOrDefault(categoryId, Set.of())
                    .stream()
                    .map(live::get)
                    .filter(Objects::nonNull)
                    .sorted(Comparator.comparing(MemoryItem::getCreatedAt,
                                                 Comparator.nullsLast(Comparator.naturalOrder())))
                    .toList();
            if (memberItems.isEmpty()) {
                if (!TaxonomySupport.inCatalog(taxonomy, category.getName())) {
                    plan.deletedCategory(category);
                }
                else if (!Strings.isNullOrEmpty(category.getSummary())
                        || (category.getAnchorItemIds() != null && !category.getAnchorItemIds().isEmpty())) {
                    plan.upsert(category.withSummary("")
                                        .withAnchorItemIds(List.of())
                                        .withUpdatedAt(now)
                                        .withSummarizedAt(now));
                    plan.updatedName(category.getName());
                }
                continue;
            }
            final var summary = context.calls()
                    .capability("summarize",
                                () -> context.services().getExtraction().summarize(
                                        SummaryRequest.builder()
                                                .categoryName(category.getName())
                                                .contents(memberItems.stream().map(MemoryItem::getContent).toList())
                                                .targetLength(taxonomy.getSummaryTargetLength())
                                                .build()));
            final var anchors = TaxonomySupport.anchors(memberItems.stream(), taxonomy.getAnchorCount());
            final var isNew = created.contains(categoryId);
            if (!isNew && summary.equals(category.getSummary()) && anchors.equals(category.getAnchorItemIds())) {
                continue;
            }
            plan.upsert(category.withSummary(summary)
                                .withAnchorItemIds(anchors)
                                .withUpdatedAt(now)
                                .withSummarizedAt(now));
            if (isNew) {
                plan.createdName(category.getName());
            }
            else {
                plan.updatedName(category.getName());
            }
        }
        final var categoryPlan = plan.build();
        log.info("Re-clustering in scope {}: {} links added, {} removed, {} categories updated, {} deleted",
                 scope, categoryPlan.getAddedLinks().size(), categoryPlan.getRemovedLinks().size(),
                 categoryPlan.getUpserts().size(), categoryPlan.getDeletedCategories().size());
        state.put(StateKeys.CATEGORY_PLAN, categoryPlan);
        return categoryPlan.isEmpty() ? StepStatus.SKIPPED : StepStatus.COMPLETED;
    }
}
