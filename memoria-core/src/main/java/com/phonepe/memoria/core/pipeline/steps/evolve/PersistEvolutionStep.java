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

import com.google.common.collect.Iterables;
import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;
import com.phonepe.memoria.core.model.EntityType;
import com.phonepe.memoria.core.model.Intention;
import com.phonepe.memoria.core.model.MemoryCategory;
import com.phonepe.memoria.core.model.MemoryItem;
import com.phonepe.memoria.core.pipeline.BaseStep;
import com.phonepe.memoria.core.pipeline.PipelineState;
import com.phonepe.memoria.core.pipeline.StepContext;
import com.phonepe.memoria.core.pipeline.StepRole;
import com.phonepe.memoria.core.pipeline.steps.CategoryPlan;
import com.phonepe.memoria.core.pipeline.steps.ItemPlan;
import com.phonepe.memoria.core.pipeline.steps.PersistSupport;
import com.phonepe.memoria.core.pipeline.steps.PersistSupport.VectorEntry;
import com.phonepe.memoria.core.pipeline.steps.StateKeys;
import com.phonepe.memoria.core.pipeline.steps.TaxonomySupport;
import com.phonepe.memoria.core.runlog.StepStatus;
import com.phonepe.memoria.core.scope.Scope;
import com.phonepe.memoria.core.scope.ScopeSelector;
import com.phonepe.memoria.core.store.ItemFilter;
import com.phonepe.memoria.core.store.WriteBatch;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Commits an evolve plan in one batch, item relations included. The plan was made from a snapshot, so under the
 * scope lock every row it rewrites is compared with the stored one; if any changed in the meantime nothing is
 * written.
 */
@Slf4j
public class PersistEvolutionStep extends BaseStep {
    public static final String ID = "persist_evolution";

    public PersistEvolutionStep() {
        super(ID,
              StepRole.PERSISTENCE,
              Set.of(StateKeys.EVOLVE_TARGETS, StateKeys.ITEM_PLAN, StateKeys.CATEGORY_PLAN),
              Set.of(StateKeys.EVOLVE_COMMITTED));
    }

    @Override
    public StepStatus execute(StepContext context, PipelineState state) {
        final var targets = state.require(StateKeys.EVOLVE_TARGETS);
        final var itemPlan = state.require(StateKeys.ITEM_PLAN);
        final var categoryPlan = state.require(StateKeys.CATEGORY_PLAN);
        final var intention = state.get(StateKeys.INTENTION_UPDATE).orElse(null);
        final var relations = state.getOrDefault(StateKeys.ITEM_RELATIONS, Map.<String, List<String>>of());
        if (itemPlan.isEmpty() && categoryPlan.isEmpty() && intention == null && relations.isEmpty()) {
            state.put(StateKeys.EVOLVE_COMMITTED, 0);
            return StepStatus.SKIPPED;
        }
        final var scope = context.scope();
        final var texts = new LinkedHashMap<String, String>();
        itemPlan.getCreated().forEach(candidate -> texts.put(candidate.getItem().getId(),
                                                             candidate.getItem().getContent()));
        categoryPlan.getUpserts().forEach(category -> texts.put(category.getId(),
                                                                TaxonomySupport.categoryText(category)));
        final var vectors = PersistSupport.embed(context, texts);
        final var relinked = relinkedRows(targets, itemPlan, relations);

        final var lock = context.services().scopeLock(scope);
        lock.lock();
        try {
            checkUnchanged(context, scope, targets, itemPlan, relinked, categoryPlan);
            final var batch = WriteBatch.builder();
            final var upserts = new ArrayList<VectorEntry>();
            final var removals = new ArrayList<VectorEntry>();
            for (var candidate : itemPlan.getCreated()) {
                final var item = withRelations(candidate.getItem(), relations);
                final var vector = vectors.get(item.getId());
                batch.item(vector == null ? item : item.withEmbedding(vector));
                if (vector != null) {
                    upserts.add(new VectorEntry(scope, EntityType.ITEM, item.getId(), vector));
                }
            }
            for (var row : itemPlan.getUpdated()) {
                batch.item(withRelations(row, relations));
                if (!row.isLive()) {
                    removals.add(VectorEntry.remove(scope, EntityType.ITEM, row.getId()));
                }
            }
            relinked.forEach(batch::item);
            for (var category : categoryPlan.getUpserts()) {
                batch.category(category);
                final var vector = vectors.get(category.getId());
                if (vector != null) {
                    upserts.add(new VectorEntry(scope, EntityType.CATEGORY, category.getId(), vector));
                }
            }
            for (var category : categoryPlan.getDeletedCategories()) {
                batch.deletedCategory(category);
                removals.add(VectorEntry.remove(scope, EntityType.CATEGORY, category.getId()));
            }
            categoryPlan.getAddedLinks().forEach(batch::link);
            categoryPlan.getRemovedLinks().forEach(batch::deletedLink);
            if (intention != null) {
                batch.intention(intention);
            }
            final var writes = batch.build();
            PersistSupport.commit(context, writes, upserts, removals);
            log.info("Evolve committed {} writes in scope {}", writes.size(), scope);
            state.put(StateKeys.EVOLVE_COMMITTED, writes.size());
            return StepStatus.COMPLETED;
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Live rows the plan leaves alone but whose relations change. They keep their update time.
     */
    private static List<MemoryItem> relinkedRows(
            EvolveTargets targets,
            ItemPlan itemPlan,
            Map<String, List<String>> relations) {
        if (relations.isEmpty()) {
            return List.of();
        }
        final var planned = new HashSet<String>();
        itemPlan.getCreated().forEach(candidate -> planned.add(candidate.getItem().getId()));
        itemPlan.getUpdated().forEach(row -> planned.add(row.getId()));
        return targets.getLiveItems()
                .stream()
                .filter(item -> relations.containsKey(item.getId()) && !planned.contains(item.getId()))
                .map(item -> item.withRelatedItemIds(List.copyOf(relations.get(item.getId()))))
                .toList();
    }

    private static MemoryItem withRelations(MemoryItem item, Map<String, List<String>> relations) {
        final var related = relations.get(item.getId());
        return related == null || !item.isLive() ? item : item.withRelatedItemIds(List.copyOf(related));
    }

    private static void checkUnchanged(
            StepContext context,
            Scope scope,
            EvolveTargets targets,
            ItemPlan itemPlan,
            List<MemoryItem> relinked,
            CategoryPlan categoryPlan) {
        final var store = context.services().getMetadataStore();
        final var snapshot = targets.getLiveItems()
                .stream()
                .collect(Collectors.toMap(MemoryItem::getId, Function.identity()));
        final var current = context.calls()
                .store("list live items", () -> store.listItems(ScopeSelector.exact(scope), ItemFilter.LIVE))
                .stream()
                .collect(Collectors.toMap(MemoryItem::getId, Function.identity()));
        for (var row : Iterables.concat(itemPlan.getUpdated(), relinked)) {
            final var before = snapshot.get(row.getId());
            final var now = current.get(row.getId());
            if (before == null || now == null || !Objects.equals(before.getUpdatedAt(), now.getUpdatedAt())) {
                throw conflict(scope, "item " + row.getId());
            }
        }
        final var categories = targets.getCategories()
                .stream()
                .collect(Collectors.toMap(MemoryCategory::getId, Function.identity()));
        for (var category : categoryPlan.getUpserts()) {
            final var before = categories.get(category.getId());
            final var stored = context.calls()
                    .store("get category", () -> store.getCategory(scope, category.getId()))
                    .orElse(null);
            final var changed = before == null
                                ? stored != null || context.calls()
                                        .store("find category",
                                               () -> store.findCategoryByName(scope, category.getName()))
                                        .isPresent()
                                : stored == null || !Objects.equals(before.getUpdatedAt(), stored.getUpdatedAt());
            if (changed) {
                throw conflict(scope, "category " + category.getName());
            }
        }
        final var storedIntention = context.calls()
                .store("get intention", () -> store.getIntention(scope))
                .map(Intention::getVersion)
                .orElse(0);
        final var snapshotIntention = targets.getIntention() == null ? 0 : targets.getIntention().getVersion();
        if (storedIntention != snapshotIntention) {
            throw conflict(scope, "intention");
        }
    }

    private static MemoriaException conflict(Scope scope, String what) {
        log.warn("Evolve of scope {} aborted: {} changed since the run started", scope, what);
        return MemoriaException.of(ErrorType.CONCURRENT_MODIFICATION, what + " in scope " + scope);
    }
}
