package com.phonepe.memoria.core.pipeline.steps.memorize;

import com.phonepe.memoria.core.model.CategoryItem;
import com.phonepe.memoria.core.model.EntityType;
import com.phonepe.memoria.core.model.MemoryCategory;
import com.phonepe.memoria.core.model.MemoryItem;
import com.phonepe.memoria.core.model.Resource;
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
import com.phonepe.memoria.core.service.MemorizeResult;
import com.phonepe.memoria.core.store.ItemFilter;
import com.phonepe.memoria.core.store.MetadataStore;
import com.phonepe.memoria.core.store.ResourceFilter;
import com.phonepe.memoria.core.store.WriteBatch;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Writes everything the run produced in one batch. Under the scope lock it first checks again for writers that
 * stored the same resource, the same item content or the same category name since the plan was made, and folds
 * the plan into what they wrote.
 */
@Slf4j
public class PersistMemoriesStep extends BaseStep {
    public static final String ID = "persist_memories";

    public PersistMemoriesStep() {
        super(ID,
              StepRole.PERSISTENCE,
              Set.of(StateKeys.RESOURCE, StateKeys.DEDUPLICATED, StateKeys.ITEM_PLAN, StateKeys.CATEGORY_PLAN),
              Set.of(StateKeys.MEMORIZE_RESULT));
    }

    @Override
    public StepStatus execute(StepContext context, PipelineState state) {
        final var scope = context.scope();
        final var resource = state.require(StateKeys.RESOURCE);
        if (state.getOrDefault(StateKeys.DEDUPLICATED, false)) {
            state.put(StateKeys.MEMORIZE_RESULT, existingResult(context, resource));
            return StepStatus.SKIPPED;
        }
        final var itemPlan = state.require(StateKeys.ITEM_PLAN);
        final var categoryPlan = state.require(StateKeys.CATEGORY_PLAN);
        final var texts = new LinkedHashMap<String, String>();
        itemPlan.getCreated().forEach(candidate -> texts.put(candidate.getItem().getId(),
                                                             candidate.getItem().getContent()));
        categoryPlan.getUpserts().forEach(category -> texts.put(category.getId(),
                                                                TaxonomySupport.categoryText(category)));
        if (resource.text() != null) {
            texts.put(resource.getId(), resource.text());
        }
        final var vectors = PersistSupport.embed(context, texts);

        final var lock = context.services().scopeLock(scope);
        lock.lock();
        try {
            final var store = context.services().getMetadataStore();
            final var racing = context.calls()
                    .store("find resource by hash",
                           () -> store.listResources(ScopeSelector.exact(scope),
                                                     ResourceFilter.builder()
                                                             .contentHash(resource.getContentHash())
                                                             .build()));
            if (!racing.isEmpty()) {
                log.info("Resource {} was stored concurrently in scope {}", resource.getContentHash(), scope);
                state.put(StateKeys.MEMORIZE_RESULT, existingResult(context, racing.get(0)));
                return StepStatus.COMPLETED;
            }
            final var now = context.services().getClock().instant();
            final var writes = new Reconciliation(context, scope, now).reconcile(itemPlan, categoryPlan);
            final var batch = WriteBatch.builder();
            final var upserts = new ArrayList<VectorEntry>();
            final var removals = new ArrayList<VectorEntry>();

            batch.resource(resource);
            addVector(upserts, scope, EntityType.RESOURCE, resource.getId(), vectors.get(resource.getId()));
            state.get(StateKeys.SUPERSEDED_RESOURCE).ifPresent(previous -> {
                batch.resource(previous.withSupersededBy(resource.getId()).withUpdatedAt(now));
                removals.add(VectorEntry.remove(scope, EntityType.RESOURCE, previous.getId()));
            });
            final var createdItems = new ArrayList<MemoryItem>();
            for (var item : writes.created) {
                final var vector = vectors.get(item.getId());
                final var stored = vector == null ? item : item.withEmbedding(vector);
                createdItems.add(stored);
                batch.item(stored);
                addVector(upserts, scope, EntityType.ITEM, item.getId(), vector);
            }
            for (var item : writes.updated) {
                batch.item(item);
                if (item.getSupersededBy() != null) {
                    removals.add(VectorEntry.remove(scope, EntityType.ITEM, item.getId()));
                }
            }
            for (var entry : writes.categories.entrySet()) {
                batch.category(entry.getValue());
                addVector(upserts, scope, EntityType.CATEGORY, entry.getValue().getId(), vectors.get(entry.getKey()));
            }
            writes.links.forEach(batch::link);
            writes.removedLinks.forEach(batch::deletedLink);
            state.get(StateKeys.INTENTION_UPDATE).ifPresent(batch::intention);

            PersistSupport.commit(context, batch.build(), upserts, removals);

            final var liveUpdated = writes.updated.stream().filter(MemoryItem::isLive).toList();
            state.put(StateKeys.MEMORIZE_RESULT, MemorizeResult.builder()
                    .resource(resource)
                    .items(createdItems)
                    .items(liveUpdated)
                    .categories(writes.categories.values())
                    .deduplicated(false)
                    .rejectedCandidates(itemPlan.getRejectedContents())
                    .build());
            log.info("Memorized resource {} in scope {}: {} new items, {} categories",
                     resource.getId(), scope, createdItems.size(), writes.categories.size());
            return StepStatus.COMPLETED;
        }
        finally {
            lock.unlock();
        }
    }

    private static void addVector(List<VectorEntry> upserts, Scope scope, EntityType type, String id, float[] vector) {
        if (vector != null) {
            upserts.add(new VectorEntry(scope, type, id, vector));
        }
    }

    /**
     * Result for content that is already stored: the resource with its live items and their categories
     */
    private static MemorizeResult existingResult(StepContext context, Resource resource) {
        final var scope = resource.getScope();
        final var store = context.services().getMetadataStore();
        final var items = context.calls()
                .store("list resource items",
                       () -> store.listItems(ScopeSelector.exact(scope),
                                             ItemFilter.builder().resourceId(resource.getId()).build()));
        final var categories = new LinkedHashMap<String, MemoryCategory>();
        for (var item : items) {
            for (var link : context.calls().store("list links", () -> store.listLinks(scope, null, item.getId()))) {
                if (!categories.containsKey(link.getCategoryId())) {
                    context.calls()
                            .store("get category", () -> store.getCategory(scope, link.getCategoryId()))
                            .ifPresent(category -> categories.put(category.getId(), category));
                }
            }
        }
        return MemorizeResult.builder()
                .resource(resource)
                .items(items)
                .categories(categories.values())
                .deduplicated(true)
                .build();
    }

    /**
     * Folds the plan into the current contents of the scope. Must run under the scope lock.
     */
    private static final class Reconciliation {
        private final StepContext context;
        private final Scope scope;
        private final Instant now;
        private final MetadataStore store;
        private final List<MemoryItem> created = new ArrayList<>();
        private final List<MemoryItem> updated = new ArrayList<>();
        /**
         * Keyed by the category id used in the plan
         */
        private final Map<String, MemoryCategory> categories = new LinkedHashMap<>();
        private final List<CategoryItem> links = new ArrayList<>();
        private final List<CategoryItem> removedLinks = new ArrayList<>();

        private Reconciliation(StepContext context, Scope scope, Instant now) {
            this.context = context;
            this.scope = scope;
            this.now = now;
            this.store = context.services().getMetadataStore();
        }

        Reconciliation reconcile(ItemPlan itemPlan, CategoryPlan categoryPlan) {
            final var live = context.calls()
                    .store("list live items", () -> store.listItems(ScopeSelector.exact(scope), ItemFilter.LIVE))
                    .stream()
                    .collect(Collectors.toMap(MemoryItem::getId, Function.identity()));
            final var liveByHash = new HashMap<String, MemoryItem>();
            live.values().forEach(item -> liveByHash.put(item.getContentHash(), item));

            final var dropped = new HashSet<String>();
            final var reinforcedNow = new LinkedHashMap<String, MemoryItem>();
            for (var candidate : itemPlan.getCreated()) {
                final var item = candidate.getItem();
                final var racing = liveByHash.get(item.getContentHash());
                if (racing != null && !itemPlan.getSuccessors().containsKey(racing.getId())) {
                    log.debug("Item '{}' was stored concurrently as {}", item.getContent(), racing.getId());
                    dropped.add(item.getId());
                    final var base = reinforcedNow.getOrDefault(racing.getId(), racing);
                    reinforcedNow.put(racing.getId(),
                                      base.withReinforcementCount(base.getReinforcementCount() + 1)
                                              .withUpdatedAt(now));
                }
                else {
                    created.add(item);
                }
            }
            for (var row : itemPlan.getUpdated()) {
                final var current = live.get(row.getId());
                if (current == null) {
                    log.warn("Item {} was superseded concurrently, leaving it untouched", row.getId());
                    continue;
                }
                if (row.getSupersededBy() != null) {
                    if (!dropped.contains(row.getSupersededBy())) {
                        updated.add(current.withSupersededBy(row.getSupersededBy()).withUpdatedAt(now));
                    }
                }
                else {
                    final var base = reinforcedNow.getOrDefault(current.getId(), current);
                    reinforcedNow.put(current.getId(),
                                      base.withReinforcementCount(base.getReinforcementCount() + 1)
                                              .withUpdatedAt(now));
                }
            }
            updated.addAll(reinforcedNow.values());

            final var categoryIds = new HashMap<String, String>();
            for (var category : categoryPlan.getUpserts()) {
                final var stored = context.calls()
                        .store("find category", () -> store.findCategoryByName(scope, category.getName()))
                        .orElse(null);
                if (stored != null && !stored.getId().equals(category.getId())) {
                    categoryIds.put(category.getId(), stored.getId());
                    categories.put(category.getId(), category.withId(stored.getId())
                            .withCreatedAt(stored.getCreatedAt()));
                }
                else {
                    categories.put(category.getId(), category);
                }
            }
            final var linkIds = new HashSet<String>();
            for (var link : categoryPlan.getAddedLinks()) {
                if (dropped.contains(link.getItemId())) {
                    continue;
                }
                final var categoryId = categoryIds.getOrDefault(link.getCategoryId(), link.getCategoryId());
                final var remapped = Objects.equals(categoryId, link.getCategoryId())
                                     ? link
                                     : CategoryItem.link(scope, categoryId, link.getItemId(), now);
                if (linkIds.add(remapped.getId())) {
                    links.add(remapped);
                }
            }
            final var supersededIds = updated.stream()
                    .filter(item -> item.getSupersededBy() != null)
                    .map(MemoryItem::getId)
                    .collect(Collectors.toSet());
            categoryPlan.getRemovedLinks()
                    .stream()
                    .filter(link -> supersededIds.contains(link.getItemId()))
                    .forEach(removedLinks::add);
            return this;
        }
    }
}
