package com.phonepe.memoria.core.pipeline.steps.memorize;

import com.phonepe.memoria.core.capability.SummaryRequest;
import com.phonepe.memoria.core.model.CategoryItem;
import com.phonepe.memoria.core.model.MemoryCategory;
import com.phonepe.memoria.core.model.MemoryItem;
import com.phonepe.memoria.core.pipeline.BaseStep;
import com.phonepe.memoria.core.pipeline.PipelineState;
import com.phonepe.memoria.core.pipeline.StepContext;
import com.phonepe.memoria.core.pipeline.StepRole;
import com.phonepe.memoria.core.pipeline.steps.CategoryPlan;
import com.phonepe.memoria.core.pipeline.steps.ItemPlan;
import com.phonepe.memoria.core.pipeline.steps.StateKeys;
import com.phonepe.memoria.core.pipeline.steps.TaxonomySupport;
import com.phonepe.memoria.core.runlog.StepStatus;
import com.phonepe.memoria.core.scope.ScopeSelector;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Links new rows to categories and rolls their content into the category summaries. Categories come from the
 * extraction hints, from the links of the version being replaced and, if neither gives any, from the memory type.
 * Missing categories are created on first use.
 */
@Slf4j
public class CategorizeItemsStep extends BaseStep {
    public static final String ID = "categorize_items";

    public CategorizeItemsStep() {
        super(ID,
              StepRole.CLUSTERING,
              Set.of(StateKeys.ITEM_PLAN),
              Set.of(StateKeys.CATEGORY_PLAN));
    }

    @Override
    public StepStatus execute(StepContext context, PipelineState state) {
        final var itemPlan = state.require(StateKeys.ITEM_PLAN);
        if (itemPlan.getCreated().isEmpty()) {
            state.put(StateKeys.CATEGORY_PLAN, CategoryPlan.EMPTY);
            return StepStatus.SKIPPED;
        }
        final var scope = context.scope();
        final var store = context.services().getMetadataStore();
        final var taxonomy = context.config().getTaxonomy();
        final var now = context.services().getClock().instant();
        final var byName = new HashMap<String, MemoryCategory>();
        context.calls()
                .store("list categories", () -> store.listCategories(ScopeSelector.exact(scope)))
                .forEach(category -> byName.put(TaxonomySupport.normalizeName(category.getName()), category));
        final var createdIds = new LinkedHashSet<String>();
        final var addedLinks = new LinkedHashMap<String, CategoryItem>();
        final var removedLinks = new ArrayList<CategoryItem>();
        final var newMembers = new LinkedHashMap<String, List<MemoryItem>>();
        final var predecessors = inverse(itemPlan);

        for (var candidate : itemPlan.getCreated()) {
            final var item = candidate.getItem();
            final var categoryIds = new LinkedHashSet<String>();
            final var previousId = predecessors.get(item.getId());
            if (previousId != null) {
                for (var link : context.calls().store("list links", () -> store.listLinks(scope, null, previousId))) {
                    removedLinks.add(link);
                    categoryIds.add(link.getCategoryId());
                }
            }
            final var names = new ArrayList<>(candidate.getCategories());
            if (names.isEmpty() && categoryIds.isEmpty()) {
                names.add(TaxonomySupport.fallbackCategory(item.getMemoryType()));
            }
            for (var name : names) {
                final var category = byName.computeIfAbsent(name, missing -> {
                    final var created = TaxonomySupport.newCategory(taxonomy, scope, missing, now);
                    createdIds.add(created.getId());
                    return created;
                });
                categoryIds.add(category.getId());
            }
            for (var categoryId : categoryIds) {
                final var link = CategoryItem.link(scope, categoryId, item.getId(), now);
                addedLinks.put(link.getId(), link);
                newMembers.computeIfAbsent(categoryId, id -> new ArrayList<>()).add(item);
            }
        }

        final var byId = byName.values()
                .stream()
                .collect(Collectors.toMap(MemoryCategory::getId, category -> category));
        final var plan = CategoryPlan.builder()
                .addedLinks(addedLinks.values())
                .removedLinks(removedLinks);
        final var superseded = itemPlan.getSuccessors().keySet();
        for (var entry : newMembers.entrySet()) {
            final var category = byId.get(entry.getKey());
            if (category == null) {
                // Link inherited from a category this step did not list; its summary is refreshed by evolve.
                continue;
            }
            final var members = entry.getValue();
            final var summary = context.calls()
                    .capability("summarize",
                                () -> context.services().getExtraction().summarize(
                                        SummaryRequest.builder()
                                                .categoryName(category.getName())
                                                .previousSummary(category.getSummary())
                                                .contents(members.stream().map(MemoryItem::getContent).toList())
                                                .targetLength(taxonomy.getSummaryTargetLength())
                                                .build()));
            final var anchors = Stream.concat(
                            TaxonomySupport.anchors(members.stream(), taxonomy.getAnchorCount()).stream(),
                            category.getAnchorItemIds() == null
                            ? Stream.<String>empty()
                            : category.getAnchorItemIds().stream().filter(id -> !superseded.contains(id)))
                    .distinct()
                    .limit(taxonomy.getAnchorCount())
                    .toList();
            plan.upsert(category.withSummary(summary)
                                .withAnchorItemIds(anchors)
                                .withUpdatedAt(now)
                                .withSummarizedAt(now));
            if (createdIds.contains(category.getId())) {
                plan.createdName(category.getName());
            }
            else {
                plan.updatedName(category.getName());
            }
        }
        final var categoryPlan = plan.build();
        log.debug("Categorised {} items into {} categories ({} new)",
                  itemPlan.getCreated().size(), categoryPlan.getUpserts().size(), categoryPlan.getCreatedNames().size());
        state.put(StateKeys.CATEGORY_PLAN, categoryPlan);
        return StepStatus.COMPLETED;
    }

    private static Map<String, String> inverse(ItemPlan plan) {
        final var inverse = new HashMap<String, String>();
        plan.getSuccessors().forEach((previous, next) -> inverse.put(next, previous));
        return inverse;
    }
}
