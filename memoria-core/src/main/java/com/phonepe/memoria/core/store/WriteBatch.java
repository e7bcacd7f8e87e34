package com.phonepe.memoria.core.store;

import com.phonepe.memoria.core.model.CategoryItem;
import com.phonepe.memoria.core.model.Intention;
import com.phonepe.memoria.core.model.MemoryCategory;
import com.phonepe.memoria.core.model.MemoryItem;
import com.phonepe.memoria.core.model.Resource;
import com.phonepe.memoria.core.scope.Scope;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.stream.Stream;

/**
 * A set of writes applied atomically by {@link MetadataStore#commit(WriteBatch)}. Deletes are applied before puts.
 * Puts are upserts keyed by scope and id.
 */
@Value
@Builder
public class WriteBatch {
    @Singular
    List<Resource> resources;
    @Singular
    List<MemoryItem> items;
    @Singular
    List<MemoryCategory> categories;
    @Singular
    List<CategoryItem> links;
    @Singular
    List<Intention> intentions;
    @Singular
    List<CategoryItem> deletedLinks;
    @Singular
    List<MemoryCategory> deletedCategories;

    public boolean isEmpty() {
        return resources.isEmpty()
                && items.isEmpty()
                && categories.isEmpty()
                && links.isEmpty()
                && intentions.isEmpty()
                && deletedLinks.isEmpty()
                && deletedCategories.isEmpty();
    }

    public int size() {
        return resources.size() + items.size() + categories.size() + links.size() + intentions.size()
                + deletedLinks.size() + deletedCategories.size();
    }

    /**
     * Every scope touched by the batch
     */
    public List<Scope> scopes() {
        return Stream.of(resources.stream().map(Resource::getScope),
                         items.stream().map(MemoryItem::getScope),
                         categories.stream().map(MemoryCategory::getScope),
                         links.stream().map(CategoryItem::getScope),
                         intentions.stream().map(Intention::getScope),
                         deletedLinks.stream().map(CategoryItem::getScope),
                         deletedCategories.stream().map(MemoryCategory::getScope))
                .flatMap(s -> s)
                .distinct()
                .toList();
    }
}
