package com.phonepe.memoria.core.store;

import com.phonepe.memoria.core.model.CategoryItem;
import com.phonepe.memoria.core.model.Intention;
import com.phonepe.memoria.core.model.MemoryCategory;
import com.phonepe.memoria.core.model.MemoryItem;
import com.phonepe.memoria.core.model.Resource;
import com.phonepe.memoria.core.scope.Scope;
import com.phonepe.memoria.core.scope.ScopeSchema;
import com.phonepe.memoria.core.scope.ScopeSelector;
import com.phonepe.memoria.core.tenancy.ServiceMetadata;

import java.util.List;
import java.util.Optional;

/**
 * Transactional, scope filtered persistence for resources, items, categories, links and intentions. Point reads
 * take an exact {@link Scope}; listings take a {@link ScopeSelector}. All writes go through
 * {@link #commit(WriteBatch)} and are all or nothing.
 * <p>
 * Implementations raise {@link com.phonepe.memoria.core.errors.MemoriaException} with
 * {@link com.phonepe.memoria.core.errors.ErrorType#TRANSIENT_STORE_ERROR} for failures worth retrying.
 */
public interface MetadataStore {

    /**
     * Prepare storage for the schema: scope columns on every table and composite indexes led by the scope fields.
     * Must be idempotent.
     */
    void provision(ScopeSchema schema);

    Optional<ServiceMetadata> serviceMetadata();

    void saveServiceMetadata(ServiceMetadata metadata);

    Optional<Resource> getResource(Scope scope, String id);

    List<Resource> listResources(ScopeSelector selector, ResourceFilter filter);

    Optional<MemoryItem> getItem(Scope scope, String id);

    List<MemoryItem> listItems(ScopeSelector selector, ItemFilter filter);

    Optional<MemoryCategory> getCategory(Scope scope, String id);

    /**
     * Case insensitive lookup by name
     */
    Optional<MemoryCategory> findCategoryByName(Scope scope, String name);

    List<MemoryCategory> listCategories(ScopeSelector selector);

    /**
     * Links of a scope. Null category or item ids do not filter.
     */
    List<CategoryItem> listLinks(Scope scope, String categoryId, String itemId);

    Optional<Intention> getIntention(Scope scope);

    List<Intention> listIntentions(ScopeSelector selector);

    /**
     * Apply every write in the batch atomically
     */
    void commit(WriteBatch batch);

    /**
     * Hard delete everything stored for the scope. The only path that removes items.
     *
     * @return Number of rows removed
     */
    int purge(Scope scope);

    default void putResource(Resource resource) {
        commit(WriteBatch.builder().resource(resource).build());
    }

    default void putItem(MemoryItem item) {
        commit(WriteBatch.builder().item(item).build());
    }

    default void putCategory(MemoryCategory category) {
        commit(WriteBatch.builder().category(category).build());
    }

    default void putLink(CategoryItem link) {
        commit(WriteBatch.builder().link(link).build());
    }

    default void putIntention(Intention intention) {
        commit(WriteBatch.builder().intention(intention).build());
    }

    default void deleteLink(CategoryItem link) {
        commit(WriteBatch.builder().deletedLink(link).build());
    }

    default void deleteCategory(MemoryCategory category) {
        commit(WriteBatch.builder().deletedCategory(category).build());
    }
}
