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
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Volatile metadata store. Data is partitioned by scope key; a batch is applied under the write lock so readers
 * never see half a batch.
 */
@Slf4j
public class InMemoryMetadataStore implements MetadataStore {

    /**
     * Everything stored for one scope
     */
    static final class Partition {
        final Scope scope;
        final Map<String, Resource> resources = new LinkedHashMap<>();
        final Map<String, MemoryItem> items = new LinkedHashMap<>();
        final Map<String, MemoryCategory> categories = new LinkedHashMap<>();
        final Map<String, CategoryItem> links = new LinkedHashMap<>();
        Intention intention;

        Partition(Scope scope) {
            this.scope = scope;
        }

        int size() {
            return resources.size() + items.size() + categories.size() + links.size() + (intention == null ? 0 : 1);
        }
    }

    private static final Comparator<Instant> NULLS_FIRST = Comparator.nullsFirst(Comparator.naturalOrder());

    private final ConcurrentHashMap<String, Partition> partitions = new ConcurrentHashMap<>();
    private final AtomicReference<ServiceMetadata> metadata = new AtomicReference<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public void provision(ScopeSchema schema) {
        log.debug("In memory store needs no provisioning for schema {}", schema.fieldNames());
    }

    @Override
    public Optional<ServiceMetadata> serviceMetadata() {
        return Optional.ofNullable(metadata.get());
    }

    @Override
    public void saveServiceMetadata(ServiceMetadata serviceMetadata) {
        metadata.set(serviceMetadata);
    }

    @Override
    public Optional<Resource> getResource(Scope scope, String id) {
        return read(() -> partition(scope).map(p -> p.resources.get(id)));
    }

    @Override
    public List<Resource> listResources(ScopeSelector selector, ResourceFilter filter) {
        return read(() -> select(selector, p -> p.resources.values().stream())
                .filter(filter::test)
                .sorted(Comparator.comparing(Resource::getCreatedAt, NULLS_FIRST).thenComparing(Resource::getId))
                .toList());
    }

    @Override
    public Optional<MemoryItem> getItem(Scope scope, String id) {
        return read(() -> partition(scope).map(p -> p.items.get(id)));
    }

    @Override
    public List<MemoryItem> listItems(ScopeSelector selector, ItemFilter filter) {
        return read(() -> select(selector, p -> p.items.values().stream())
                .filter(filter::test)
                .sorted(Comparator.comparing(MemoryItem::getCreatedAt, NULLS_FIRST).thenComparing(MemoryItem::getId))
                .toList());
    }

    @Override
    public Optional<MemoryCategory> getCategory(Scope scope, String id) {
        return read(() -> partition(scope).map(p -> p.categories.get(id)));
    }

    @Override
    public Optional<MemoryCategory> findCategoryByName(Scope scope, String name) {
        return read(() -> partition(scope)
                .flatMap(p -> p.categories.values()
                        .stream()
                        .filter(c -> c.getName().equalsIgnoreCase(name))
                        .findFirst()));
    }

    @Override
    public List<MemoryCategory> listCategories(ScopeSelector selector) {
        return read(() -> select(selector, p -> p.categories.values().stream())
                .sorted(Comparator.comparing(MemoryCategory::getName).thenComparing(MemoryCategory::getId))
                .toList());
    }

    @Override
    public List<CategoryItem> listLinks(Scope scope, String categoryId, String itemId) {
        return read(() -> partition(scope)
                .map(p -> p.links.values()
                        .stream()
                        .filter(l -> categoryId == null || categoryId.equals(l.getCategoryId()))
                        .filter(l -> itemId == null || itemId.equals(l.getItemId()))
                        .toList())
                .orElse(List.of()));
    }

    @Override
    public Optional<Intention> getIntention(Scope scope) {
        return read(() -> partition(scope).map(p -> p.intention));
    }

    @Override
    public List<Intention> listIntentions(ScopeSelector selector) {
        return read(() -> select(selector, p -> Stream.ofNullable(p.intention)).toList());
    }

    @Override
    public void commit(WriteBatch batch) {
        if (batch.isEmpty()) {
            return;
        }
        final var writeLock = lock.writeLock();
        writeLock.lock();
        try {
            BatchChecks.validate(batch,
                                 (scope, id) -> peek(scope).map(p -> p.resources.containsKey(id)).orElse(false),
                                 (scope, id) -> peek(scope).map(p -> p.items.containsKey(id)).orElse(false),
                                 (scope, id) -> peek(scope).map(p -> p.categories.containsKey(id)).orElse(false));
            batch.getDeletedLinks().forEach(l -> peek(l.getScope()).ifPresent(p -> p.links.remove(l.getId())));
            batch.getDeletedCategories()
                    .forEach(c -> peek(c.getScope()).ifPresent(p -> p.categories.remove(c.getId())));
            batch.getResources().forEach(r -> writable(r.getScope()).resources.put(r.getId(), r));
            batch.getItems().forEach(i -> writable(i.getScope()).items.put(i.getId(), i));
            batch.getCategories().forEach(c -> writable(c.getScope()).categories.put(c.getId(), c));
            batch.getLinks().forEach(l -> writable(l.getScope()).links.put(l.getId(), l));
            batch.getIntentions().forEach(i -> writable(i.getScope()).intention = i);
        }
        finally {
            writeLock.unlock();
        }
    }

    @Override
    public int purge(Scope scope) {
        final var writeLock = lock.writeLock();
        writeLock.lock();
        try {
            final var removed = partitions.remove(scope.key());
            return removed == null ? 0 : removed.size();
        }
        finally {
            writeLock.unlock();
        }
    }

    private <T> T read(Supplier<T> reader) {
        final var readLock = lock.readLock();
        readLock.lock();
        try {
            return reader.get();
        }
        finally {
            readLock.unlock();
        }
    }

    private Optional<Partition> partition(Scope scope) {
        return peek(scope).filter(p -> p.scope.equals(scope));
    }

    private Optional<Partition> peek(Scope scope) {
        return Optional.ofNullable(partitions.get(scope.key()));
    }

    private Partition writable(Scope scope) {
        return partitions.computeIfAbsent(scope.key(), k -> new Partition(scope));
    }

    private <T> Stream<T> select(ScopeSelector selector, Function<Partition, Stream<T>> extractor) {
        final var selected = new ArrayList<Partition>();
        if (selector.isSingleExact()) {
            partition(selector.toExactScope()).ifPresent(selected::add);
        }
        else {
            partitions.values().stream().filter(p -> selector.matches(p.scope)).forEach(selected::add);
        }
        return selected.stream().flatMap(extractor);
    }
}
