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

package com.phonepe.memoria.filesystem.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;
import com.phonepe.memoria.core.model.CategoryItem;
import com.phonepe.memoria.core.model.Intention;
import com.phonepe.memoria.core.model.MemoryCategory;
import com.phonepe.memoria.core.model.MemoryItem;
import com.phonepe.memoria.core.model.Resource;
import com.phonepe.memoria.core.runlog.RunLog;
import com.phonepe.memoria.core.runlog.RunLogStore;
import com.phonepe.memoria.core.scope.Scope;
import com.phonepe.memoria.core.scope.ScopeSchema;
import com.phonepe.memoria.core.scope.ScopeSelector;
import com.phonepe.memoria.core.store.InMemoryMetadataStore;
import com.phonepe.memoria.core.store.ItemFilter;
import com.phonepe.memoria.core.store.MetadataStore;
import com.phonepe.memoria.core.store.ResourceFilter;
import com.phonepe.memoria.core.store.WriteBatch;
import com.phonepe.memoria.core.tenancy.ServiceMetadata;
import com.phonepe.memoria.filesystem.utils.FileUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.StampedLock;
import java.util.function.Supplier;

/**
 * Metadata store that keeps one JSON snapshot file per scope and serves reads from an in memory copy. A commit
 * rewrites the snapshot of every scope it touches. The new snapshots are first written together to a journal
 * file, so a crash between two scope files is repaired on the next start.
 * This is not for serious production use.
 */
@Slf4j
public class FileSystemMetadataStore implements MetadataStore, RunLogStore {
    private static final String SCOPES_DIR = "scopes";
    private static final String RUNS_DIR = "runs";
    private static final String SERVICE_FILE_NAME = "service.json";
    private static final String JOURNAL_FILE_NAME = "journal.json";
    private static final ResourceFilter ALL_RESOURCES = ResourceFilter.builder().includeSuperseded(true).build();

    private final Path root;
    private final Path scopesRoot;
    private final Path runsRoot;
    private final ObjectMapper mapper;
    private final InMemoryMetadataStore cache = new InMemoryMetadataStore();
    private final StampedLock lock = new StampedLock();

    @Builder
    public FileSystemMetadataStore(@NonNull String baseDir, @NonNull ObjectMapper mapper) {
        this.root = FileUtils.ensurePath(baseDir, true, true);
        this.scopesRoot = FileUtils.ensurePath(root.resolve(SCOPES_DIR).toString(), true, true);
        this.runsRoot = FileUtils.ensurePath(root.resolve(RUNS_DIR).toString(), true, true);
        this.mapper = mapper;
        replayJournal();
        loadSnapshots();
    }

    @Override
    public void provision(ScopeSchema schema) {
        log.debug("File system store at {} needs no provisioning for schema {}", root, schema.fieldNames());
    }

    @Override
    public Optional<ServiceMetadata> serviceMetadata() {
        final var file = root.resolve(SERVICE_FILE_NAME);
        return read(() -> Files.exists(file)
                          ? Optional.of(readFile(file, ServiceMetadata.class))
                          : Optional.<ServiceMetadata>empty());
    }

    @Override
    public void saveServiceMetadata(ServiceMetadata metadata) {
        write(() -> {
            FileUtils.writeAtomically(root.resolve(SERVICE_FILE_NAME), toBytes(metadata));
            return null;
        });
    }

    @Override
    public Optional<Resource> getResource(Scope scope, String id) {
        return read(() -> cache.getResource(scope, id));
    }

    @Override
    public List<Resource> listResources(ScopeSelector selector, ResourceFilter filter) {
        return read(() -> cache.listResources(selector, filter));
    }

    @Override
    public Optional<MemoryItem> getItem(Scope scope, String id) {
        return read(() -> cache.getItem(scope, id));
    }

    @Override
    public List<MemoryItem> listItems(ScopeSelector selector, ItemFilter filter) {
        return read(() -> cache.listItems(selector, filter));
    }

    @Override
    public Optional<MemoryCategory> getCategory(Scope scope, String id) {
        return read(() -> cache.getCategory(scope, id));
    }

    @Override
    public Optional<MemoryCategory> findCategoryByName(Scope scope, String name) {
        return read(() -> cache.findCategoryByName(scope, name));
    }

    @Override
    public List<MemoryCategory> listCategories(ScopeSelector selector) {
        return read(() -> cache.listCategories(selector));
    }

    @Override
    public List<CategoryItem> listLinks(Scope scope, String categoryId, String itemId) {
        return read(() -> cache.listLinks(scope, categoryId, itemId));
    }

    @Override
    public Optional<Intention> getIntention(Scope scope) {
        return read(() -> cache.getIntention(scope));
    }

    @Override
    public List<Intention> listIntentions(ScopeSelector selector) {
        return read(() -> cache.listIntentions(selector));
    }

    @Override
    public void commit(WriteBatch batch) {
        if (batch.isEmpty()) {
            return;
        }
        write(() -> {
            final var scopes = batch.scopes();
            cache.commit(batch);
            try {
                persist(scopes.stream().map(this::snapshot).toList());
            }
            catch (RuntimeException e) {
                log.error("Could not persist batch for scopes {}, restoring from disk", scopes);
                scopes.forEach(this::reload);
                throw e instanceof MemoriaException me ? me : MemoriaException.wrap(ErrorType.STORE_FAILURE, e);
            }
            return null;
        });
    }

    @Override
    public int purge(Scope scope) {
        return write(() -> {
            final var removed = cache.purge(scope);
            FileUtils.delete(scopesRoot.resolve(FileUtils.scopeFileName(scope)));
            log.info("Purged {} entities of scope {}", removed, scope);
            return removed;
        });
    }

    @Override
    public void save(RunLog runLog) {
        FileUtils.writeAtomically(runsRoot.resolve(runLog.getRunId() + ".json"), toBytes(runLog));
    }

    @Override
    public Optional<RunLog> get(String runId) {
        final var file = runsRoot.resolve(runId + ".json");
        return Files.exists(file) ? Optional.of(readFile(file, RunLog.class)) : Optional.empty();
    }

    @Override
    public List<RunLog> recent(int count) {
        return listJson(runsRoot)
                .stream()
                .map(file -> readFile(file, RunLog.class))
                .sorted(Comparator.comparing(RunLog::getStartedAt, Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(count)
                .toList();
    }

    private ScopeSnapshot snapshot(Scope scope) {
        final var selector = ScopeSelector.exact(scope);
        return ScopeSnapshot.builder()
                .scope(scope)
                .resources(cache.listResources(selector, ALL_RESOURCES))
                .items(cache.listItems(selector, ItemFilter.ALL))
                .categories(cache.listCategories(selector))
                .links(cache.listLinks(scope, null, null))
                .intention(cache.getIntention(scope).orElse(null))
                .build();
    }

    private void persist(List<ScopeSnapshot> snapshots) {
        final var journal = root.resolve(JOURNAL_FILE_NAME);
        final var multiScope = snapshots.size() > 1;
        if (multiScope) {
            FileUtils.writeAtomically(journal, toBytes(snapshots));
        }
        snapshots.forEach(this::writeSnapshot);
        if (multiScope) {
            FileUtils.delete(journal);
        }
    }

    private void writeSnapshot(ScopeSnapshot snapshot) {
        final var file = scopesRoot.resolve(FileUtils.scopeFileName(snapshot.getScope()));
        if (snapshot.isEmpty()) {
            FileUtils.delete(file);
        }
        else {
            FileUtils.writeAtomically(file, toBytes(snapshot));
        }
    }

    private void reload(Scope scope) {
        cache.purge(scope);
        final var file = scopesRoot.resolve(FileUtils.scopeFileName(scope));
        if (Files.exists(file)) {
            cache.commit(readFile(file, ScopeSnapshot.class).toBatch());
        }
    }

    private void replayJournal() {
        final var journal = root.resolve(JOURNAL_FILE_NAME);
        if (!Files.exists(journal)) {
            return;
        }
        final List<ScopeSnapshot> snapshots;
        try {
            snapshots = mapper.readValue(journal.toFile(), new TypeReference<List<ScopeSnapshot>>() {
            });
        }
        catch (IOException e) {
            // the journal itself never finished, so no scope file was touched
            log.warn("Discarding unreadable journal {}: {}", journal, e.getMessage());
            FileUtils.delete(journal);
            return;
        }
        log.info("Replaying journal with {} scope snapshots", snapshots.size());
        snapshots.forEach(this::writeSnapshot);
        FileUtils.delete(journal);
    }

    private void loadSnapshots() {
        var count = 0;
        for (var file : listJson(scopesRoot)) {
            cache.commit(readFile(file, ScopeSnapshot.class).toBatch());
            count++;
        }
        log.info("Loaded {} scopes from {}", count, scopesRoot);
    }

    private List<Path> listJson(Path dir) {
        try (var files = Files.list(dir)) {
            return files.filter(file -> file.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .toList();
        }
        catch (IOException e) {
            throw MemoriaException.wrap(ErrorType.STORE_FAILURE, e);
        }
    }

    private <T> T readFile(Path file, Class<T> type) {
        try {
            return mapper.readValue(file.toFile(), type);
        }
        catch (IOException e) {
            throw MemoriaException.wrap(ErrorType.STORE_FAILURE, e);
        }
    }

    private byte[] toBytes(Object value) {
        try {
            return mapper.writeValueAsBytes(Objects.requireNonNull(value));
        }
        catch (IOException e) {
            throw MemoriaException.wrap(ErrorType.STORE_FAILURE, e);
        }
    }

    private <T> T read(Supplier<T> reader) {
        final var stamp = lock.readLock();
        try {
            return reader.get();
        }
        finally {
            lock.unlockRead(stamp);
        }
    }

    private <T> T write(Supplier<T> writer) {
        final var stamp = lock.writeLock();
        try {
            return writer.get();
        }
        finally {
            lock.unlockWrite(stamp);
        }
    }
}
