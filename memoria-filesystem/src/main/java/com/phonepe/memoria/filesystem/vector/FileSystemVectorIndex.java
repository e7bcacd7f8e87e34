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

package com.phonepe.memoria.filesystem.vector;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;
import com.phonepe.memoria.core.model.EntityType;
import com.phonepe.memoria.core.scope.Scope;
import com.phonepe.memoria.core.scope.ScopeSchema;
import com.phonepe.memoria.core.scope.ScopeSelector;
import com.phonepe.memoria.core.vector.BruteForceVectorIndex;
import com.phonepe.memoria.core.vector.VectorHit;
import com.phonepe.memoria.core.vector.VectorIndex;
import com.phonepe.memoria.filesystem.utils.FileUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Vector index persisted as one JSON file per scope. Queries run against an in memory brute force copy.
 * This is not for serious production use.
 */
@Slf4j
public class FileSystemVectorIndex implements VectorIndex {

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StoredVector {
        private EntityType entityType;
        private String entityId;
        private float[] vector;
    }

    @Data
    @NoArgsConstructor
    public static class ScopeVectors {
        private Scope scope;
        private List<StoredVector> vectors = new ArrayList<>();
    }

    private final Path indexRoot;
    private final ObjectMapper mapper;
    private final BruteForceVectorIndex cache = new BruteForceVectorIndex();
    private final ConcurrentHashMap<String, Map<String, StoredVector>> byScope = new ConcurrentHashMap<>();

    @Builder
    public FileSystemVectorIndex(@NonNull String baseDir, @NonNull ObjectMapper mapper) {
        this.indexRoot = FileUtils.ensurePath(baseDir, true, true);
        this.mapper = mapper;
        loadVectors();
    }

    @Override
    public void provision(ScopeSchema schema, int dimension) {
        cache.provision(schema, dimension);
    }

    @Override
    public void upsert(Scope scope, EntityType entityType, String entityId, float[] vector) {
        cache.upsert(scope, entityType, entityId, vector);
        update(scope, vectors -> vectors.put(key(entityType, entityId),
                                             new StoredVector(entityType, entityId, vector.clone())));
    }

    @Override
    public void delete(Scope scope, EntityType entityType, String entityId) {
        cache.delete(scope, entityType, entityId);
        update(scope, vectors -> vectors.remove(key(entityType, entityId)));
    }

    @Override
    public List<VectorHit> query(ScopeSelector selector, EntityType entityType, float[] vector, int k) {
        return cache.query(selector, entityType, vector, k);
    }

    @Override
    public int deleteScope(Scope scope) {
        final var removed = cache.deleteScope(scope);
        byScope.compute(scope.key(), (key, existing) -> {
            FileUtils.delete(indexRoot.resolve(FileUtils.scopeFileName(scope)));
            return null;
        });
        return removed;
    }

    private void update(Scope scope, Consumer<Map<String, StoredVector>> mutation) {
        byScope.compute(scope.key(), (key, existing) -> {
            final var vectors = existing == null ? new ConcurrentHashMap<String, StoredVector>() : existing;
            mutation.accept(vectors);
            final var file = indexRoot.resolve(FileUtils.scopeFileName(scope));
            if (vectors.isEmpty()) {
                FileUtils.delete(file);
                return null;
            }
            final var stored = new ScopeVectors();
            stored.setScope(scope);
            stored.setVectors(new ArrayList<>(vectors.values()));
            try {
                FileUtils.writeAtomically(file, mapper.writeValueAsBytes(stored));
            }
            catch (IOException e) {
                throw MemoriaException.wrap(ErrorType.STORE_FAILURE, e);
            }
            return vectors;
        });
    }

    private void loadVectors() {
        try (var files = Files.list(indexRoot)) {
            files.filter(file -> file.getFileName().toString().endsWith(".json")).forEach(this::loadFile);
        }
        catch (IOException e) {
            throw MemoriaException.wrap(ErrorType.STORE_FAILURE, e);
        }
        log.info("Loaded vectors of {} scopes from {}", byScope.size(), indexRoot);
    }

    private void loadFile(Path file) {
        final ScopeVectors stored;
        try {
            stored = mapper.readValue(file.toFile(), ScopeVectors.class);
        }
        catch (IOException e) {
            throw MemoriaException.wrap(ErrorType.STORE_FAILURE, e);
        }
        final var vectors = new ConcurrentHashMap<String, StoredVector>();
        for (var vector : stored.getVectors()) {
            vectors.put(key(vector.getEntityType(), vector.getEntityId()), vector);
            cache.upsert(stored.getScope(), vector.getEntityType(), vector.getEntityId(), vector.getVector());
        }
        byScope.put(stored.getScope().key(), vectors);
    }

    private static String key(EntityType entityType, String entityId) {
        return entityType.name() + ":" + entityId;
    }
}
