package com.phonepe.memoria.core.vector;

import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;
import com.phonepe.memoria.core.model.EntityType;
import com.phonepe.memoria.core.scope.Scope;
import com.phonepe.memoria.core.scope.ScopeSchema;
import com.phonepe.memoria.core.scope.ScopeSelector;
import com.phonepe.memoria.core.utils.VectorUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Full scan cosine index held in memory. Fine for small per scope volumes.
 */
@Slf4j
public class BruteForceVectorIndex implements VectorIndex {
    private record Key(String scopeKey, EntityType entityType, String entityId) {
    }

    private record Entry(Scope scope, float[] vector) {
    }

    private final ConcurrentHashMap<Key, Entry> vectors = new ConcurrentHashMap<>();
    private volatile int dimension;

    @Override
    public void provision(ScopeSchema schema, int dimension) {
        log.info("Brute force index provisioned with dimension {}", dimension);
        this.dimension = dimension;
    }

    @Override
    public void upsert(Scope scope, EntityType entityType, String entityId, float[] vector) {
        if (dimension > 0 && vector.length != dimension) {
            throw MemoriaException.of(ErrorType.INVALID_INPUT,
                                      "Vector dimension %d does not match index dimension %d"
                                              .formatted(vector.length, dimension));
        }
        vectors.put(new Key(scope.key(), entityType, entityId), new Entry(scope, vector.clone()));
    }

    @Override
    public void delete(Scope scope, EntityType entityType, String entityId) {
        vectors.remove(new Key(scope.key(), entityType, entityId));
    }

    @Override
    public List<VectorHit> query(ScopeSelector selector, EntityType entityType, float[] vector, int k) {
        return vectors.entrySet()
                .stream()
                .filter(e -> e.getKey().entityType() == entityType)
                .filter(e -> selector.matches(e.getValue().scope()))
                .map(e -> new VectorHit(e.getValue().scope(),
                                        entityType,
                                        e.getKey().entityId(),
                                        VectorUtils.cosineSimilarity(e.getValue().vector(), vector)))
                .sorted(Comparator.comparingDouble(VectorHit::getScore).reversed()
                                .thenComparing(VectorHit::getEntityId))
                .limit(k)
                .toList();
    }

    @Override
    public int deleteScope(Scope scope) {
        final var keys = vectors.keySet().stream().filter(key -> key.scopeKey().equals(scope.key())).toList();
        keys.forEach(vectors::remove);
        return keys.size();
    }
}
