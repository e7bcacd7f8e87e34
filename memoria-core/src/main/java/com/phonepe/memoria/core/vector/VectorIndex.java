package com.phonepe.memoria.core.vector;

import com.phonepe.memoria.core.model.EntityType;
import com.phonepe.memoria.core.scope.Scope;
import com.phonepe.memoria.core.scope.ScopeSchema;
import com.phonepe.memoria.core.scope.ScopeSelector;

import java.util.List;

/**
 * Stores one embedding per entity and answers scope filtered top-k similarity queries. Vectors are only pointers:
 * callers always materialise hits through the metadata store, so an entry whose metadata never committed is never
 * returned to a caller.
 */
public interface VectorIndex {

    /**
     * Prepare the index for the schema and embedding dimension. Must be idempotent.
     */
    default void provision(ScopeSchema schema, int dimension) {
        //Nothing to do by default
    }

    void upsert(Scope scope, EntityType entityType, String entityId, float[] vector);

    void delete(Scope scope, EntityType entityType, String entityId);

    /**
     * Top k entities of the type among scopes matching the selector, by descending cosine similarity
     */
    List<VectorHit> query(ScopeSelector selector, EntityType entityType, float[] vector, int k);

    /**
     * Drop every vector stored for the scope
     *
     * @return Number of vectors removed
     */
    int deleteScope(Scope scope);
}
