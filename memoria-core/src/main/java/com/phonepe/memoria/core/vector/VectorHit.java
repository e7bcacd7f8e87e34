package com.phonepe.memoria.core.vector;

import com.phonepe.memoria.core.model.EntityType;
import com.phonepe.memoria.core.scope.Scope;
import lombok.Value;

/**
 * A similarity query result. The scope is returned so callers can load the entity from the metadata store.
 */
@Value
public class VectorHit {
    Scope scope;
    EntityType entityType;
    String entityId;
    double score;
}
