package com.phonepe.memoria.storage.es;

import com.phonepe.memoria.core.model.EntityType;
import lombok.Builder;
import lombok.Value;
import lombok.experimental.FieldNameConstants;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * One stored embedding. Scope values live under an object with one keyword field per scope field.
 */
@Value
@Builder
@Jacksonized
@FieldNameConstants
public class ESVectorDocument {
    String id;

    Map<String, String> scope;

    String scopeKey;

    EntityType entityType;

    String entityId;

    float[] vector;
}
