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

package com.phonepe.memoria.core.tenancy;

import com.google.common.collect.Sets;
import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;
import com.phonepe.memoria.core.scope.FieldSelector;
import com.phonepe.memoria.core.scope.Scope;
import com.phonepe.memoria.core.scope.ScopeSchema;
import com.phonepe.memoria.core.scope.ScopeSelector;
import com.phonepe.memoria.core.store.MetadataStore;
import com.phonepe.memoria.core.vector.VectorIndex;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the tenant identity schema. Provisioning asks the stores to lay out scope columns and indexes and persists
 * the schema fingerprint in the deployment metadata. After that every scope and selector is checked against the
 * cached schema; a different field set is always rejected, never coerced, and there is no automatic migration.
 * Validation only reads the cached metadata, so a rejected request never reaches a store.
 */
@Slf4j
public class TenancyManager {
    private final MetadataStore metadataStore;
    private final VectorIndex vectorIndex;
    private final int embeddingDimension;
    private final Clock clock;
    private final AtomicReference<ServiceMetadata> metadata = new AtomicReference<>();

    public TenancyManager(
            @NonNull MetadataStore metadataStore,
            VectorIndex vectorIndex,
            int embeddingDimension,
            @NonNull Clock clock) {
        this.metadataStore = metadataStore;
        this.vectorIndex = vectorIndex;
        this.embeddingDimension = embeddingDimension;
        this.clock = clock;
    }

    /**
     * Provision the schema, or verify it against the one already provisioned for the deployment.
     *
     * @throws MemoriaException with {@link ErrorType#SCOPE_SCHEMA_MISMATCH} if a different schema is on record
     */
    public synchronized ServiceMetadata provision(@NonNull ScopeSchema schema) {
        final var fingerprint = schema.fingerprint();
        final var existing = metadataStore.serviceMetadata().orElse(null);
        if (existing != null && !fingerprint.equals(existing.getSchemaFingerprint())) {
            log.error("Deployment is provisioned with scope fields {} but {} was requested",
                      existing.getSchema().fieldNames(), schema.fieldNames());
            throw MemoriaException.of(ErrorType.SCOPE_SCHEMA_MISMATCH,
                                      "deployment provisioned with %s, requested %s. Migrate the store first"
                                              .formatted(existing.getSchema().fieldNames(), schema.fieldNames()));
        }
        metadataStore.provision(schema);
        if (vectorIndex != null) {
            vectorIndex.provision(schema, embeddingDimension);
        }
        if (existing != null) {
            log.info("Scope schema {} already provisioned (version {})",
                     schema.fieldNames(), existing.getSchemaVersion());
            metadata.set(existing);
            return existing;
        }
        final var now = clock.instant();
        final var created = ServiceMetadata.builder()
                .schema(schema)
                .schemaFingerprint(fingerprint)
                .schemaVersion(schema.getVersion())
                .taxonomyVersion(1)
                .provisionedAt(now)
                .updatedAt(now)
                .build();
        metadataStore.saveServiceMetadata(created);
        metadata.set(created);
        log.info("Provisioned scope schema {} with fingerprint {}", schema.fieldNames(), fingerprint);
        return created;
    }

    public ServiceMetadata metadata() {
        final var current = metadata.get();
        if (current == null) {
            throw MemoriaException.of(ErrorType.SCOPE_SCHEMA_MISMATCH, "no scope schema has been provisioned");
        }
        return current;
    }

    public ScopeSchema schema() {
        return metadata().getSchema();
    }

    /**
     * Checks the scope against the schema and returns it with fields in schema order
     */
    public Scope validate(Scope scope) {
        final var schema = schema();
        if (scope == null) {
            throw MemoriaException.of(ErrorType.SCOPE_SCHEMA_MISMATCH, "scope is missing");
        }
        checkFieldSet(schema, scope.fieldNames());
        for (var field : schema.getFields()) {
            final var value = scope.get(field.getName());
            if (!field.getType().accepts(value)) {
                throw MemoriaException.of(ErrorType.SCOPE_SCHEMA_MISMATCH,
                                          "value '%s' of field %s is not a valid %s"
                                                  .formatted(value, field.getName(), field.getType()));
            }
        }
        return scope.inOrder(schema.fieldNames());
    }

    /**
     * Checks the selector against the schema and returns it with fields in schema order
     */
    public ScopeSelector validate(ScopeSelector selector) {
        final var schema = schema();
        if (selector == null) {
            throw MemoriaException.of(ErrorType.SCOPE_SCHEMA_MISMATCH, "scope selector is missing");
        }
        checkFieldSet(schema, selector.fieldNames());
        for (var field : schema.getFields()) {
            final var fieldSelector = selector.field(field.getName());
            if (fieldSelector.getMode() == FieldSelector.Mode.WILDCARD) {
                continue;
            }
            for (var value : fieldSelector.getValues()) {
                if (!field.getType().accepts(value)) {
                    throw MemoriaException.of(ErrorType.SCOPE_SCHEMA_MISMATCH,
                                              "value '%s' of field %s is not a valid %s"
                                                      .formatted(value, field.getName(), field.getType()));
                }
            }
        }
        return selector.inOrder(schema.fieldNames());
    }

    public synchronized ServiceMetadata bumpTaxonomyVersion() {
        final var current = metadata();
        final var updated = current.withTaxonomyVersion(current.getTaxonomyVersion() + 1)
                .withUpdatedAt(clock.instant());
        metadataStore.saveServiceMetadata(updated);
        metadata.set(updated);
        log.debug("Taxonomy version now {}", updated.getTaxonomyVersion());
        return updated;
    }

    public synchronized void recordPipelineRevision(String pipeline, String revisionToken) {
        final var current = metadata.get();
        if (current == null) {
            return;
        }
        if (revisionToken.equals(current.getPipelineRevisions().get(pipeline))) {
            return;
        }
        final var revisions = new HashMap<>(current.getPipelineRevisions());
        revisions.put(pipeline, revisionToken);
        final var updated = current.withPipelineRevisions(Map.copyOf(revisions))
                .withUpdatedAt(clock.instant());
        metadataStore.saveServiceMetadata(updated);
        metadata.set(updated);
        log.info("Pipeline {} now at revision {}", pipeline, revisionToken);
    }

    private static void checkFieldSet(ScopeSchema schema, Set<String> supplied) {
        final var expected = new HashSet<>(schema.fieldNames());
        if (expected.equals(supplied)) {
            return;
        }
        final var missing = Sets.difference(expected, supplied);
        final var unknown = Sets.difference(supplied, expected);
        throw MemoriaException.of(ErrorType.SCOPE_SCHEMA_MISMATCH,
                                  "missing fields %s, unknown fields %s".formatted(missing, unknown));
    }
}
