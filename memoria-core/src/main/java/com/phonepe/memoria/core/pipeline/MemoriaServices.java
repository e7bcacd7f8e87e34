package com.phonepe.memoria.core.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.Striped;
import com.phonepe.memoria.core.capability.BlobStore;
import com.phonepe.memoria.core.capability.Capability;
import com.phonepe.memoria.core.capability.EmbeddingCapability;
import com.phonepe.memoria.core.capability.ExtractionCapability;
import com.phonepe.memoria.core.config.MemoriaConfig;
import com.phonepe.memoria.core.scope.Scope;
import com.phonepe.memoria.core.store.MetadataStore;
import com.phonepe.memoria.core.tenancy.TenancyManager;
import com.phonepe.memoria.core.vector.VectorIndex;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Clock;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.locks.Lock;

/**
 * Everything a step may talk to. Built once per deployment and shared by all runs.
 */
@Value
@Builder
public class MemoriaServices {
    @NonNull
    MetadataStore metadataStore;
    VectorIndex vectorIndex;
    ExtractionCapability extraction;
    EmbeddingCapability embedding;
    BlobStore blobStore;
    @NonNull
    TenancyManager tenancy;
    @NonNull
    MemoriaConfig config;
    @NonNull
    ObjectMapper mapper;
    @NonNull
    Clock clock;
    @NonNull
    GuardedCalls calls;
    @NonNull
    Striped<Lock> scopeLocks;

    public Set<Capability> availableCapabilities() {
        final var available = EnumSet.of(Capability.METADATA_WRITE);
        if (extraction != null) {
            available.add(Capability.LLM);
        }
        if (embedding != null) {
            available.add(Capability.EMBEDDING);
        }
        if (vectorIndex != null) {
            available.add(Capability.VECTOR_INDEX);
        }
        if (blobStore != null) {
            available.add(Capability.BLOB_READ);
        }
        return available;
    }

    public boolean vectorSearchAvailable() {
        return vectorIndex != null && embedding != null;
    }

    /**
     * Lock serialising the final dedup check and commit of writers to the same scope
     */
    public Lock scopeLock(Scope scope) {
        return scopeLocks.get(scope.key());
    }
}
