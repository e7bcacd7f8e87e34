package com.phonepe.memoria.core.pipeline.steps;

import com.phonepe.memoria.core.capability.CapabilityResponse;
import com.phonepe.memoria.core.model.EntityType;
import com.phonepe.memoria.core.pipeline.StepContext;
import com.phonepe.memoria.core.scope.Scope;
import com.phonepe.memoria.core.store.WriteBatch;
import com.phonepe.memoria.core.utils.TextUtils;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Embedding and the final commit of the writing pipelines. Vectors are upserted first and removed again if the
 * metadata commit fails, so the index never points at rows that were not committed for long. Readers always go
 * back to the metadata store, which keeps the store authoritative.
 */
@Slf4j
@UtilityClass
public class PersistSupport {
    private static final int MAX_EMBEDDING_TEXT = 2000;

    /**
     * A vector to write, or to remove when vector is null
     */
    public record VectorEntry(Scope scope, EntityType entityType, String entityId, float[] vector) {
        public static VectorEntry remove(Scope scope, EntityType entityType, String entityId) {
            return new VectorEntry(scope, entityType, entityId, null);
        }
    }

    /**
     * Embed texts keyed by entity id. Empty if the deployment has no vector search.
     */
    public static Map<String, float[]> embed(StepContext context, Map<String, String> texts) {
        final var services = context.services();
        final var embedded = new LinkedHashMap<String, float[]>();
        if (!services.vectorSearchAvailable() || texts.isEmpty()) {
            return embedded;
        }
        final var ids = List.copyOf(texts.keySet());
        final var inputs = ids.stream()
                .map(id -> TextUtils.truncate(texts.get(id), MAX_EMBEDDING_TEXT))
                .toList();
        final var vectors = context.calls()
                .capability("embed", () -> CapabilityResponse.success(services.getEmbedding().embedAll(inputs)));
        for (int i = 0; i < ids.size(); i++) {
            embedded.put(ids.get(i), vectors.get(i));
        }
        return embedded;
    }

    /**
     * Write vectors, commit the batch, then drop vectors of replaced entities.
     */
    public static void commit(
            StepContext context,
            WriteBatch batch,
            List<VectorEntry> upserts,
            List<VectorEntry> removals) {
        final var services = context.services();
        final var index = services.getVectorIndex();
        final var written = new ArrayList<VectorEntry>();
        try {
            if (index != null) {
                for (var entry : upserts) {
                    context.calls().write("vector upsert", () -> index.upsert(entry.scope(),
                                                                               entry.entityType(),
                                                                               entry.entityId(),
                                                                               entry.vector()));
                    written.add(entry);
                }
            }
            context.calls().write("commit", () -> services.getMetadataStore().commit(batch));
        }
        catch (RuntimeException e) {
            log.error("Commit of {} writes failed, removing {} vectors: {}", batch.size(), written.size(),
                      e.getMessage());
            written.forEach(entry -> removeQuietly(context, entry));
            throw e;
        }
        log.debug("Committed {} writes and {} vectors", batch.size(), written.size());
        if (index != null) {
            removals.forEach(entry -> removeQuietly(context, entry));
        }
    }

    private static void removeQuietly(StepContext context, VectorEntry entry) {
        try {
            context.services().getVectorIndex().delete(entry.scope(), entry.entityType(), entry.entityId());
        }
        catch (RuntimeException e) {
            log.warn("Could not remove vector {}:{} of scope {}: {}",
                     entry.entityType(), entry.entityId(), entry.scope(), e.getMessage());
        }
    }
}
