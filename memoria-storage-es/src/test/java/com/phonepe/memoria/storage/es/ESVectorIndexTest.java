package com.phonepe.memoria.storage.es;

import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;
import com.phonepe.memoria.core.model.EntityType;
import com.phonepe.memoria.core.scope.Scope;
import com.phonepe.memoria.core.scope.ScopeSchema;
import com.phonepe.memoria.core.scope.ScopeSelector;
import com.phonepe.memoria.core.vector.VectorHit;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test for {@link ESVectorIndex}
 */
@Testcontainers(disabledWithoutDocker = true)
@Slf4j
class ESVectorIndexTest extends ESIntegrationTestBase {
    private static final ScopeSchema SCHEMA = ScopeSchema.parse("project:string, agent:string");
    private static final Scope P1 = Scope.of("project", "p1", "agent", "a1");
    private static final Scope P2 = Scope.of("project", "p2", "agent", "a1");

    @Test
    void testQueriesStayInsideSelectedScopes() throws Exception {
        try (final var client = client()) {
            final var index = index(client, "scoped");
            index.upsert(P1, EntityType.ITEM, "blue", new float[]{1, 0, 0});
            index.upsert(P1, EntityType.ITEM, "green", new float[]{0.6f, 0.8f, 0});
            index.upsert(P2, EntityType.ITEM, "other", new float[]{1, 0, 0});
            index.upsert(P1, EntityType.CATEGORY, "prefs", new float[]{1, 0, 0});

            final var hits = index.query(ScopeSelector.exact(P1), EntityType.ITEM, new float[]{1, 0, 0}, 5);
            log.debug("Hits: {}", hits);
            assertEquals(List.of("blue", "green"), hits.stream().map(VectorHit::getEntityId).toList());
            assertEquals(1.0, hits.get(0).getScore(), 1e-3);
            assertEquals(0.6, hits.get(1).getScore(), 1e-3);
            assertEquals(P1, hits.get(0).getScope());

            final var both = ScopeSelector.builder().anyOf("project", "p1", "p2").exact("agent", "a1").build();
            assertEquals(3, index.query(both, EntityType.ITEM, new float[]{1, 0, 0}, 10).size());
            final var anyProject = ScopeSelector.builder().wildcard("project").exact("agent", "a1").build();
            assertEquals(3, index.query(anyProject, EntityType.ITEM, new float[]{1, 0, 0}, 10).size());
            final var otherAgent = ScopeSelector.builder().wildcard("project").exact("agent", "a2").build();
            assertTrue(index.query(otherAgent, EntityType.ITEM, new float[]{1, 0, 0}, 10).isEmpty());
        }
    }

    @Test
    void testDeletes() throws Exception {
        try (final var client = client()) {
            final var index = index(client, "deletes");
            index.upsert(P1, EntityType.ITEM, "blue", new float[]{1, 0, 0});
            index.upsert(P1, EntityType.ITEM, "green", new float[]{0, 1, 0});
            index.upsert(P2, EntityType.ITEM, "other", new float[]{1, 0, 0});

            index.delete(P1, EntityType.ITEM, "blue");
            assertEquals(1, index.deleteScope(P2));
            assertEquals(List.of("green"),
                         index.query(ScopeSelector.exact(P1), EntityType.ITEM, new float[]{1, 0, 0}, 5)
                                 .stream()
                                 .map(VectorHit::getEntityId)
                                 .toList());
            assertTrue(index.query(ScopeSelector.exact(P2), EntityType.ITEM, new float[]{1, 0, 0}, 5).isEmpty());
        }
    }

    @Test
    void testReprovisioningWithOtherDimensionFails() throws Exception {
        try (final var client = client()) {
            index(client, "dims");
            final var reopened = ESVectorIndex.builder().client(client).indexPrefix(indexPrefix(this) + "_dims").build();
            final var error = assertThrows(MemoriaException.class, () -> reopened.provision(SCHEMA, 8));
            assertEquals(ErrorType.INVALID_INPUT, error.getErrorType());
            reopened.provision(SCHEMA, 3);
            assertEquals(ErrorType.INVALID_INPUT,
                         assertThrows(MemoriaException.class,
                                      () -> reopened.upsert(P1, EntityType.ITEM, "x", new float[]{1, 0}))
                                 .getErrorType());
        }
    }

    private ESVectorIndex index(ESClient client, String name) {
        final var index = ESVectorIndex.builder()
                .client(client)
                .indexPrefix(indexPrefix(this) + "_" + name)
                .build();
        index.provision(SCHEMA, 3);
        return index;
    }
}
