package com.phonepe.memoria.core.vector;

import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;
import com.phonepe.memoria.core.model.EntityType;
import com.phonepe.memoria.core.scope.Scope;
import com.phonepe.memoria.core.scope.ScopeSchema;
import com.phonepe.memoria.core.scope.ScopeSelector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BruteForceVectorIndexTest {
    private static final Scope P1 = Scope.of("project", "p1", "agent", "a1");
    private static final Scope P2 = Scope.of("project", "p2", "agent", "a1");

    private BruteForceVectorIndex index;

    @BeforeEach
    void setUp() {
        index = new BruteForceVectorIndex();
        index.provision(ScopeSchema.parse("project:string, agent:string"), 2);
    }

    @Test
    void testQueryIsScopedAndOrderedByScore() {
        index.upsert(P1, EntityType.ITEM, "i1", new float[]{1, 0});
        index.upsert(P1, EntityType.ITEM, "i2", new float[]{0.6f, 0.8f});
        index.upsert(P2, EntityType.ITEM, "i3", new float[]{1, 0});

        final var hits = index.query(ScopeSelector.exact(P1), EntityType.ITEM, new float[]{1, 0}, 10);
        assertEquals(List.of("i1", "i2"), hits.stream().map(VectorHit::getEntityId).toList());
        assertEquals(1.0, hits.get(0).getScore(), 1e-6);
        assertEquals(P1, hits.get(0).getScope());

        final var both = ScopeSelector.builder().anyOf("project", "p1", "p2").exact("agent", "a1").build();
        final var top = index.query(both, EntityType.ITEM, new float[]{1, 0}, 2);
        assertEquals(List.of("i1", "i3"), top.stream().map(VectorHit::getEntityId).toList());
    }

    @Test
    void testEntityTypesAreKeptApart() {
        index.upsert(P1, EntityType.ITEM, "x", new float[]{1, 0});
        assertTrue(index.query(ScopeSelector.exact(P1), EntityType.CATEGORY, new float[]{1, 0}, 5).isEmpty());
    }

    @Test
    void testDimensionMismatchIsRejected() {
        final var error = assertThrows(MemoriaException.class,
                                       () -> index.upsert(P1, EntityType.ITEM, "i1", new float[]{1, 0, 0}));
        assertEquals(ErrorType.INVALID_INPUT, error.getErrorType());
    }

    @Test
    void testDeletes() {
        index.upsert(P1, EntityType.ITEM, "i1", new float[]{1, 0});
        index.upsert(P1, EntityType.CATEGORY, "c1", new float[]{0, 1});
        index.upsert(P2, EntityType.ITEM, "i2", new float[]{1, 0});

        index.delete(P1, EntityType.ITEM, "i1");
        assertTrue(index.query(ScopeSelector.exact(P1), EntityType.ITEM, new float[]{1, 0}, 5).isEmpty());

        assertEquals(1, index.deleteScope(P1));
        assertEquals(0, index.deleteScope(P1));
        assertEquals(1, index.query(ScopeSelector.exact(P2), EntityType.ITEM, new float[]{1, 0}, 5).size());
    }
}
