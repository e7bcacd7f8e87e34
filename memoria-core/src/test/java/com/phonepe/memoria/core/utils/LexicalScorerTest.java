package com.phonepe.memoria.core.utils;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LexicalScorerTest {

    @Test
    void testBm25PrefersMatchingDocuments() {
        final var hits = LexicalScorer.bm25("favorite color",
                                            Map.of("blue", "My favorite color is blue",
                                                   "dog", "I have a dog named Rex",
                                                   "food", "My favorite food is pasta"),
                                            10);
        assertEquals(List.of("blue", "food"), hits.stream().map(LexicalScorer.Hit::id).toList());
        assertTrue(hits.get(0).score() > hits.get(1).score());
    }

    @Test
    void testBm25WithoutContentTerms() {
        assertTrue(LexicalScorer.bm25("what is it", Map.of("a", "what is it"), 5).isEmpty());
        assertTrue(LexicalScorer.bm25("color", Map.of(), 5).isEmpty());
    }

    @Test
    void testReciprocalRankFusion() {
        final var lexical = List.of(new LexicalScorer.Hit("a", 3.0), new LexicalScorer.Hit("b", 1.0));
        final var vector = List.of(new LexicalScorer.Hit("b", 0.9), new LexicalScorer.Hit("c", 0.5));
        final var fused = LexicalScorer.reciprocalRankFusion(2, lexical, vector);
        assertEquals(2, fused.size());
        assertEquals("b", fused.get(0).id());
        assertEquals("a", fused.get(1).id());
    }
}
