package com.phonepe.memoria.core.utils;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * Lexical ranking used when vector search is disabled, and for hybrid recall.
 */
@UtilityClass
public class LexicalScorer {
    public static final double BM25_K1 = 1.2;
    public static final double BM25_B = 0.75;
    public static final int RRF_K = 60;

    /**
     * Ranked id with its score.
     */
    public record Hit(String id, double score) {
    }

    private static final Comparator<Hit> BY_SCORE = Comparator.comparingDouble(Hit::score)
            .reversed()
            .thenComparing(Hit::id);

    /**
     * Okapi BM25 over the supplied documents. Documents that share no term with the query are dropped.
     *
     * @param query     Query text
     * @param documents Document id to text
     * @param topK      Max hits returned
     * @return Hits sorted by descending score
     */
    public static List<Hit> bm25(String query, Map<String, String> documents, int topK) {
        final var queryTerms = new ArrayList<>(TextUtils.contentTokens(query));
        if (queryTerms.isEmpty() || documents.isEmpty()) {
            return List.of();
        }
        final var docs = new HashMap<String, List<String>>();
        documents.forEach((id, text) -> docs.put(id, TextUtils.tokenize(text)));
        final var docCount = docs.size();
        final var avgLength = docs.values().stream().mapToInt(List::size).average().orElse(0);
        final var df = new HashMap<String, Integer>();
        for (var tokens : docs.values()) {
            final var unique = new HashSet<>(tokens);
            for (var term : queryTerms) {
                if (unique.contains(term)) {
                    df.merge(term, 1, Integer::sum);
                }
            }
        }
        final var hits = new ArrayList<Hit>();
        docs.forEach((id, tokens) -> {
            final var score = docScore(queryTerms, tokens, df, docCount, avgLength);
            if (score > 0) {
                hits.add(new Hit(id, score));
            }
        });
        hits.sort(BY_SCORE);
        return hits.subList(0, Math.min(topK, hits.size()));
    }

    /**
     * Reciprocal rank fusion of several ranked lists.
     */
    @SafeVarargs
    public static List<Hit> reciprocalRankFusion(int topK, List<Hit>... rankedLists) {
        final var scores = new HashMap<String, Double>();
        for (var ranked : rankedLists) {
            for (int rank = 0; rank < ranked.size(); rank++) {
                scores.merge(ranked.get(rank).id(), 1.0 / (RRF_K + rank + 1), Double::sum);
            }
        }
        return scores.entrySet()
                .stream()
                .map(e -> new Hit(e.getKey(), e.getValue()))
                .sorted(BY_SCORE)
                .limit(topK)
                .toList();
    }

    private static double docScore(
            List<String> queryTerms,
            List<String> docTokens,
            Map<String, Integer> df,
            int docCount,
            double avgLength) {
        final var docLength = Math.max(docTokens.size(), 1);
        final var tf = new HashMap<String, Integer>();
        docTokens.forEach(t -> tf.merge(t, 1, Integer::sum));
        double score = 0.0;
        for (var term : queryTerms) {
            final int freq = tf.getOrDefault(term, 0);
            if (freq <= 0) {
                continue;
            }
            final int nt = df.getOrDefault(term, 0);
            final var idf = Math.log((docCount - nt + 0.5) / (nt + 0.5) + 1.0);
            final var numerator = freq * (BM25_K1 + 1);
            final var denominator = freq + BM25_K1 * (1 - BM25_B + BM25_B * docLength / Math.max(avgLength, 1e-9));
            score += idf * numerator / denominator;
        }
        return score;
    }
}
