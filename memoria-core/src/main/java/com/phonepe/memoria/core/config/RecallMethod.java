package com.phonepe.memoria.core.config;

/**
 * How candidate items are recalled
 */
public enum RecallMethod {
    /**
     * Similarity search in the vector index
     */
    VECTOR,
    /**
     * BM25 over item text
     */
    LEXICAL,
    /**
     * Vector and BM25 hits merged by reciprocal rank fusion
     */
    HYBRID
}
