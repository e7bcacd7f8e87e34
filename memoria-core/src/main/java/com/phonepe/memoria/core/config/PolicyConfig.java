package com.phonepe.memoria.core.config;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Bounds for cross scope retrieval
 */
@Value
@Builder
@Jacksonized
public class PolicyConfig {
    public static final PolicyConfig DEFAULT = PolicyConfig.builder().build();

    /**
     * Max concrete scopes a finite set selector may expand to
     */
    @Builder.Default
    int maxScopeCombinations = 64;

    /**
     * Above this many scopes vector search is switched off and retrieval routes through categories only
     */
    @Builder.Default
    int maxVectorScopeCombinations = 16;

    /**
     * Max candidates pulled from the vector index or lexical recall
     */
    @Builder.Default
    int maxCandidates = 100;

    /**
     * Max candidates handed to verification
     */
    @Builder.Default
    int maxRerankCandidates = 20;
}
