package com.phonepe.memoria.storage.es;

import lombok.Builder;
import lombok.Value;

/**
 * Settings for the vector index
 */
@Value
@Builder
public class IndexSettings {
    public static final int DEFAULT_SHARDS = 1;
    public static final int DEFAULT_REPLICAS = 0;
    public static final int DEFAULT_CANDIDATE_MULTIPLIER = 10;
    public static final IndexSettings DEFAULT = new IndexSettings(DEFAULT_SHARDS,
                                                                  DEFAULT_REPLICAS,
                                                                  DEFAULT_CANDIDATE_MULTIPLIER);

    @Builder.Default
    int shards = DEFAULT_SHARDS;

    @Builder.Default
    int replicas = DEFAULT_REPLICAS;

    /**
     * HNSW candidates examined per shard, as a multiple of k
     */
    @Builder.Default
    int candidateMultiplier = DEFAULT_CANDIDATE_MULTIPLIER;
}
