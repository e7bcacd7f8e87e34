package com.phonepe.memoria.core.config;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;

@Value
@Builder
@Jacksonized
public class EvolveConfig {
    public static final EvolveConfig DEFAULT = EvolveConfig.builder().build();

    /**
     * Items untouched for longer than this are refreshed
     */
    @Builder.Default
    Duration staleAfter = Duration.ofDays(30);

    @Builder.Default
    int maxTargets = 200;

    /**
     * Smallest confidence change that produces a new item version
     */
    @Builder.Default
    double minConfidenceDelta = 0.01;

    /**
     * Most related items kept per item. Zero turns linking off.
     */
    @Builder.Default
    int relatedTopK = 5;

    /**
     * Lowest cosine similarity for two items to be related
     */
    @Builder.Default
    double minRelatedSimilarity = 0.3;
}
