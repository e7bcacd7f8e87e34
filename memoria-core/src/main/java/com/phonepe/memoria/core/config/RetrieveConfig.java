package com.phonepe.memoria.core.config;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Defaults for retrieve calls. Per call options override these.
 */
@Value
@Builder
@Jacksonized
public class RetrieveConfig {
    public static final RetrieveConfig DEFAULT = RetrieveConfig.builder().build();

    @Builder.Default
    int itemTopK = 5;
    @Builder.Default
    int categoryTopK = 3;
    @Builder.Default
    int resourceTopK = 3;
    /**
     * Head of the recalled list reranked by verification. Cross scope requests are further bounded by the policy.
     */
    @Builder.Default
    int rerankTopK = 20;
    /**
     * Items linked from the returned ones by evolve that are added to the result. Zero turns expansion off.
     */
    @Builder.Default
    int relatedTopK = 5;
    @Builder.Default
    RecallMethod method = RecallMethod.HYBRID;
    @Builder.Default
    boolean sufficiencyCheck = true;
    @Builder.Default
    boolean verify = true;
    @Builder.Default
    boolean includeResources = true;
}
