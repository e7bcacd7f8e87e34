package com.phonepe.memoria.core.pipeline.steps.retrieve;

import com.phonepe.memoria.core.config.RecallMethod;
import com.phonepe.memoria.core.config.RetrieveConfig;
import com.phonepe.memoria.core.model.MemoryType;
import com.phonepe.memoria.core.service.RetrieveOptions;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Objects;
import java.util.Set;

/**
 * Query plus retrieve settings with call overrides applied over configuration
 */
@Value
@Builder
@Jacksonized
public class RetrieveRequest {
    String query;
    int itemTopK;
    int categoryTopK;
    int resourceTopK;
    int rerankTopK;
    int relatedTopK;
    RecallMethod method;
    boolean sufficiencyCheck;
    boolean verify;
    boolean includeResources;
    Set<MemoryType> memoryTypes;

    public static RetrieveRequest resolve(String query, RetrieveOptions options, RetrieveConfig config) {
        final var effective = Objects.requireNonNullElse(options, RetrieveOptions.DEFAULT);
        return RetrieveRequest.builder()
                .query(query)
                .itemTopK(Objects.requireNonNullElse(effective.getItemTopK(), config.getItemTopK()))
                .categoryTopK(Objects.requireNonNullElse(effective.getCategoryTopK(), config.getCategoryTopK()))
                .resourceTopK(Objects.requireNonNullElse(effective.getResourceTopK(), config.getResourceTopK()))
                .rerankTopK(config.getRerankTopK())
                .relatedTopK(Objects.requireNonNullElse(effective.getRelatedTopK(), config.getRelatedTopK()))
                .method(Objects.requireNonNullElse(effective.getMethod(), config.getMethod()))
                .sufficiencyCheck(Objects.requireNonNullElse(effective.getSufficiencyCheck(),
                                                             config.isSufficiencyCheck()))
                .verify(Objects.requireNonNullElse(effective.getVerify(), config.isVerify()))
                .includeResources(Objects.requireNonNullElse(effective.getIncludeResources(),
                                                             config.isIncludeResources()))
                .memoryTypes(Set.copyOf(effective.getMemoryTypes()))
                .build();
    }
}
