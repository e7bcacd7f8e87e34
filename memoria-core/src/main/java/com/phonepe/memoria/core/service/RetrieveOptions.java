package com.phonepe.memoria.core.service;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.phonepe.memoria.core.config.RecallMethod;
import com.phonepe.memoria.core.model.MemoryType;
import com.phonepe.memoria.core.pipeline.CancellationSignal;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Set;

/**
 * Per call overrides of the configured retrieve settings. Null members fall back to configuration.
 */
@Value
@Builder
@Jacksonized
public class RetrieveOptions {
    public static final RetrieveOptions DEFAULT = RetrieveOptions.builder().build();

    Integer itemTopK;
    Integer categoryTopK;
    Integer resourceTopK;
    Integer relatedTopK;
    RecallMethod method;
    Boolean sufficiencyCheck;
    Boolean verify;
    Boolean includeResources;
    @Singular
    Set<MemoryType> memoryTypes;
    @JsonIgnore
    CancellationSignal cancellation;
}
