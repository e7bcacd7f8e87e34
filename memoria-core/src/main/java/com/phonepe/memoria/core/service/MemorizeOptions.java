package com.phonepe.memoria.core.service;

import com.phonepe.memoria.core.model.MemoryType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Set;

@Value
@Builder
@Jacksonized
public class MemorizeOptions {
    public static final MemorizeOptions DEFAULT = MemorizeOptions.builder().build();

    /**
     * Types to extract. Empty means all.
     */
    @Singular
    Set<MemoryType> memoryTypes;

    /**
     * Upper bound on extracted facts. Zero uses the configured value.
     */
    int maxFacts;
}
