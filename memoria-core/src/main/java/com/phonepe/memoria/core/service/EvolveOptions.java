package com.phonepe.memoria.core.service;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class EvolveOptions {
    public static final EvolveOptions DEFAULT = EvolveOptions.builder().build();

    /**
     * Refresh every live item, not only stale ones
     */
    boolean refreshAll;

    /**
     * Zero uses the configured value
     */
    int maxTargets;
}
