package com.phonepe.memoria.core.capability;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Whether gathered context already answers a query
 */
@Value
@Builder
@Jacksonized
public class SufficiencyVerdict {
    boolean sufficient;
    /**
     * Query to use for deeper layers, if the capability rewrote it
     */
    String rewrittenQuery;
    /**
     * Suggested follow up query for the caller
     */
    String nextStepQuery;
}
