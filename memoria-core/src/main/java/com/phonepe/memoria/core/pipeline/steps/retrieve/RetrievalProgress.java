package com.phonepe.memoria.core.pipeline.steps.retrieve;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Sufficiency decisions taken so far. Deeper layers do nothing once a flag is cleared.
 */
@Value
@With
@Builder
@Jacksonized
public class RetrievalProgress {
    public static final RetrievalProgress DESCEND = RetrievalProgress.builder()
            .proceedToCategories(true)
            .proceedToItems(true)
            .proceedToResources(true)
            .build();

    boolean proceedToCategories;
    boolean proceedToItems;
    boolean proceedToResources;
    /**
     * Query deeper layers should use instead of the original one
     */
    String rewrittenQuery;
    String nextStepQuery;
}
