package com.phonepe.memoria.core.service;

import com.phonepe.memoria.core.model.Intention;
import com.phonepe.memoria.core.model.MemoryCategory;
import com.phonepe.memoria.core.model.MemoryItem;
import com.phonepe.memoria.core.model.Resource;
import com.phonepe.memoria.core.model.Scored;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Context assembled for a query, best first in every layer
 */
@Value
@Builder
@Jacksonized
public class RetrieveResult {
    @Singular
    List<Intention> intentions;
    @Singular
    List<Scored<MemoryCategory>> categories;
    @Singular
    List<Scored<MemoryItem>> items;
    /**
     * Items related to the returned ones that the query did not recall itself
     */
    @Singular
    List<Scored<MemoryItem>> relatedItems;
    @Singular
    List<Scored<Resource>> resources;
    /**
     * Follow up query suggested when the gathered context does not fully answer the query
     */
    String nextStepQuery;
    String rewrittenQuery;
    /**
     * A deeper layer failed and the result holds what shallower layers produced
     */
    boolean degraded;
    boolean vectorSearchUsed;
}
