package com.phonepe.memoria.core.service;

import com.phonepe.memoria.core.model.MemoryCategory;
import com.phonepe.memoria.core.model.MemoryItem;
import com.phonepe.memoria.core.model.Resource;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Resource, live items and categories touched by a memorize call
 */
@Value
@Builder
@Jacksonized
public class MemorizeResult {
    Resource resource;
    @Singular
    List<MemoryItem> items;
    @Singular
    List<MemoryCategory> categories;
    /**
     * The content was already stored in the scope and nothing was written
     */
    boolean deduplicated;
    /**
     * Candidates dropped by the merge policy because a more confident version of the fact exists
     */
    @Singular
    List<String> rejectedCandidates;
}
