package com.phonepe.memoria.core.model;

import com.phonepe.memoria.core.scope.Scope;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Taxonomy node aggregating items. Names are unique per scope, ignoring case.
 */
@Value
@With
@Builder
@Jacksonized
public class MemoryCategory {
    String id;
    Scope scope;
    String name;
    String description;
    /**
     * Rolling summary of the linked items
     */
    String summary;
    /**
     * Most representative items, used for pruning and explanation
     */
    List<String> anchorItemIds;
    Instant createdAt;
    Instant updatedAt;
    Instant summarizedAt;
}
