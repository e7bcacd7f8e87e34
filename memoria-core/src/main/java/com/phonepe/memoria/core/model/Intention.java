package com.phonepe.memoria.core.model;

import com.phonepe.memoria.core.scope.Scope;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Current goals and constraints of a scope. One per scope; the entry point of hierarchical retrieval.
 */
@Value
@With
@Builder
@Jacksonized
public class Intention {
    Scope scope;
    List<String> goals;
    List<String> constraints;
    String summary;
    int version;
    Instant updatedAt;
}
