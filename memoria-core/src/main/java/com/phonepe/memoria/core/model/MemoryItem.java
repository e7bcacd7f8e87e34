package com.phonepe.memoria.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.phonepe.memoria.core.scope.Scope;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * An extracted, evidence backed fact. Revisions are new rows sharing the lineage id; the previous row is kept with
 * {@link #supersededBy} pointing at its successor.
 */
@Value
@With
@Builder
@Jacksonized
public class MemoryItem {
    String id;
    /**
     * Id of the first version of this fact
     */
    String lineageId;
    Scope scope;
    String resourceId;
    MemoryType memoryType;
    /**
     * Short CamelCase subject of the fact. Facts with the same key and type are versions of each other.
     */
    String key;
    String content;
    String contentHash;
    EvidencePointer evidence;
    double confidence;
    /**
     * Whether the fact is expected to stay true over time
     */
    boolean stable;
    int version;
    String supersededBy;
    int reinforcementCount;
    float[] embedding;
    /**
     * Live items of the same scope that evolve found close to this one, most similar first
     */
    @Builder.Default
    List<String> relatedItemIds = List.of();
    Instant createdAt;
    Instant updatedAt;

    @JsonIgnore
    public boolean isLive() {
        return supersededBy == null;
    }
}
