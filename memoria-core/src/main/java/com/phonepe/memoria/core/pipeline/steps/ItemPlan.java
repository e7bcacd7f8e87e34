package com.phonepe.memoria.core.pipeline.steps;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.phonepe.memoria.core.model.EvolutionDiff;
import com.phonepe.memoria.core.model.MemoryItem;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Item writes decided by the merge or refresh logic of a run
 */
@Value
@Builder
@Jacksonized
public class ItemPlan {
    public static final ItemPlan EMPTY = ItemPlan.builder().build();

    /**
     * New rows: first versions of new facts and new versions of existing ones
     */
    @Singular("createdItem")
    List<ItemCandidate> created;
    /**
     * Existing rows rewritten in place: marked superseded or reinforced
     */
    @Singular("updatedItem")
    List<MemoryItem> updated;
    /**
     * Superseded item id to the id of the row replacing it
     */
    @Singular
    Map<String, String> successors;
    @Singular
    List<String> reinforcedIds;
    /**
     * Contents of candidates dropped in favour of a more confident existing version
     */
    @Singular
    List<String> rejectedContents;
    @Singular
    List<String> consolidatedIds;
    @Singular
    List<EvolutionDiff.ItemRevision> revisions;

    @JsonIgnore
    public boolean isEmpty() {
        return created.isEmpty() && updated.isEmpty();
    }
}
