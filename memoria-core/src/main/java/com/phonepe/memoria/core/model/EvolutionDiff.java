package com.phonepe.memoria.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Audit record of what an evolve run changed in a scope
 */
@Value
@Builder
@Jacksonized
public class EvolutionDiff {

    /**
     * One item replaced by a newer version
     */
    @Value
    @Builder
    @Jacksonized
    public static class ItemRevision {
        String previousId;
        String currentId;
        String key;
        String previousContent;
        String currentContent;
        double previousConfidence;
        double currentConfidence;
    }

    @Singular
    List<ItemRevision> revisedItems;
    /**
     * Items folded into an identical older item
     */
    @Singular
    List<String> consolidatedItemIds;
    @Singular
    List<String> updatedCategories;
    @Singular
    List<String> createdCategories;
    /**
     * Categories left without live items and removed
     */
    @Singular
    List<String> deletedCategories;
    int linksAdded;
    int linksRemoved;
    /**
     * Items whose related item list was rewritten
     */
    @Singular
    List<String> relinkedItemIds;
    boolean intentionChanged;
    int intentionVersion;

    @JsonIgnore
    public boolean isEmpty() {
        return revisedItems.isEmpty()
                && consolidatedItemIds.isEmpty()
                && updatedCategories.isEmpty()
                && createdCategories.isEmpty()
                && deletedCategories.isEmpty()
                && linksAdded == 0
                && linksRemoved == 0
                && relinkedItemIds.isEmpty()
                && !intentionChanged;
    }

    public String summary() {
        return "revised=%d consolidated=%d categoriesUpdated=%d categoriesCreated=%d categoriesDeleted=%d linksAdded=%d linksRemoved=%d relinked=%d intentionChanged=%s"
                .formatted(revisedItems.size(), consolidatedItemIds.size(), updatedCategories.size(),
                           createdCategories.size(), deletedCategories.size(), linksAdded, linksRemoved,
                           relinkedItemIds.size(), intentionChanged);
    }
}
