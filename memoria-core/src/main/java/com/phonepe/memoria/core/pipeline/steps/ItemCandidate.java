package com.phonepe.memoria.core.pipeline.steps;

import com.phonepe.memoria.core.model.MemoryItem;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * An item about to be written, with the names of the categories it should be linked to
 */
@Value
@With
@Builder
@Jacksonized
public class ItemCandidate {
    MemoryItem item;
    @Singular
    List<String> categories;
}
