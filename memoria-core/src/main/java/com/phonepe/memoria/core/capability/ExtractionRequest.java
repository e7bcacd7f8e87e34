package com.phonepe.memoria.core.capability;

import com.phonepe.memoria.core.model.MemoryType;
import com.phonepe.memoria.core.model.Modality;
import com.phonepe.memoria.core.model.ResourceSegment;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Input for fact extraction
 */
@Value
@Builder
public class ExtractionRequest {
    Modality modality;
    List<ResourceSegment> segments;
    Set<MemoryType> memoryTypes;
    /**
     * Category names already in use in the scope, plus the configured catalog
     */
    List<String> knownCategories;
    int maxFacts;
}
