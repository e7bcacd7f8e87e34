package com.phonepe.memoria.core.capability;

import com.phonepe.memoria.core.model.MemoryType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Candidate fact returned by the extraction capability
 */
@Value
@With
@Builder
@Jacksonized
public class ExtractedFact {
    MemoryType memoryType;
    /**
     * CamelCase subject, used to find earlier versions of the same fact. May be null.
     */
    String key;
    String content;
    double confidence;
    boolean stable;
    int segmentIndex;
    /**
     * Character offset of the evidence in the resource text
     */
    int offset;
    int length;
    /**
     * Suggested category names
     */
    @Singular
    List<String> categories;
}
