package com.phonepe.memoria.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Points from an item back to the part of its resource it was extracted from
 */
@Value
@Builder
@Jacksonized
public class EvidencePointer {
    String resourceId;
    int segmentIndex;
    int offset;
    int length;
    Integer page;
    Long timestampMillis;
}
