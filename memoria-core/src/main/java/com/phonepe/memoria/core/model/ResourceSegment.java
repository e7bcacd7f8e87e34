package com.phonepe.memoria.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A preprocessing unit of a resource: a conversation turn, a paragraph or a page.
 */
@Value
@Builder
@Jacksonized
public class ResourceSegment {
    int index;
    String text;
    /**
     * Character offset of the segment in the resource text
     */
    int offset;
    Integer page;
    String speaker;
}
