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
 * Raw ingested unit of content. Immutable once stored apart from preprocessing enrichment. Changed content for
 * the same uri produces a new resource and the old one is marked superseded.
 */
@Value
@With
@Builder
@Jacksonized
public class Resource {
    String id;
    Scope scope;
    String uri;
    Modality modality;
    /**
     * Inline text, or text read from the blob store for textual modalities
     */
    String content;
    String contentHash;
    String caption;
    String transcript;
    List<ResourceSegment> segments;
    String supersededBy;
    Instant createdAt;
    Instant updatedAt;

    @JsonIgnore
    public boolean isLive() {
        return supersededBy == null;
    }

    /**
     * Best available text for the resource: transcript, then content, then caption.
     */
    @JsonIgnore
    public String text() {
        if (transcript != null) {
            return transcript;
        }
        return content != null ? content : caption;
    }
}
