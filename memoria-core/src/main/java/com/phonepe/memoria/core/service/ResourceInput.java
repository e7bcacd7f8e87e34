package com.phonepe.memoria.core.service;

import com.phonepe.memoria.core.model.Modality;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Content to memorize: inline text, a reference the blob store can resolve, or both. When both are given the
 * inline content wins and the uri is kept as the identity of the resource.
 */
@Value
@Builder
@Jacksonized
public class ResourceInput {
    String uri;
    String content;
    @Builder.Default
    Modality modality = Modality.CONVERSATION;

    public static ResourceInput conversation(String content) {
        return ResourceInput.builder()
                .content(content)
                .modality(Modality.CONVERSATION)
                .build();
    }

    public static ResourceInput document(String uri, String content) {
        return ResourceInput.builder()
                .uri(uri)
                .content(content)
                .modality(Modality.DOCUMENT)
                .build();
    }

    public static ResourceInput reference(String uri, Modality modality) {
        return ResourceInput.builder()
                .uri(uri)
                .modality(modality)
                .build();
    }
}
