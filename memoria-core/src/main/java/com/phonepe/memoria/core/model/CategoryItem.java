package com.phonepe.memoria.core.model;

import com.phonepe.memoria.core.scope.Scope;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.UUID;

/**
 * Link between a category and an item of the same scope
 */
@Value
@Builder
@Jacksonized
public class CategoryItem {
    String id;
    Scope scope;
    String categoryId;
    String itemId;
    Instant createdAt;

    public static CategoryItem link(Scope scope, String categoryId, String itemId, Instant now) {
        return new CategoryItem(linkId(scope, categoryId, itemId), scope, categoryId, itemId, now);
    }

    public static String linkId(Scope scope, String categoryId, String itemId) {
        return UUID.nameUUIDFromBytes("%s-%s-%s".formatted(scope.key(), categoryId, itemId)
                                              .getBytes(StandardCharsets.UTF_8)).toString();
    }
}
