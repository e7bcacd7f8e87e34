package com.phonepe.memoria.core.store;

import com.phonepe.memoria.core.model.Resource;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Optional filters for resource listing. Null members do not filter.
 */
@Value
@Builder
public class ResourceFilter {
    public static final ResourceFilter LIVE = ResourceFilter.builder().build();

    String uri;
    String contentHash;
    Set<String> ids;
    boolean includeSuperseded;

    public boolean test(Resource resource) {
        return (includeSuperseded || resource.isLive())
                && (uri == null || uri.equals(resource.getUri()))
                && (contentHash == null || contentHash.equals(resource.getContentHash()))
                && (ids == null || ids.contains(resource.getId()));
    }
}
