package com.phonepe.memoria.core.store;

import com.phonepe.memoria.core.model.MemoryItem;
import com.phonepe.memoria.core.model.MemoryType;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Optional filters for item listing. Null members do not filter.
 */
@Value
@Builder
public class ItemFilter {
    public static final ItemFilter LIVE = ItemFilter.builder().build();
    public static final ItemFilter ALL = ItemFilter.builder().includeSuperseded(true).build();

    Set<MemoryType> memoryTypes;
    Set<String> ids;
    String resourceId;
    String key;
    String contentHash;
    boolean includeSuperseded;

    public boolean test(MemoryItem item) {
        return (includeSuperseded || item.isLive())
                && (memoryTypes == null || memoryTypes.isEmpty() || memoryTypes.contains(item.getMemoryType()))
                && (ids == null || ids.contains(item.getId()))
                && (resourceId == null || resourceId.equals(item.getResourceId()))
                && (key == null || key.equals(item.getKey()))
                && (contentHash == null || contentHash.equals(item.getContentHash()));
    }
}
