package com.phonepe.memoria.core.model;

/**
 * Entities that can carry an embedding in the vector index
 */
public enum EntityType {
    RESOURCE,
    ITEM,
    CATEGORY
}
