package com.phonepe.memoria.core.pipeline.steps;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.phonepe.memoria.core.model.CategoryItem;
import com.phonepe.memoria.core.model.MemoryCategory;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Category and link writes decided by categorisation or re-clustering
 */
@Value
@Builder
@Jacksonized
public class CategoryPlan {
    public static final CategoryPlan EMPTY = CategoryPlan.builder().build();

    /**
     * New categories and categories with a new summary or anchors
     */
    @Singular
    List<MemoryCategory> upserts;
    @Singular
    List<MemoryCategory> deletedCategories;
    @Singular
    List<CategoryItem> addedLinks;
    @Singular
    List<CategoryItem> removedLinks;
    @Singular
    List<String> createdNames;
    @Singular
    List<String> updatedNames;

    @JsonIgnore
    public boolean isEmpty() {
        return upserts.isEmpty() && deletedCategories.isEmpty() && addedLinks.isEmpty() && removedLinks.isEmpty();
    }
}
