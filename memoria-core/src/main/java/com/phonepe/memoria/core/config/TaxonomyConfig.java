package com.phonepe.memoria.core.config;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Category catalog and summary settings
 */
@Value
@Builder
@Jacksonized
public class TaxonomyConfig {
    public static final List<CategoryDefinition> DEFAULT_CATALOG = List.of(
            CategoryDefinition.of("personal_info", "Personal information about the user"),
            CategoryDefinition.of("preferences", "User likes, dislikes and preferences"),
            CategoryDefinition.of("relationships", "People, pets and relationships in the user's life"),
            CategoryDefinition.of("activities", "Activities, hobbies and things the user does"),
            CategoryDefinition.of("goals", "Goals, plans and constraints"),
            CategoryDefinition.of("experiences", "Past events and experiences"),
            CategoryDefinition.of("knowledge", "Knowledge and information the user has shared or learnt"),
            CategoryDefinition.of("opinions", "Opinions and viewpoints"),
            CategoryDefinition.of("habits", "Routines and recurring behaviour"),
            CategoryDefinition.of("work_life", "Work, career and skills"));
    public static final TaxonomyConfig DEFAULT = TaxonomyConfig.builder().build();

    @Builder.Default
    List<CategoryDefinition> catalog = DEFAULT_CATALOG;

    @Builder.Default
    int summaryTargetLength = 400;

    /**
     * Anchor items kept per category
     */
    @Builder.Default
    int anchorCount = 5;

    @Builder.Default
    int maxFactsPerResource = 50;
}
