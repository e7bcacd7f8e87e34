package com.phonepe.memoria.core.model;

/**
 * Type of an extracted memory fact
 */
public enum MemoryType {
    /**
     * Stable facts about the subject: name, location, preferences, relationships
     */
    PROFILE,
    /**
     * Something that happened at a point in time
     */
    EVENT,
    /**
     * General knowledge or information learnt from content
     */
    KNOWLEDGE,
    /**
     * Recurring patterns, habits and routines
     */
    BEHAVIOR,
    /**
     * Abilities, tools and expertise
     */
    SKILL,
    /**
     * Goals, plans and constraints. These feed the scope intention.
     */
    GOAL
}
