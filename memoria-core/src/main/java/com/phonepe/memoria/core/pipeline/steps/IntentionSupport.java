package com.phonepe.memoria.core.pipeline.steps;

import com.phonepe.memoria.core.model.Intention;
import com.phonepe.memoria.core.model.MemoryItem;
import com.phonepe.memoria.core.model.MemoryType;
import com.phonepe.memoria.core.scope.Scope;
import lombok.experimental.UtilityClass;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Derives the intention of a scope from its live goal items
 */
@UtilityClass
public class IntentionSupport {
    public static final String CONSTRAINT_KEY_PREFIX = "Constraint";

    /**
     * New intention version, or empty if goals and constraints are unchanged
     */
    public static Optional<Intention> derive(
            Scope scope,
            Collection<MemoryItem> liveItems,
            Intention existing,
            Instant now) {
        final var goalItems = liveItems.stream()
                .filter(item -> item.getMemoryType() == MemoryType.GOAL)
                .sorted(Comparator.comparing(MemoryItem::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                .toList();
        final var goals = goalItems.stream()
                .filter(item -> !isConstraint(item))
                .map(MemoryItem::getContent)
                .distinct()
                .toList();
        final var constraints = goalItems.stream()
                .filter(IntentionSupport::isConstraint)
                .map(MemoryItem::getContent)
                .distinct()
                .toList();
        if (existing == null && goals.isEmpty() && constraints.isEmpty()) {
            return Optional.empty();
        }
        if (existing != null
                && Objects.equals(existing.getGoals(), goals)
                && Objects.equals(existing.getConstraints(), constraints)) {
            return Optional.empty();
        }
        return Optional.of(Intention.builder()
                                   .scope(scope)
                                   .goals(goals)
                                   .constraints(constraints)
                                   .summary(summary(goals, constraints))
                                   .version(existing == null ? 1 : existing.getVersion() + 1)
                                   .updatedAt(now)
                                   .build());
    }

    /**
     * Text used to match an intention against a query
     */
    public static String intentionText(Intention intention) {
        return intention.getSummary() == null ? "" : intention.getSummary();
    }

    private static boolean isConstraint(MemoryItem item) {
        return item.getKey() != null && item.getKey().startsWith(CONSTRAINT_KEY_PREFIX);
    }

    private static String summary(List<String> goals, List<String> constraints) {
        final var summary = new StringBuilder();
        if (!goals.isEmpty()) {
            summary.append("Goals: ").append(String.join("; ", goals)).append('.');
        }
        if (!constraints.isEmpty()) {
            if (!summary.isEmpty()) {
                summary.append(' ');
            }
            summary.append("Constraints: ").append(String.join("; ", constraints)).append('.');
        }
        return summary.toString();
    }
}
