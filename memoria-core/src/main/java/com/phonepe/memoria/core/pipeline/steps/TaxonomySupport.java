package com.phonepe.memoria.core.pipeline.steps;

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import com.phonepe.memoria.core.config.CategoryDefinition;
import com.phonepe.memoria.core.config.TaxonomyConfig;
import com.phonepe.memoria.core.model.MemoryCategory;
import com.phonepe.memoria.core.model.MemoryItem;
import com.phonepe.memoria.core.model.MemoryType;
import com.phonepe.memoria.core.scope.Scope;
import lombok.experimental.UtilityClass;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Category naming and anchor selection shared by categorisation and re-clustering
 */
@UtilityClass
public class TaxonomySupport {
    private static final CharMatcher SEPARATORS = CharMatcher.whitespace().or(CharMatcher.anyOf("-/"));

    /**
     * Category used when extraction suggested none
     */
    public static String fallbackCategory(MemoryType memoryType) {
        return switch (memoryType) {
            case PROFILE -> "personal_info";
            case EVENT -> "experiences";
            case KNOWLEDGE -> "knowledge";
            case BEHAVIOR -> "habits";
            case SKILL -> "work_life";
            case GOAL -> "goals";
        };
    }

    /**
     * Lower snake case form used to compare category names
     */
    public static String normalizeName(String name) {
        if (Strings.isNullOrEmpty(name)) {
            return "";
        }
        return SEPARATORS.trimAndCollapseFrom(name.trim().toLowerCase(Locale.ROOT), '_');
    }

    public static String catalogDescription(TaxonomyConfig config, String name) {
        return config.getCatalog()
                .stream()
                .filter(definition -> definition.getName().equalsIgnoreCase(name))
                .map(CategoryDefinition::getDescription)
                .findFirst()
                .orElse("");
    }

    public static boolean inCatalog(TaxonomyConfig config, String name) {
        return config.getCatalog().stream().anyMatch(definition -> definition.getName().equalsIgnoreCase(name));
    }

    /**
     * Catalog names followed by names already used in the scope
     */
    public static List<String> knownNames(TaxonomyConfig config, Collection<MemoryCategory> existing) {
        final var names = new LinkedHashSet<String>();
        config.getCatalog().forEach(definition -> names.add(definition.getName()));
        existing.forEach(category -> names.add(category.getName()));
        return List.copyOf(names);
    }

    public static MemoryCategory newCategory(TaxonomyConfig config, Scope scope, String name, Instant now) {
        return MemoryCategory.builder()
                .id(UUID.randomUUID().toString())
                .scope(scope)
                .name(name)
                .description(catalogDescription(config, name))
                .summary("")
                .anchorItemIds(List.of())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * Most representative items: most confident first, then most reinforced, then oldest
     */
    public static List<String> anchors(Stream<MemoryItem> items, int count) {
        return items
                .sorted(Comparator.comparingDouble(MemoryItem::getConfidence).reversed()
                                .thenComparing(Comparator.comparingInt(MemoryItem::getReinforcementCount).reversed())
                                .thenComparing(MemoryItem::getCreatedAt,
                                               Comparator.nullsLast(Comparator.naturalOrder())))
                .map(MemoryItem::getId)
                .distinct()
                .limit(count)
                .toList();
    }

    /**
     * Text used to embed and lexically match a category
     */
    public static String categoryText(MemoryCategory category) {
        return String.join(" ",
                           category.getName().replace('_', ' '),
                           Strings.nullToEmpty(category.getDescription()),
                           Strings.nullToEmpty(category.getSummary()));
    }
}
