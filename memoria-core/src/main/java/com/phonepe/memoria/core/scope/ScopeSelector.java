package com.phonepe.memoria.core.scope;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.Sets;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read side scope expression: per field an exact value, a finite set of values or a wildcard. A selector that is
 * exact on every field addresses exactly one scope and needs no policing.
 */
@Value
public class ScopeSelector {
    Map<String, FieldSelector> fields;

    private ScopeSelector(Map<String, FieldSelector> fields) {
        Preconditions.checkArgument(fields != null && !fields.isEmpty(), "Selector needs at least one field");
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ScopeSelector of(Map<String, FieldSelector> fields) {
        return new ScopeSelector(fields);
    }

    public static ScopeSelector exact(Scope scope) {
        final var fields = new LinkedHashMap<String, FieldSelector>();
        scope.getValues().forEach((name, value) -> fields.put(name, FieldSelector.exact(value)));
        return new ScopeSelector(fields);
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonValue
    public Map<String, FieldSelector> getFields() {
        return fields;
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    public FieldSelector field(String name) {
        return fields.get(name);
    }

    /**
     * True if the scope has exactly the selector's fields and every value matches.
     */
    public boolean matches(Scope scope) {
        if (scope == null || !scope.fieldNames().equals(fields.keySet())) {
            return false;
        }
        return fields.entrySet()
                .stream()
                .allMatch(e -> e.getValue().matches(scope.get(e.getKey())));
    }

    public boolean isSingleExact() {
        return fields.values().stream().allMatch(f -> f.getMode() == FieldSelector.Mode.EXACT);
    }

    public boolean hasWildcard() {
        return fields.values().stream().anyMatch(f -> f.getMode() == FieldSelector.Mode.WILDCARD);
    }

    public boolean isAllWildcard() {
        return fields.values().stream().allMatch(f -> f.getMode() == FieldSelector.Mode.WILDCARD);
    }

    /**
     * Number of concrete value combinations across the non wildcard fields. Saturates at {@link Long#MAX_VALUE}.
     */
    public long combinationCount() {
        long count = 1;
        for (var selector : fields.values()) {
            if (selector.getMode() == FieldSelector.Mode.WILDCARD) {
                continue;
            }
            final var size = selector.getValues().size();
            if (count > Long.MAX_VALUE / size) {
                return Long.MAX_VALUE;
            }
            count *= size;
        }
        return count;
    }

    public Scope toExactScope() {
        Preconditions.checkState(isSingleExact(), "Selector %s is not a single exact scope", this);
        final var values = new LinkedHashMap<String, String>();
        fields.forEach((name, selector) -> values.put(name, selector.singleValue()));
        return Scope.of(values);
    }

    /**
     * All concrete scopes addressed by this selector. Only defined when no field is wildcarded.
     */
    public List<Scope> expand() {
        Preconditions.checkState(!hasWildcard(), "Cannot expand selector with wildcard: %s", this);
        final var names = new ArrayList<>(fields.keySet());
        final var valueSets = names.stream()
                .map(name -> fields.get(name).getValues())
                .toList();
        return Sets.cartesianProduct(valueSets)
                .stream()
                .map(combination -> {
                    final var values = new LinkedHashMap<String, String>();
                    for (int i = 0; i < names.size(); i++) {
                        values.put(names.get(i), combination.get(i));
                    }
                    return Scope.of(values);
                })
                .toList();
    }

    public ScopeSelector inOrder(List<String> order) {
        final var ordered = new LinkedHashMap<String, FieldSelector>();
        for (var name : order) {
            if (fields.containsKey(name)) {
                ordered.put(name, fields.get(name));
            }
        }
        return new ScopeSelector(ordered);
    }

    @Override
    public String toString() {
        return fields.entrySet()
                .stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("|"));
    }

    /**
     * Fluent selector builder
     */
    public static final class Builder {
        private final Map<String, FieldSelector> fields = new LinkedHashMap<>();

        public Builder exact(String field, String value) {
            fields.put(field, FieldSelector.exact(value));
            return this;
        }

        public Builder anyOf(String field, String... values) {
            fields.put(field, FieldSelector.anyOf(values));
            return this;
        }

        public Builder anyOf(String field, Collection<String> values) {
            fields.put(field, FieldSelector.anyOf(values));
            return this;
        }

        public Builder wildcard(String field) {
            fields.put(field, FieldSelector.wildcard());
            return this;
        }

        public ScopeSelector build() {
            return new ScopeSelector(fields);
        }
    }
}
