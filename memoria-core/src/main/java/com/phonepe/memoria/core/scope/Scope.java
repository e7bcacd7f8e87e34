package com.phonepe.memoria.core.scope;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Preconditions;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Concrete tenant identity: one value per scope field, kept in schema order once validated by the tenancy manager.
 * Every persisted entity carries one of these.
 */
@Value
public class Scope {
    Map<String, String> values;

    private Scope(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Scope of(Map<String, String> values) {
        Preconditions.checkArgument(values != null && !values.isEmpty(), "Scope must have at least one field");
        return new Scope(values);
    }

    /**
     * Builds a scope from alternating field names and values.
     */
    public static Scope of(String... fieldsAndValues) {
        Preconditions.checkArgument(fieldsAndValues.length > 0 && fieldsAndValues.length % 2 == 0,
                                    "Scope needs field/value pairs");
        final var values = new LinkedHashMap<String, String>();
        for (int i = 0; i < fieldsAndValues.length; i += 2) {
            values.put(fieldsAndValues[i], fieldsAndValues[i + 1]);
        }
        return new Scope(values);
    }

    @JsonValue
    public Map<String, String> getValues() {
        return values;
    }

    public String get(String field) {
        return values.get(field);
    }

    public Set<String> fieldNames() {
        return values.keySet();
    }

    /**
     * Copy with fields rearranged in the given order. Fields missing from the order are dropped.
     */
    public Scope inOrder(List<String> order) {
        final var ordered = new LinkedHashMap<String, String>();
        for (var field : order) {
            if (values.containsKey(field)) {
                ordered.put(field, values.get(field));
            }
        }
        return new Scope(ordered);
    }

    /**
     * Canonical key, e.g. <code>project=p1|agent=a1</code>. Used as partition key by the stores.
     */
    public String key() {
        return values.entrySet()
                .stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("|"));
    }

    @Override
    public String toString() {
        return key();
    }
}
