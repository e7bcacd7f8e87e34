package com.phonepe.memoria.core.scope;

import com.google.common.base.Preconditions;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Match expression for a single scope field
 */
@Value
public class FieldSelector {
    public enum Mode {
        /**
         * Exactly one value
         */
        EXACT,
        /**
         * Any of a finite set of values
         */
        ANY_OF,
        /**
         * Any value at all
         */
        WILDCARD
    }

    @NonNull
    Mode mode;
    Set<String> values;

    @Builder
    @Jacksonized
    public FieldSelector(@NonNull Mode mode, Collection<String> values) {
        this.mode = mode;
        this.values = Collections.unmodifiableSet(new TreeSet<>(Objects.requireNonNullElse(values, Set.of())));
        switch (mode) {
            case EXACT -> Preconditions.checkArgument(this.values.size() == 1, "Exact selector needs one value");
            case ANY_OF -> Preconditions.checkArgument(!this.values.isEmpty(), "Set selector needs values");
            case WILDCARD -> Preconditions.checkArgument(this.values.isEmpty(), "Wildcard selector takes no values");
        }
    }

    public static FieldSelector exact(String value) {
        return new FieldSelector(Mode.EXACT, Set.of(value));
    }

    public static FieldSelector anyOf(String... values) {
        return anyOf(Arrays.asList(values));
    }

    public static FieldSelector anyOf(Collection<String> values) {
        final var distinct = new TreeSet<>(values);
        return distinct.size() == 1
               ? new FieldSelector(Mode.EXACT, distinct)
               : new FieldSelector(Mode.ANY_OF, distinct);
    }

    public static FieldSelector wildcard() {
        return new FieldSelector(Mode.WILDCARD, Set.of());
    }

    public boolean matches(String value) {
        return value != null && (mode == Mode.WILDCARD || values.contains(value));
    }

    public String singleValue() {
        Preconditions.checkState(mode == Mode.EXACT, "Not an exact selector");
        return values.iterator().next();
    }

    @Override
    public String toString() {
        return switch (mode) {
            case EXACT -> singleValue();
            case ANY_OF -> "{" + String.join(",", values) + "}";
            case WILDCARD -> "*";
        };
    }
}
