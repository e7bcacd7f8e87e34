package com.phonepe.memoria.core.pipeline;

import com.fasterxml.jackson.core.type.TypeReference;
import lombok.NonNull;
import lombok.Value;

/**
 * Typed name of a value in the pipeline state. The type reference is used to rebuild the value from a checkpoint.
 */
@Value
public class StateKey<T> {
    @NonNull
    String name;
    @NonNull
    TypeReference<T> type;

    public static <T> StateKey<T> of(String name, TypeReference<T> type) {
        return new StateKey<>(name, type);
    }

    @Override
    public String toString() {
        return name;
    }
}
