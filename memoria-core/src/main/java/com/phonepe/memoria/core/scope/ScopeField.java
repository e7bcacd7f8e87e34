package com.phonepe.memoria.core.scope;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A named, typed tenant identity field
 */
@Value
@Builder
@Jacksonized
public class ScopeField {
    @NonNull
    String name;
    @NonNull
    ScopeFieldType type;

    public static ScopeField string(String name) {
        return new ScopeField(name, ScopeFieldType.STRING);
    }

    public static ScopeField of(String name, ScopeFieldType type) {
        return new ScopeField(name, type);
    }
}
