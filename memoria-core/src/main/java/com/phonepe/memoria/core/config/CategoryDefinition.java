package com.phonepe.memoria.core.config;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A category known to the deployment before any content arrives
 */
@Value
@Builder
@Jacksonized
public class CategoryDefinition {
    String name;
    String description;

    public static CategoryDefinition of(String name, String description) {
        return new CategoryDefinition(name, description);
    }
}
