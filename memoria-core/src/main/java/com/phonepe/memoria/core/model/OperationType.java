package com.phonepe.memoria.core.model;

import java.util.Locale;

/**
 * The named operations the engine runs as pipelines
 */
public enum OperationType {
    MEMORIZE,
    RETRIEVE,
    EVOLVE;

    public String pipelineName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
