package com.phonepe.memoria.core.pipeline;

import com.phonepe.memoria.core.capability.Capability;

import java.util.EnumSet;
import java.util.Set;

/**
 * What a step does. The role decides the capabilities a step needs unless the step overrides them.
 */
public enum StepRole {
    INGESTION(EnumSet.of(Capability.BLOB_READ)),
    PREPROCESSING(EnumSet.of(Capability.LLM)),
    EXTRACTION(EnumSet.of(Capability.LLM)),
    MERGING(EnumSet.noneOf(Capability.class)),
    PLANNING(EnumSet.noneOf(Capability.class)),
    CLUSTERING(EnumSet.of(Capability.LLM)),
    ROUTING(EnumSet.noneOf(Capability.class)),
    SUFFICIENCY(EnumSet.of(Capability.LLM)),
    RECALL(EnumSet.noneOf(Capability.class)),
    VERIFICATION(EnumSet.of(Capability.LLM)),
    PERSISTENCE(EnumSet.of(Capability.METADATA_WRITE)),
    REPORTING(EnumSet.noneOf(Capability.class));

    private final Set<Capability> defaultCapabilities;

    StepRole(Set<Capability> defaultCapabilities) {
        this.defaultCapabilities = defaultCapabilities;
    }

    public Set<Capability> defaultCapabilities() {
        return Set.copyOf(defaultCapabilities);
    }
}
