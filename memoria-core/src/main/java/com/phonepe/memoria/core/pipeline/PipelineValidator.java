package com.phonepe.memoria.core.pipeline;

import com.google.common.collect.Sets;
import com.phonepe.memoria.core.capability.Capability;
import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Static checks run on every candidate step sequence before it becomes a revision
 */
@Slf4j
public class PipelineValidator {
    private final Set<Capability> availableCapabilities;

    public PipelineValidator(Set<Capability> availableCapabilities) {
        this.availableCapabilities = Set.copyOf(availableCapabilities);
    }

    /**
     * @throws MemoriaException {@link ErrorType#VALIDATION_ERROR} for structural problems,
     *                          {@link ErrorType#CAPABILITY_UNAVAILABLE} if a step needs a capability the deployment
     *                          does not have
     */
    public void validate(String pipeline, List<StepBinding> steps, Set<String> initialKeys) {
        if (steps.isEmpty()) {
            throw invalid(pipeline, "pipeline has no steps");
        }
        final var ids = new HashSet<String>();
        final var available = new HashSet<>(initialKeys);
        var finalizerSeen = false;
        for (var binding : steps) {
            final var step = binding.getStep();
            if (!ids.add(step.id())) {
                throw invalid(pipeline, "duplicate step id " + step.id());
            }
            final var unknown = Sets.difference(binding.getConfig().keySet(), step.options());
            if (!unknown.isEmpty()) {
                throw invalid(pipeline, "step %s does not take options %s".formatted(step.id(), unknown));
            }
            if (finalizerSeen && !binding.isFinalizer()) {
                throw invalid(pipeline, "step " + step.id() + " is placed after a finalizer");
            }
            finalizerSeen |= binding.isFinalizer();
            final var missing = Sets.difference(step.requires(), available);
            if (!missing.isEmpty()) {
                throw invalid(pipeline, "step %s requires %s which no earlier step produces"
                        .formatted(step.id(), missing));
            }
            final var unavailable = Sets.difference(step.capabilities(), availableCapabilities);
            if (!unavailable.isEmpty()) {
                log.error("Pipeline {} step {} needs capabilities {} missing from this deployment",
                          pipeline, step.id(), unavailable);
                throw MemoriaException.of(ErrorType.CAPABILITY_UNAVAILABLE,
                                          "%s for step %s of %s".formatted(unavailable, step.id(), pipeline));
            }
            available.addAll(step.produces());
        }
    }

    private static MemoriaException invalid(String pipeline, String message) {
        log.error("Rejected step sequence for pipeline {}: {}", pipeline, message);
        return MemoriaException.of(ErrorType.VALIDATION_ERROR, pipeline + ": " + message);
    }
}
