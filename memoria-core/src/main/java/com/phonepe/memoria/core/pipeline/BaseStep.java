package com.phonepe.memoria.core.pipeline;

import com.phonepe.memoria.core.capability.Capability;

import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Holds the declarations of a step
 */
public abstract class BaseStep implements PipelineStep {
    private final String id;
    private final StepRole role;
    private final Set<String> requires;
    private final Set<String> produces;
    private final Set<Capability> capabilities;

    protected BaseStep(String id, StepRole role, Set<StateKey<?>> requires, Set<StateKey<?>> produces) {
        this(id, role, requires, produces, role.defaultCapabilities());
    }

    protected BaseStep(
            String id,
            StepRole role,
            Set<StateKey<?>> requires,
            Set<StateKey<?>> produces,
            Set<Capability> capabilities) {
        this.id = id;
        this.role = role;
        this.requires = names(requires);
        this.produces = names(produces);
        this.capabilities = Set.copyOf(capabilities);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public StepRole role() {
        return role;
    }

    @Override
    public Set<String> requires() {
        return requires;
    }

    @Override
    public Set<String> produces() {
        return produces;
    }

    @Override
    public Set<Capability> capabilities() {
        return capabilities;
    }

    @Override
    public String toString() {
        return id;
    }

    private static Set<String> names(Set<StateKey<?>> keys) {
        return Stream.ofNullable(keys)
                .flatMap(Set::stream)
                .map(StateKey::getName)
                .collect(Collectors.toUnmodifiableSet());
    }
}
