package com.phonepe.memoria.core.pipeline;

import com.phonepe.memoria.core.config.MemoriaConfig;
import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;
import com.phonepe.memoria.core.scope.Scope;
import com.phonepe.memoria.core.scope.ScopeSelector;
import lombok.Value;

/**
 * What a step sees of its run, plus its own config overrides
 */
@Value
public class StepContext {
    RunContext run;
    StepBinding binding;

    public MemoriaServices services() {
        return run.getServices();
    }

    public MemoriaConfig config() {
        return run.getServices().getConfig();
    }

    public GuardedCalls calls() {
        return run.getServices().getCalls();
    }

    /**
     * Scope written by the run
     */
    public Scope scope() {
        if (run.getScope() == null) {
            throw MemoriaException.of(ErrorType.INTERNAL_ERROR,
                                      "step %s needs a single scope".formatted(binding.id()));
        }
        return run.getScope();
    }

    public ScopeSelector selector() {
        return run.getSelector();
    }

    /**
     * Override from the step binding, converted to the type of the default
     */
    @SuppressWarnings("unchecked")
    public <T> T option(String name, T defaultValue) {
        final var value = binding.getConfig().get(name);
        if (value == null) {
            return defaultValue;
        }
        if (defaultValue == null || defaultValue.getClass().isInstance(value)) {
            return (T) value;
        }
        return (T) services().getMapper().convertValue(value, defaultValue.getClass());
    }
}
