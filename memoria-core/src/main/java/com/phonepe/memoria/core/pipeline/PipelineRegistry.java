package com.phonepe.memoria.core.pipeline;

import com.phonepe.memoria.core.capability.Capability;
import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Append only log of pipeline revisions. Every edit builds a new step list, validates it and publishes it as the
 * next revision. Published revisions are never changed, so a run that captured one is unaffected by later edits.
 */
@Slf4j
public class PipelineRegistry {
    private final PipelineValidator validator;
    private final Clock clock;
    private final Map<String, List<PipelineRevision>> revisions = new ConcurrentHashMap<>();
    private final List<Consumer<PipelineRevision>> listeners = new CopyOnWriteArrayList<>();

    public PipelineRegistry(Set<Capability> availableCapabilities, Clock clock) {
        this.validator = new PipelineValidator(availableCapabilities);
        this.clock = clock;
    }

    /**
     * Called with every newly published revision
     */
    public PipelineRegistry onPublish(Consumer<PipelineRevision> listener) {
        listeners.add(listener);
        return this;
    }

    public synchronized PipelineRevision register(String pipeline, List<StepBinding> steps, Set<String> initialKeys) {
        if (revisions.containsKey(pipeline)) {
            throw MemoriaException.of(ErrorType.VALIDATION_ERROR, "pipeline " + pipeline + " is already registered");
        }
        return publish(pipeline, steps, initialKeys);
    }

    public PipelineRevision current(String pipeline) {
        final var history = history(pipeline);
        return history.get(history.size() - 1);
    }

    public PipelineRevision revision(String pipeline, int revision) {
        final var history = history(pipeline);
        if (revision < 1 || revision > history.size()) {
            throw MemoriaException.of(ErrorType.NOT_FOUND, "revision %d of pipeline %s".formatted(revision, pipeline));
        }
        return history.get(revision - 1);
    }

    public List<PipelineRevision> history(String pipeline) {
        final var history = revisions.get(pipeline);
        if (history == null) {
            throw MemoriaException.of(ErrorType.NOT_FOUND, "pipeline " + pipeline);
        }
        return List.copyOf(history);
    }

    public Set<String> pipelines() {
        return Set.copyOf(revisions.keySet());
    }

    /**
     * Merge config overrides into a step
     */
    public PipelineRevision configureStep(String pipeline, String stepId, Map<String, Object> config) {
        return edit(pipeline, steps -> {
            final var index = indexOf(pipeline, steps, stepId);
            final var binding = steps.get(index);
            final var merged = new HashMap<>(binding.getConfig());
            merged.putAll(config);
            steps.set(index, binding.withConfig(Map.copyOf(merged)));
            return steps;
        });
    }

    public PipelineRevision insertBefore(String pipeline, String targetStepId, StepBinding binding) {
        return edit(pipeline, steps -> {
            steps.add(indexOf(pipeline, steps, targetStepId), binding);
            return steps;
        });
    }

    public PipelineRevision insertAfter(String pipeline, String targetStepId, StepBinding binding) {
        return edit(pipeline, steps -> {
            steps.add(indexOf(pipeline, steps, targetStepId) + 1, binding);
            return steps;
        });
    }

    public PipelineRevision replaceStep(String pipeline, String stepId, StepBinding binding) {
        return edit(pipeline, steps -> {
            steps.set(indexOf(pipeline, steps, stepId), binding);
            return steps;
        });
    }

    public PipelineRevision removeStep(String pipeline, String stepId) {
        return edit(pipeline, steps -> {
            steps.remove(indexOf(pipeline, steps, stepId));
            return steps;
        });
    }

    /**
     * Publish the step sequence of an older revision as a new revision
     */
    public PipelineRevision rollback(String pipeline, int revision) {
        final var target = revision(pipeline, revision);
        return edit(pipeline, steps -> new ArrayList<>(target.getSteps()));
    }

    private synchronized PipelineRevision edit(String pipeline, UnaryOperator<List<StepBinding>> change) {
        final var current = current(pipeline);
        final var steps = change.apply(new ArrayList<>(current.getSteps()));
        return publish(pipeline, steps, current.getInitialKeys());
    }

    private PipelineRevision publish(String pipeline, List<StepBinding> steps, Set<String> initialKeys) {
        validator.validate(pipeline, steps, initialKeys);
        final var history = revisions.computeIfAbsent(pipeline, name -> new CopyOnWriteArrayList<>());
        final var revision = new PipelineRevision(pipeline, history.size() + 1, steps, initialKeys, clock.instant());
        history.add(revision);
        log.info("Published pipeline revision {} with steps {}", revision, revision.stepIds());
        listeners.forEach(listener -> listener.accept(revision));
        return revision;
    }

    private static int indexOf(String pipeline, List<StepBinding> steps, String stepId) {
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).id().equals(stepId)) {
                return i;
            }
        }
        throw MemoriaException.of(ErrorType.VALIDATION_ERROR, "pipeline %s has no step %s".formatted(pipeline, stepId));
    }
}
