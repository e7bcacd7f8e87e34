package com.phonepe.memoria.core.pipeline;

import com.google.common.hash.Hashing;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * An immutable, validated step sequence of a pipeline. Runs hold on to the revision they started with.
 */
@Value
public class PipelineRevision {
    String pipeline;
    int revision;
    List<StepBinding> steps;
    /**
     * State keys the caller seeds before the first step
     */
    Set<String> initialKeys;
    /**
     * Short hash over name, revision number, step ids and config
     */
    String token;
    Instant createdAt;

    public PipelineRevision(
            String pipeline,
            int revision,
            List<StepBinding> steps,
            Set<String> initialKeys,
            Instant createdAt) {
        this.pipeline = pipeline;
        this.revision = revision;
        this.steps = List.copyOf(steps);
        this.initialKeys = Set.copyOf(initialKeys);
        this.createdAt = createdAt;
        this.token = computeToken(pipeline, revision, this.steps);
    }

    public Optional<StepBinding> step(String stepId) {
        return steps.stream().filter(binding -> binding.id().equals(stepId)).findFirst();
    }

    public List<String> stepIds() {
        return steps.stream().map(StepBinding::id).toList();
    }

    @Override
    public String toString() {
        return pipeline + "@" + revision + "(" + token + ")";
    }

    private static String computeToken(String pipeline, int revision, List<StepBinding> steps) {
        final var description = pipeline + ":" + revision + ":" + steps.stream()
                .map(binding -> binding.id() + "/" + binding.getFailurePolicy() + "/" + binding.isFinalizer()
                        + "/" + new TreeMap<>(binding.getConfig()))
                .collect(Collectors.joining(","));
        return Hashing.sha256()
                .hashString(description, StandardCharsets.UTF_8)
                .toString()
                .substring(0, 16);
    }
}
