package com.phonepe.memoria.core.pipeline.runner;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Volatile checkpoint store. Survives step failures but not a process restart.
 */
public class InMemoryRunCheckpointStore implements RunCheckpointStore {
    private final Map<String, RunCheckpoint> checkpoints = new ConcurrentHashMap<>();

    @Override
    public void save(RunCheckpoint checkpoint) {
        checkpoints.put(checkpoint.getRunId(), checkpoint);
    }

    @Override
    public Optional<RunCheckpoint> get(String runId) {
        return Optional.ofNullable(checkpoints.get(runId));
    }

    @Override
    public List<RunCheckpoint> incomplete() {
        return checkpoints.values()
                .stream()
                .sorted(Comparator.comparing(RunCheckpoint::getStartedAt,
                                             Comparator.nullsFirst(Comparator.<Instant>naturalOrder())))
                .toList();
    }

    @Override
    public void delete(String runId) {
        checkpoints.remove(runId);
    }
}
