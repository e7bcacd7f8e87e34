package com.phonepe.memoria.core.pipeline.runner;

import java.util.List;
import java.util.Optional;

/**
 * Where the durable runner keeps checkpoints of runs in progress
 */
public interface RunCheckpointStore {
    void save(RunCheckpoint checkpoint);

    Optional<RunCheckpoint> get(String runId);

    /**
     * Checkpoints of runs that never finished, oldest first
     */
    List<RunCheckpoint> incomplete();

    /**
     * Drop the checkpoint of a finished run
     */
    void delete(String runId);
}
