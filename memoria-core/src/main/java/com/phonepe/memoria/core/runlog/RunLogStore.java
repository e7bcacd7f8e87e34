package com.phonepe.memoria.core.runlog;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for run logs. Kept apart from the metadata store so that requests rejected before running (for
 * example by the retrieval policy) can still be logged without touching tenant data.
 */
public interface RunLogStore {
    void save(RunLog runLog);

    Optional<RunLog> get(String runId);

    /**
     * Most recent runs first
     */
    List<RunLog> recent(int count);
}
