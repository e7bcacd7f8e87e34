package com.phonepe.memoria.core.runlog;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Volatile run log store
 */
public class InMemoryRunLogStore implements RunLogStore {
    private final ConcurrentHashMap<String, RunLog> logs = new ConcurrentHashMap<>();

    @Override
    public void save(RunLog runLog) {
        logs.put(runLog.getRunId(), runLog);
    }

    @Override
    public Optional<RunLog> get(String runId) {
        return Optional.ofNullable(logs.get(runId));
    }

    @Override
    public List<RunLog> recent(int count) {
        return logs.values()
                .stream()
                .sorted(Comparator.comparing(RunLog::getStartedAt, Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(count)
                .toList();
    }
}
