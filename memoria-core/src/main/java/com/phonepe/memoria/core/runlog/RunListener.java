package com.phonepe.memoria.core.runlog;

/**
 * Notified after every run has been logged. Evolve diffs reach auditors through this.
 */
@FunctionalInterface
public interface RunListener {
    void onRunFinished(RunLog runLog);
}
