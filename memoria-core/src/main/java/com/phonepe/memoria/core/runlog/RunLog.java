package com.phonepe.memoria.core.runlog;

import com.phonepe.memoria.core.errors.MemoriaError;
import com.phonepe.memoria.core.model.EvolutionDiff;
import com.phonepe.memoria.core.model.OperationType;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Record of a pipeline run. Kept for every run whatever the outcome.
 */
@Value
@With
@Builder
@Jacksonized
public class RunLog {
    String runId;
    OperationType operation;
    String pipeline;
    int revision;
    String revisionToken;
    /**
     * Scope key, or selector description for cross scope reads
     */
    String scope;
    RunStatus status;
    String inputSummary;
    List<StepRecord> steps;
    MemoriaError error;
    EvolutionDiff diff;
    Instant startedAt;
    Instant finishedAt;
}
