package com.phonepe.memoria.core.pipeline.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.phonepe.memoria.core.model.OperationType;
import com.phonepe.memoria.core.runlog.StepRecord;
import com.phonepe.memoria.core.scope.Scope;
import com.phonepe.memoria.core.scope.ScopeSelector;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Durable snapshot of an unfinished run, written after every wave of steps
 */
@Value
@With
@Builder
@Jacksonized
public class RunCheckpoint {
    String runId;
    OperationType operation;
    String pipeline;
    int revision;
    String revisionToken;
    Scope scope;
    ScopeSelector selector;
    /**
     * Records of the steps already done, in pipeline order
     */
    List<StepRecord> steps;
    Map<String, JsonNode> state;
    boolean degraded;
    Instant startedAt;
    Instant updatedAt;
}
