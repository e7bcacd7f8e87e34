package com.phonepe.memoria.core.runlog;

import com.phonepe.memoria.core.errors.MemoriaError;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Timing and outcome of one step of a run
 */
@Value
@Builder
@Jacksonized
public class StepRecord {
    String stepId;
    StepStatus status;
    int attempts;
    long durationMillis;
    MemoriaError error;
}
