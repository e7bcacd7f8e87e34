package com.phonepe.memoria.core.errors;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Structured error returned to callers. Carries enough context (run, step, scope) to diagnose a failure without
 * exposing internal state.
 */
@Value
@With
@Builder
@Jacksonized
@AllArgsConstructor
public class MemoriaError {
    ErrorType errorType;
    String message;
    String runId;
    String stepId;
    String scope;

    public static MemoriaError success() {
        return new MemoriaError(ErrorType.SUCCESS, ErrorType.SUCCESS.getMessage(), null, null, null);
    }

    public static MemoriaError error(ErrorType errorType, Object... args) {
        return new MemoriaError(errorType, String.format(errorType.getMessage(), args), null, null, null);
    }

    public static MemoriaError error(ErrorType errorType, Throwable throwable) {
        var cause = throwable.getCause();
        var message = throwable.getMessage();
        do {
            if (cause != null) {
                message = cause.getMessage();
                cause = cause.getCause();
            }
        } while (cause != null);
        return MemoriaError.error(errorType, message);
    }

    public boolean isRetryable() {
        return errorType != null && errorType.isRetryable();
    }
}
