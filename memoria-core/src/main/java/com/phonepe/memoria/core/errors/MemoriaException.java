package com.phonepe.memoria.core.errors;

import lombok.Getter;

/**
 * Unchecked carrier for a {@link MemoriaError} through stores, steps and runners.
 */
@Getter
public class MemoriaException extends RuntimeException {
    private final transient MemoriaError error;

    public MemoriaException(MemoriaError error) {
        super(error.getMessage());
        this.error = error;
    }

    public MemoriaException(MemoriaError error, Throwable cause) {
        super(error.getMessage(), cause);
        this.error = error;
    }

    public static MemoriaException of(ErrorType errorType, Object... args) {
        return new MemoriaException(MemoriaError.error(errorType, args));
    }

    public static MemoriaException wrap(ErrorType errorType, Throwable cause) {
        return new MemoriaException(MemoriaError.error(errorType, cause), cause);
    }

    public ErrorType getErrorType() {
        return error.getErrorType();
    }

    public boolean isRetryable() {
        return error.isRetryable();
    }
}
