package com.phonepe.memoria.core.capability;

import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaError;
import com.phonepe.memoria.core.errors.MemoriaException;
import lombok.Value;

/**
 * Result of a capability call: data on success, otherwise an error whose type tells the runner whether the call
 * can be retried.
 */
@Value
public class CapabilityResponse<T> {
    T data;
    MemoriaError error;

    public static <T> CapabilityResponse<T> success(T data) {
        return new CapabilityResponse<>(data, null);
    }

    public static <T> CapabilityResponse<T> failure(MemoriaError error) {
        return new CapabilityResponse<>(null, error);
    }

    public static <T> CapabilityResponse<T> failure(ErrorType errorType, Object... args) {
        return new CapabilityResponse<>(null, MemoriaError.error(errorType, args));
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Data, or a {@link MemoriaException} carrying the error
     */
    public T orThrow() {
        if (error != null) {
            throw new MemoriaException(error);
        }
        return data;
    }
}
