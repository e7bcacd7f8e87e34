package com.phonepe.memoria.core.service;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaError;
import lombok.Value;

/**
 * Result of a facade call: data, or an error carrying run, step and scope context
 */
@Value
public class OperationOutput<T> {
    T data;
    MemoriaError error;
    /**
     * Run that produced this output. Null for calls that do not run a pipeline.
     */
    String runId;

    public static <T> OperationOutput<T> success(T data, String runId) {
        return new OperationOutput<>(data, MemoriaError.success(), runId);
    }

    public static <T> OperationOutput<T> error(MemoriaError error, String runId) {
        return new OperationOutput<>(null, error, runId);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return error == null || error.getErrorType() == ErrorType.SUCCESS;
    }
}
