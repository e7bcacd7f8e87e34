package com.phonepe.memoria.core.errors;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Classified error kinds surfaced by the engine. The retryable flag drives the runner retry policies.
 */
@Getter
@AllArgsConstructor
public enum ErrorType {
    SUCCESS("Success", false),
    SCOPE_SCHEMA_MISMATCH("Scope does not match provisioned schema: %s", false),
    POLICY_VIOLATION("Cross scope request rejected: %s", false),
    CAPABILITY_UNAVAILABLE("Required capability is not available: %s", false),
    VALIDATION_ERROR("Pipeline validation failed: %s", false),
    TRANSIENT_STORE_ERROR("Transient store failure: %s", true),
    TRANSIENT_CAPABILITY_ERROR("Transient capability failure: %s", true),
    CAPABILITY_FAILURE("Capability call failed: %s", false),
    STORE_FAILURE("Store operation failed: %s", false),
    INVALID_INPUT("Invalid input: %s", false),
    NOT_FOUND("Not found: %s", false),
    CONCURRENT_MODIFICATION("Scope changed while the run was in progress: %s", false),
    CANCELLED("Run cancelled before step %s", false),
    INTERNAL_ERROR("Internal error: %s", false)
    ;

    private final String message;
    private final boolean retryable;
}
