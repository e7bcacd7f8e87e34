package com.phonepe.memoria.core.pipeline;

import com.phonepe.memoria.core.model.OperationType;
import com.phonepe.memoria.core.policy.PolicyDecision;
import com.phonepe.memoria.core.scope.Scope;
import com.phonepe.memoria.core.scope.ScopeSelector;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * Identity and environment of one run
 */
@Value
@Builder
public class RunContext {
    @NonNull
    String runId;
    @NonNull
    OperationType operation;
    /**
     * The written scope. Null for reads spanning several scopes.
     */
    Scope scope;
    /**
     * What a read may see. For single scope operations this is the exact selector of {@link #scope}.
     */
    @NonNull
    ScopeSelector selector;
    @NonNull
    MemoriaServices services;
    @NonNull
    CancellationSignal cancellation;
    PolicyDecision policy;
    Instant startedAt;

    public String scopeDescription() {
        return scope != null ? scope.key() : selector.toString();
    }
}
