package com.phonepe.memoria.core.pipeline.steps.retrieve;

import com.google.common.base.Strings;
import com.phonepe.memoria.core.capability.CapabilityResponse;
import com.phonepe.memoria.core.pipeline.PipelineState;
import com.phonepe.memoria.core.pipeline.StepContext;
import com.phonepe.memoria.core.pipeline.steps.StateKeys;
import com.phonepe.memoria.core.policy.PolicyDecision;
import com.phonepe.memoria.core.policy.RetrievalPolicyEngine;
import com.phonepe.memoria.core.scope.Scope;
import lombok.experimental.UtilityClass;

/**
 * Helpers shared by the retrieve steps
 */
@UtilityClass
public class RetrieveSupport {

    /**
     * Decision taken by the facade before the run started. Evaluated here only for runs started without one.
     */
    public static PolicyDecision policy(StepContext context) {
        final var decision = context.getRun().getPolicy();
        if (decision != null) {
            return decision;
        }
        return new RetrievalPolicyEngine(context.config().getPolicy())
                .evaluate(context.selector(), context.services().vectorSearchAvailable());
    }

    /**
     * Query for the deeper layers: the rewritten one if a sufficiency check produced it
     */
    public static String effectiveQuery(PipelineState state) {
        final var rewritten = state.get(StateKeys.PROGRESS)
                .map(RetrievalProgress::getRewrittenQuery)
                .orElse(null);
        return Strings.isNullOrEmpty(rewritten) ? state.require(StateKeys.RETRIEVE_REQUEST).getQuery() : rewritten;
    }

    public static float[] queryVector(StepContext context, String query) {
        final var embedding = context.services().getEmbedding();
        return context.calls().capability("embed query", () -> CapabilityResponse.success(embedding.embed(query)));
    }

    /**
     * Entity ids are only unique within a scope, so results spanning scopes are keyed by both
     */
    public static String entityKey(Scope scope, String id) {
        return scope.key() + "#" + id;
    }
}
