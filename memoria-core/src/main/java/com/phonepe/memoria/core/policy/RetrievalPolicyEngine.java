/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.memoria.core.policy;

import com.phonepe.memoria.core.config.PolicyConfig;
import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;
import com.phonepe.memoria.core.scope.ScopeSelector;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounds cross scope retrieval. Works only on the selector and the configuration, so it can run before anything
 * touches a store.
 */
@Slf4j
public class RetrievalPolicyEngine {
    private final PolicyConfig config;

    public RetrievalPolicyEngine(@NonNull PolicyConfig config) {
        this.config = config;
    }

    /**
     * A single exact scope passes without caps. Its recall is bounded by the live contents of the scope and the
     * retrieve limits.
     *
     * @param selector        Validated selector
     * @param vectorAvailable Whether the deployment has both a vector index and an embedding capability
     * @throws MemoriaException with {@link ErrorType#POLICY_VIOLATION} if the selector is not allowed
     */
    public PolicyDecision evaluate(@NonNull ScopeSelector selector, boolean vectorAvailable) {
        if (selector.isSingleExact()) {
            return PolicyDecision.builder()
                    .crossScope(false)
                    .scopeCombinations(1)
                    .vectorSearchAllowed(vectorAvailable)
                    .vectorDisabledReason(vectorAvailable ? null : "no vector capability")
                    .categoryOnly(false)
                    .candidateCap(PolicyDecision.UNCAPPED)
                    .rerankCap(PolicyDecision.UNCAPPED)
                    .build();
        }
        if (selector.isAllWildcard()) {
            log.warn("Rejected selector {}: every field is a wildcard", selector);
            throw MemoriaException.of(ErrorType.POLICY_VIOLATION,
                                      "at least one scope field must be exact or a finite set in " + selector);
        }
        final var combinations = selector.combinationCount();
        if (combinations > config.getMaxScopeCombinations()) {
            log.warn("Rejected selector {}: {} combinations above limit {}",
                     selector, combinations, config.getMaxScopeCombinations());
            throw MemoriaException.of(ErrorType.POLICY_VIOLATION,
                                      "selector %s expands to %d scopes, limit is %d"
                                              .formatted(selector, combinations, config.getMaxScopeCombinations()));
        }
        final var disabledReason = vectorDisabledReason(selector, combinations, vectorAvailable);
        final var decision = PolicyDecision.builder()
                .crossScope(true)
                .scopeCombinations(combinations)
                .vectorSearchAllowed(disabledReason == null)
                .vectorDisabledReason(disabledReason)
                .categoryOnly(disabledReason != null)
                .candidateCap(config.getMaxCandidates())
                .rerankCap(config.getMaxRerankCandidates())
                .build();
        log.debug("Cross scope selector {} allowed: {}", selector, decision);
        return decision;
    }

    private String vectorDisabledReason(ScopeSelector selector, long combinations, boolean vectorAvailable) {
        if (!vectorAvailable) {
            return "no vector capability";
        }
        if (selector.hasWildcard()) {
            return "wildcard scope field";
        }
        if (combinations > config.getMaxVectorScopeCombinations()) {
            return "selector expands to %d scopes, vector limit is %d"
                    .formatted(combinations, config.getMaxVectorScopeCombinations());
        }
        return null;
    }
}
