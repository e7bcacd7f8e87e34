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
import com.phonepe.memoria.core.scope.Scope;
import com.phonepe.memoria.core.scope.ScopeSelector;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RetrievalPolicyEngineTest {
    private final RetrievalPolicyEngine engine = new RetrievalPolicyEngine(PolicyConfig.builder()
                                                                                   .maxScopeCombinations(8)
                                                                                   .maxVectorScopeCombinations(4)
                                                                                   .maxCandidates(50)
                                                                                   .maxRerankCandidates(10)
                                                                                   .build());

    @Test
    void testSingleScopeNeedsNoPolicing() {
        final var decision = engine.evaluate(ScopeSelector.exact(Scope.of("project", "p1", "agent", "a1")), true);
        assertFalse(decision.isCrossScope());
        assertTrue(decision.isVectorSearchAllowed());
        assertFalse(decision.isCategoryOnly());
        assertFalse(decision.isCapped());
        assertEquals(PolicyDecision.UNCAPPED, decision.getCandidateCap());
        assertEquals(PolicyDecision.UNCAPPED, decision.getRerankCap());
    }

    @Test
    void testSmallSetKeepsVectorSearch() {
        final var decision = engine.evaluate(ScopeSelector.builder()
                                                     .anyOf("project", "p1", "p2")
                                                     .anyOf("agent", "a1", "a2")
                                                     .build(), true);
        assertTrue(decision.isCrossScope());
        assertEquals(4, decision.getScopeCombinations());
        assertTrue(decision.isVectorSearchAllowed());
        assertFalse(decision.isCategoryOnly());
        assertTrue(decision.isCapped());
        assertEquals(50, decision.getCandidateCap());
        assertEquals(10, decision.getRerankCap());
    }

    @Test
    void testWideSetFallsBackToCategories() {
        final var decision = engine.evaluate(ScopeSelector.builder()
                                                     .anyOf("project", "p1", "p2", "p3")
                                                     .anyOf("agent", "a1", "a2")
                                                     .build(), true);
        assertEquals(6, decision.getScopeCombinations());
        assertFalse(decision.isVectorSearchAllowed());
        assertTrue(decision.isCategoryOnly());
        assertNotNull(decision.getVectorDisabledReason());
    }

    @Test
    void testWildcardDisablesVectorSearch() {
        final var decision = engine.evaluate(ScopeSelector.builder()
                                                     .exact("project", "p1")
                                                     .wildcard("agent")
                                                     .build(), true);
        assertEquals(1, decision.getScopeCombinations());
        assertFalse(decision.isVectorSearchAllowed());
        assertEquals("wildcard scope field", decision.getVectorDisabledReason());
    }

    @Test
    void testMissingVectorCapability() {
        final var decision = engine.evaluate(ScopeSelector.exact(Scope.of("project", "p1")), false);
        assertFalse(decision.isVectorSearchAllowed());
        assertEquals("no vector capability", decision.getVectorDisabledReason());
    }

    @Test
    void testUnboundedSelectorsAreRejected() {
        final var allWildcard = ScopeSelector.builder().wildcard("project").wildcard("agent").build();
        assertEquals(ErrorType.POLICY_VIOLATION,
                     assertThrows(MemoriaException.class, () -> engine.evaluate(allWildcard, true)).getErrorType());
        final var tooMany = ScopeSelector.builder()
                .anyOf("project", "p1", "p2", "p3")
                .anyOf("agent", "a1", "a2", "a3")
                .build();
        assertEquals(ErrorType.POLICY_VIOLATION,
                     assertThrows(MemoriaException.class, () -> engine.evaluate(tooMany, true)).getErrorType());
    }
}
