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

package com.phonepe.memoria.core.capability.heuristic;

import com.phonepe.memoria.core.capability.ExtractionRequest;
import com.phonepe.memoria.core.capability.SummaryRequest;
import com.phonepe.memoria.core.model.MemoryType;
import com.phonepe.memoria.core.model.Modality;
import com.phonepe.memoria.core.pipeline.steps.memorize.Segmenter;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class HeuristicExtractionCapabilityTest {
    private final HeuristicExtractionCapability capability = new HeuristicExtractionCapability();

    @Test
    void testFactsFromConversation() {
        final var text = """
                user: My favorite color is blue. I live in Pune.
                assistant: Noted, I like blue too.
                user: I want to learn the violin
                """;
        final var facts = capability.extract(ExtractionRequest.builder()
                                                     .modality(Modality.CONVERSATION)
                                                     .segments(Segmenter.segment(Modality.CONVERSATION, text))
                                                     .knownCategories(List.of("preferences"))
                                                     .build())
                .orThrow();
        assertEquals(3, facts.size());
        final var color = facts.get(0);
        assertEquals(MemoryType.PROFILE, color.getMemoryType());
        assertEquals("FavoriteColor", color.getKey());
        assertEquals("My favorite color is blue", color.getContent());
        assertEquals(text.indexOf("My favorite"), color.getOffset());
        assertEquals("Location", facts.get(1).getKey());
        assertEquals(MemoryType.GOAL, facts.get(2).getMemoryType());
    }

    @Test
    void testTypeFilterAndLimit() {
        final var segments = Segmenter.segment(Modality.CONVERSATION,
                                               "My favorite color is blue. I want to learn the violin.");
        final var goals = capability.extract(ExtractionRequest.builder()
                                                     .modality(Modality.CONVERSATION)
                                                     .segments(segments)
                                                     .memoryTypes(Set.of(MemoryType.GOAL))
                                                     .build())
                .orThrow();
        assertEquals(1, goals.size());
        final var limited = capability.extract(ExtractionRequest.builder()
                                                       .modality(Modality.CONVERSATION)
                                                       .segments(segments)
                                                       .maxFacts(1)
                                                       .build())
                .orThrow();
        assertEquals(1, limited.size());
    }

    @Test
    void testSufficiencyNeedsEveryQueryTerm() {
        final var partial = capability.checkSufficiency("what color do they like",
                                                        List.of("My favorite color is blue."))
                .orThrow();
        assertFalse(partial.isSufficient());
        assertEquals("like", partial.getNextStepQuery());
        assertTrue(capability.checkSufficiency("favorite color", List.of("My favorite color is blue."))
                           .orThrow()
                           .isSufficient());
        assertFalse(capability.checkSufficiency("favorite color", List.of()).orThrow().isSufficient());
    }

    @Test
    void testRankAndSummarize() {
        final var ranked = capability.rank("favorite color",
                                           Map.of("a", "I have a dog", "b", "My favorite color is blue"))
                .orThrow();
        assertEquals("b", ranked.get(0).getValue());
        final var summary = capability.summarize(SummaryRequest.builder()
                                                         .categoryName("preferences")
                                                         .previousSummary("My favorite color is blue.")
                                                         .contents(List.of("My favorite color is blue",
                                                                           "I like jazz"))
                                                         .targetLength(400)
                                                         .build())
                .orThrow();
        assertEquals("My favorite color is blue. I like jazz.", summary);
    }
}
