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

package com.phonepe.memoria.core.pipeline.steps.evolve;

import com.phonepe.memoria.core.model.EvolutionDiff;
import com.phonepe.memoria.core.model.Intention;
import com.phonepe.memoria.core.model.MemoryCategory;
import com.phonepe.memoria.core.pipeline.BaseStep;
import com.phonepe.memoria.core.pipeline.PipelineState;
import com.phonepe.memoria.core.pipeline.StepContext;
import com.phonepe.memoria.core.pipeline.StepRole;
import com.phonepe.memoria.core.pipeline.steps.StateKeys;
import com.phonepe.memoria.core.runlog.StepStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reports what the committed evolve run changed. A run that created or removed categories moves the taxonomy
 * version forward.
 */
@Slf4j
public class EmitDiffStep extends BaseStep {
    public static final String ID = "emit_diff";

    public EmitDiffStep() {
        super(ID,
              StepRole.REPORTING,
              Set.of(StateKeys.EVOLVE_COMMITTED, StateKeys.ITEM_PLAN, StateKeys.CATEGORY_PLAN),
              Set.of(StateKeys.EVOLUTION_DIFF));
    }

    @Override
    public StepStatus execute(StepContext context, PipelineState state) {
        final var committed = state.require(StateKeys.EVOLVE_COMMITTED);
        final var diff = EvolutionDiff.builder();
        if (committed > 0) {
            final var itemPlan = state.require(StateKeys.ITEM_PLAN);
            final var categoryPlan = state.require(StateKeys.CATEGORY_PLAN);
            final var intention = state.get(StateKeys.INTENTION_UPDATE);
            diff.revisedItems(itemPlan.getRevisions())
                    .consolidatedItemIds(itemPlan.getConsolidatedIds())
                    .updatedCategories(categoryPlan.getUpdatedNames())
                    .createdCategories(categoryPlan.getCreatedNames())
                    .deletedCategories(categoryPlan.getDeletedCategories()
                                               .stream()
                                               .map(MemoryCategory::getName)
                                               .toList())
                    .linksAdded(categoryPlan.getAddedLinks().size())
                    .linksRemoved(categoryPlan.getRemovedLinks().size())
                    .relinkedItemIds(state.getOrDefault(StateKeys.ITEM_RELATIONS, Map.<String, List<String>>of())
                                             .keySet())
                    .intentionChanged(intention.isPresent())
                    .intentionVersion(intention.map(Intention::getVersion).orElse(0));
        }
        final var result = diff.build();
        if (!result.getCreatedCategories().isEmpty() || !result.getDeletedCategories().isEmpty()) {
            context.services().getTenancy().bumpTaxonomyVersion();
        }
        log.info("Evolution of scope {}: {}", context.scope(), result.summary());
        state.put(StateKeys.EVOLUTION_DIFF, result);
        return StepStatus.COMPLETED;
    }
}
