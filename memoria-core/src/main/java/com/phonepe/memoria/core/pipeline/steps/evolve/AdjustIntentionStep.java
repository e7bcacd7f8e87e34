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

import com.phonepe.memoria.core.pipeline.BaseStep;
import com.phonepe.memoria.core.pipeline.PipelineState;
import com.phonepe.memoria.core.pipeline.StepContext;
import com.phonepe.memoria.core.pipeline.StepRole;
import com.phonepe.memoria.core.pipeline.steps.IntentionSupport;
import com.phonepe.memoria.core.pipeline.steps.StateKeys;
import com.phonepe.memoria.core.runlog.StepStatus;

import java.util.Set;

/**
 * Derives the intention again from the goal items that stay live after the plan
 */
public class AdjustIntentionStep extends BaseStep {
    public static final String ID = "adjust_intention";

    public AdjustIntentionStep() {
        super(ID,
              StepRole.PLANNING,
              Set.of(StateKeys.EVOLVE_TARGETS, StateKeys.ITEM_PLAN),
              Set.of(StateKeys.INTENTION_UPDATE));
    }

    @Override
    public StepStatus execute(StepContext context, PipelineState state) {
        final var targets = state.require(StateKeys.EVOLVE_TARGETS);
        final var live = EvolveSupport.liveAfter(targets, state.require(StateKeys.ITEM_PLAN));
        final var update = IntentionSupport.derive(context.scope(),
                                                   live.values(),
                                                   targets.getIntention(),
                                                   context.services().getClock().instant());
        update.ifPresent(intention -> state.put(StateKeys.INTENTION_UPDATE, intention));
        return update.isPresent() ? StepStatus.COMPLETED : StepStatus.SKIPPED;
    }
}
