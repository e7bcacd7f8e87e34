package com.phonepe.memoria.core.pipeline.steps.retrieve;

import com.phonepe.memoria.core.pipeline.BaseStep;
import com.phonepe.memoria.core.pipeline.PipelineState;
import com.phonepe.memoria.core.pipeline.StepContext;
import com.phonepe.memoria.core.pipeline.StepRole;
import com.phonepe.memoria.core.pipeline.steps.StateKeys;
import com.phonepe.memoria.core.runlog.StepStatus;

import java.util.Set;

/**
 * Loads the intentions of every scope the selector addresses
 */
public class RouteIntentionStep extends BaseStep {
    public static final String ID = "route_intention";

    public RouteIntentionStep() {
        super(ID,
              StepRole.ROUTING,
              Set.of(StateKeys.RETRIEVE_REQUEST),
              Set.of(StateKeys.INTENTIONS));
    }

    @Override
    public StepStatus execute(StepContext context, PipelineState state) {
        final var selector = context.selector();
        final var intentions = context.calls()
                .store("list intentions", () -> context.services().getMetadataStore().listIntentions(selector))
                .stream()
                .filter(intention -> selector.matches(intention.getScope()))
                .toList();
        state.put(StateKeys.INTENTIONS, intentions);
        return StepStatus.COMPLETED;
    }
}
