package com.phonepe.memoria.core.pipeline.steps.retrieve;

import com.google.common.base.Strings;
import com.phonepe.memoria.core.model.Scored;
import com.phonepe.memoria.core.pipeline.BaseStep;
import com.phonepe.memoria.core.pipeline.PipelineState;
import com.phonepe.memoria.core.pipeline.StepContext;
import com.phonepe.memoria.core.pipeline.StateKey;
import com.phonepe.memoria.core.pipeline.StepRole;
import com.phonepe.memoria.core.pipeline.steps.IntentionSupport;
import com.phonepe.memoria.core.pipeline.steps.StateKeys;
import com.phonepe.memoria.core.runlog.StepStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Asks the extraction capability whether the context gathered so far answers the query. A positive answer stops
 * the descent into deeper layers.
 */
@Slf4j
public class SufficiencyCheckStep extends BaseStep {
    public static final String AFTER_INTENTION_ID = "sufficiency_after_intention";
    public static final String AFTER_CATEGORY_ID = "sufficiency_after_category";
    public static final String AFTER_ITEMS_ID = "sufficiency_after_items";

    /**
     * Layer the check follows
     */
    public enum Layer {
        INTENTION,
        CATEGORY,
        ITEMS
    }

    private final Layer layer;

    private SufficiencyCheckStep(String id, Layer layer, Set<StateKey<?>> requires) {
        super(id, StepRole.SUFFICIENCY, requires, Set.of(StateKeys.PROGRESS));
        this.layer = layer;
    }

    public static SufficiencyCheckStep afterIntention() {
        return new SufficiencyCheckStep(AFTER_INTENTION_ID,
                                        Layer.INTENTION,
                                        Set.of(StateKeys.RETRIEVE_REQUEST, StateKeys.PROGRESS, StateKeys.INTENTIONS));
    }

    public static SufficiencyCheckStep afterCategory() {
        return new SufficiencyCheckStep(AFTER_CATEGORY_ID,
                                        Layer.CATEGORY,
                                        Set.of(StateKeys.RETRIEVE_REQUEST, StateKeys.PROGRESS,
                                               StateKeys.INTENTIONS, StateKeys.ROUTED_CATEGORIES));
    }

    public static SufficiencyCheckStep afterItems() {
        return new SufficiencyCheckStep(AFTER_ITEMS_ID,
                                        Layer.ITEMS,
                                        Set.of(StateKeys.RETRIEVE_REQUEST, StateKeys.PROGRESS,
                                               StateKeys.RECALLED_ITEMS));
    }

    @Override
    public StepStatus execute(StepContext context, PipelineState state) {
        final var request = state.require(StateKeys.RETRIEVE_REQUEST);
        final var progress = state.require(StateKeys.PROGRESS);
        if (!request.isSufficiencyCheck()
                || (layer == Layer.INTENTION && !progress.isProceedToCategories())
                || (layer == Layer.CATEGORY && !progress.isProceedToItems())
                || (layer == Layer.ITEMS && !progress.isProceedToResources())) {
            return StepStatus.SKIPPED;
        }
        final var gathered = gathered(state);
        if (gathered.isEmpty()) {
            return StepStatus.SKIPPED;
        }
        final var verdict = context.calls()
                .capability("check sufficiency",
                            () -> context.services().getExtraction().checkSufficiency(request.getQuery(), gathered));
        var next = progress.withNextStepQuery(verdict.getNextStepQuery());
        if (!Strings.isNullOrEmpty(verdict.getRewrittenQuery())) {
            next = next.withRewrittenQuery(verdict.getRewrittenQuery());
        }
        if (verdict.isSufficient()) {
            log.debug("Context sufficient after {} layer, not descending further", layer);
            next = switch (layer) {
                case INTENTION -> next.withProceedToCategories(false)
                        .withProceedToItems(false)
                        .withProceedToResources(false);
                case CATEGORY -> next.withProceedToItems(false).withProceedToResources(false);
                case ITEMS -> next.withProceedToResources(false);
            };
        }
        state.put(StateKeys.PROGRESS, next);
        return StepStatus.COMPLETED;
    }

    private List<String> gathered(PipelineState state) {
        final var texts = new ArrayList<String>();
        state.getOrDefault(StateKeys.INTENTIONS, List.of())
                .stream()
                .map(IntentionSupport::intentionText)
                .filter(text -> !text.isBlank())
                .forEach(texts::add);
        if (layer == Layer.INTENTION) {
            return texts;
        }
        state.getOrDefault(StateKeys.ROUTED_CATEGORIES, List.of())
                .stream()
                .map(Scored::getValue)
                .map(category -> Strings.nullToEmpty(category.getSummary()))
                .filter(text -> !text.isBlank())
                .forEach(texts::add);
        if (layer == Layer.ITEMS) {
            state.getOrDefault(StateKeys.RECALLED_ITEMS, List.of())
                    .stream()
                    .map(scored -> scored.getValue().getContent())
                    .forEach(texts::add);
        }
        return texts;
    }
}
