package com.phonepe.memoria.core.pipeline.steps.memorize;

import com.phonepe.memoria.core.model.Modality;
import com.phonepe.memoria.core.pipeline.BaseStep;
import com.phonepe.memoria.core.pipeline.PipelineState;
import com.phonepe.memoria.core.pipeline.StepContext;
import com.phonepe.memoria.core.pipeline.StepRole;
import com.phonepe.memoria.core.pipeline.steps.StateKeys;
import com.phonepe.memoria.core.runlog.StepStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;

/**
 * Modality specific enrichment: segments for text, a caption for images and a transcript for audio and video
 */
@Slf4j
public class PreprocessStep extends BaseStep {
    public static final String ID = "preprocess";

    public PreprocessStep() {
        super(ID,
              StepRole.PREPROCESSING,
              Set.of(StateKeys.RESOURCE, StateKeys.DEDUPLICATED),
              Set.of(StateKeys.RESOURCE));
    }

    @Override
    public StepStatus execute(StepContext context, PipelineState state) {
        if (state.getOrDefault(StateKeys.DEDUPLICATED, false)) {
            return StepStatus.SKIPPED;
        }
        final var resource = state.require(StateKeys.RESOURCE);
        final var modality = resource.getModality();
        if (modality.isTextual()) {
            final var segments = Segmenter.segment(modality, resource.getContent());
            log.debug("Resource {} split into {} segments", resource.getId(), segments.size());
            state.put(StateKeys.RESOURCE, resource.withSegments(segments));
            return StepStatus.COMPLETED;
        }
        final var bytes = state.get(StateKeys.RESOURCE_BYTES).orElse(null);
        final var description = context.calls()
                .capability("describe",
                            () -> context.services().getExtraction().describe(modality, resource.getUri(), bytes));
        final var enriched = modality == Modality.IMAGE
                             ? resource.withCaption(description)
                             : resource.withTranscript(description);
        state.put(StateKeys.RESOURCE,
                  enriched.withSegments(Segmenter.segment(Modality.DOCUMENT, description)));
        return StepStatus.COMPLETED;
    }
}
