package com.phonepe.memoria.core.pipeline.steps.memorize;

import com.google.common.base.Strings;
import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;
import com.phonepe.memoria.core.model.Resource;
import com.phonepe.memoria.core.pipeline.BaseStep;
import com.phonepe.memoria.core.pipeline.PipelineState;
import com.phonepe.memoria.core.pipeline.StepContext;
import com.phonepe.memoria.core.pipeline.StepRole;
import com.phonepe.memoria.core.pipeline.steps.StateKeys;
import com.phonepe.memoria.core.runlog.StepStatus;
import com.phonepe.memoria.core.scope.ScopeSelector;
import com.phonepe.memoria.core.store.ResourceFilter;
import com.phonepe.memoria.core.utils.TextUtils;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Loads the resource content, hashes it and looks for an identical resource in the scope. A hit short circuits
 * the rest of the pipeline. A live resource with the same uri but other content will be superseded.
 */
@Slf4j
public class IngestResourceStep extends BaseStep {
    public static final String ID = "ingest_resource";

    public IngestResourceStep() {
        super(ID,
              StepRole.INGESTION,
              Set.of(StateKeys.RESOURCE_INPUT),
              Set.of(StateKeys.RESOURCE,
                     StateKeys.DEDUPLICATED,
                     StateKeys.SUPERSEDED_RESOURCE,
                     StateKeys.RESOURCE_BYTES));
    }

    @Override
    public StepStatus execute(StepContext context, PipelineState state) {
        final var input = state.require(StateKeys.RESOURCE_INPUT);
        if (Strings.isNullOrEmpty(input.getContent()) && Strings.isNullOrEmpty(input.getUri())) {
            throw MemoriaException.of(ErrorType.INVALID_INPUT, "resource needs inline content or a uri");
        }
        final var scope = context.scope();
        final var store = context.services().getMetadataStore();
        final var selector = ScopeSelector.exact(scope);
        final var bytes = content(context, input.getContent(), input.getUri());
        final var contentHash = TextUtils.sha256(bytes);

        final var existing = context.calls()
                .store("find resource by hash",
                       () -> store.listResources(selector, ResourceFilter.builder().contentHash(contentHash).build()));
        if (!existing.isEmpty()) {
            log.info("Resource content {} already stored in scope {} as {}",
                     contentHash, scope, existing.get(0).getId());
            state.put(StateKeys.RESOURCE, existing.get(0));
            state.put(StateKeys.DEDUPLICATED, true);
            return StepStatus.COMPLETED;
        }
        if (!Strings.isNullOrEmpty(input.getUri())) {
            context.calls()
                    .store("find resource by uri",
                           () -> store.listResources(selector, ResourceFilter.builder().uri(input.getUri()).build()))
                    .stream()
                    .findFirst()
                    .ifPresent(previous -> {
                        log.info("Resource {} changed, superseding {}", input.getUri(), previous.getId());
                        state.put(StateKeys.SUPERSEDED_RESOURCE, previous);
                    });
        }
        final var modality = input.getModality();
        final var now = context.services().getClock().instant();
        final var resource = Resource.builder()
                .id(UUID.randomUUID().toString())
                .scope(scope)
                .uri(input.getUri())
                .modality(modality)
                .content(modality.isTextual() ? new String(bytes, StandardCharsets.UTF_8) : null)
                .contentHash(contentHash)
                .segments(List.of())
                .createdAt(now)
                .updatedAt(now)
                .build();
        if (!modality.isTextual()) {
            state.put(StateKeys.RESOURCE_BYTES, bytes);
        }
        state.put(StateKeys.RESOURCE, resource);
        state.put(StateKeys.DEDUPLICATED, false);
        return StepStatus.COMPLETED;
    }

    private static byte[] content(StepContext context, String inline, String uri) {
        if (!Strings.isNullOrEmpty(inline)) {
            return inline.getBytes(StandardCharsets.UTF_8);
        }
        final var blobStore = context.services().getBlobStore();
        if (blobStore == null) {
            throw MemoriaException.of(ErrorType.CAPABILITY_UNAVAILABLE, "no blob store to read " + uri);
        }
        return context.calls().store("read blob", () -> blobStore.read(uri));
    }
}
