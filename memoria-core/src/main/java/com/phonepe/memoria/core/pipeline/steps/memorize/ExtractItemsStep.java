package com.phonepe.memoria.core.pipeline.steps.memorize;

import com.google.common.base.Strings;
import com.phonepe.memoria.core.capability.ExtractedFact;
import com.phonepe.memoria.core.capability.ExtractionRequest;
import com.phonepe.memoria.core.model.EvidencePointer;
import com.phonepe.memoria.core.model.MemoryItem;
import com.phonepe.memoria.core.model.MemoryType;
import com.phonepe.memoria.core.model.Resource;
import com.phonepe.memoria.core.pipeline.BaseStep;
import com.phonepe.memoria.core.pipeline.PipelineState;
import com.phonepe.memoria.core.pipeline.StepContext;
import com.phonepe.memoria.core.pipeline.StepRole;
import com.phonepe.memoria.core.pipeline.steps.ItemCandidate;
import com.phonepe.memoria.core.pipeline.steps.StateKeys;
import com.phonepe.memoria.core.pipeline.steps.TaxonomySupport;
import com.phonepe.memoria.core.runlog.StepStatus;
import com.phonepe.memoria.core.scope.ScopeSelector;
import com.phonepe.memoria.core.service.MemorizeOptions;
import com.phonepe.memoria.core.utils.TextUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Asks the extraction capability for candidate facts and turns them into first version items. Candidates with the
 * same content are collapsed, keeping the most confident one.
 * <p>
 * Config: <code>maxFacts</code> overrides the configured limit.
 */
@Slf4j
public class ExtractItemsStep extends BaseStep {
    public static final String ID = "extract_items";
    public static final String MAX_FACTS = "maxFacts";

    public ExtractItemsStep() {
        super(ID,
              StepRole.EXTRACTION,
              Set.of(StateKeys.RESOURCE, StateKeys.DEDUPLICATED, StateKeys.MEMORIZE_OPTIONS),
              Set.of(StateKeys.CANDIDATES));
    }

    @Override
    public Set<String> options() {
        return Set.of(MAX_FACTS);
    }

    @Override
    public StepStatus execute(StepContext context, PipelineState state) {
        if (state.getOrDefault(StateKeys.DEDUPLICATED, false)) {
            state.put(StateKeys.CANDIDATES, List.of());
            return StepStatus.SKIPPED;
        }
        final var resource = state.require(StateKeys.RESOURCE);
        final var options = state.getOrDefault(StateKeys.MEMORIZE_OPTIONS, MemorizeOptions.DEFAULT);
        final var taxonomy = context.config().getTaxonomy();
        final var scope = context.scope();
        final var existingCategories = context.calls()
                .store("list categories",
                       () -> context.services().getMetadataStore().listCategories(ScopeSelector.exact(scope)));
        final var memoryTypes = options.getMemoryTypes().isEmpty()
                                ? EnumSet.allOf(MemoryType.class)
                                : EnumSet.copyOf(options.getMemoryTypes());
        final var maxFacts = context.option(MAX_FACTS,
                                             options.getMaxFacts() > 0
                                             ? options.getMaxFacts()
                                             : taxonomy.getMaxFactsPerResource());
        final var request = ExtractionRequest.builder()
                .modality(resource.getModality())
                .segments(resource.getSegments())
                .memoryTypes(memoryTypes)
                .knownCategories(TaxonomySupport.knownNames(taxonomy, existingCategories))
                .maxFacts(maxFacts)
                .build();
        final var facts = context.calls()
                .capability("extract", () -> context.services().getExtraction().extract(request));

        final var now = context.services().getClock().instant();
        final var byHash = new LinkedHashMap<String, ItemCandidate>();
        for (var fact : facts) {
            if (fact == null
                    || Strings.isNullOrEmpty(fact.getContent())
                    || fact.getMemoryType() == null
                    || !memoryTypes.contains(fact.getMemoryType())) {
                continue;
            }
            final var candidate = toCandidate(resource, fact, now);
            byHash.merge(candidate.getItem().getContentHash(), candidate,
                         (lhs, rhs) -> rhs.getItem().getConfidence() > lhs.getItem().getConfidence() ? rhs : lhs);
            if (byHash.size() >= maxFacts) {
                break;
            }
        }
        log.info("Extracted {} candidate items from resource {} ({} facts returned)",
                 byHash.size(), resource.getId(), facts.size());
        state.put(StateKeys.CANDIDATES, List.copyOf(byHash.values()));
        return StepStatus.COMPLETED;
    }

    private static ItemCandidate toCandidate(Resource resource, ExtractedFact fact, Instant now) {
        final var id = UUID.randomUUID().toString();
        final var content = fact.getContent().strip();
        final var segments = resource.getSegments();
        final var segment = fact.getSegmentIndex() >= 0 && segments != null && fact.getSegmentIndex() < segments.size()
                            ? segments.get(fact.getSegmentIndex())
                            : null;
        final var item = MemoryItem.builder()
                .id(id)
                .lineageId(id)
                .scope(resource.getScope())
                .resourceId(resource.getId())
                .memoryType(fact.getMemoryType())
                .key(Strings.emptyToNull(fact.getKey()))
                .content(content)
                .contentHash(TextUtils.itemContentHash(fact.getMemoryType(), content))
                .evidence(EvidencePointer.builder()
                                  .resourceId(resource.getId())
                                  .segmentIndex(fact.getSegmentIndex())
                                  .offset(fact.getOffset())
                                  .length(fact.getLength())
                                  .page(segment != null ? segment.getPage() : null)
                                  .build())
                .confidence(Math.max(0.0, Math.min(1.0, fact.getConfidence())))
                .stable(fact.isStable())
                .version(1)
                .reinforcementCount(0)
                .createdAt(now)
                .updatedAt(now)
                .build();
        return ItemCandidate.builder()
                .item(item)
                .categories(fact.getCategories()
                                    .stream()
                                    .map(TaxonomySupport::normalizeName)
                                    .filter(name -> !name.isEmpty())
                                    .distinct()
                                    .toList())
                .build();
    }
}
