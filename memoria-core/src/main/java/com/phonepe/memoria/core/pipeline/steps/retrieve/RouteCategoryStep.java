package com.phonepe.memoria.core.pipeline.steps.retrieve;

import com.phonepe.memoria.core.config.RecallMethod;
import com.phonepe.memoria.core.model.EntityType;
import com.phonepe.memoria.core.model.MemoryCategory;
import com.phonepe.memoria.core.model.Scored;
import com.phonepe.memoria.core.pipeline.BaseStep;
import com.phonepe.memoria.core.pipeline.PipelineState;
import com.phonepe.memoria.core.pipeline.StepContext;
import com.phonepe.memoria.core.pipeline.StepRole;
import com.phonepe.memoria.core.pipeline.steps.StateKeys;
import com.phonepe.memoria.core.pipeline.steps.TaxonomySupport;
import com.phonepe.memoria.core.runlog.StepStatus;
import com.phonepe.memoria.core.utils.LexicalScorer;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * Picks the categories most relevant to the query. Uses category embeddings when the policy allows vector search,
 * otherwise BM25 over name, description and summary. Does nothing when the intention layer already answered the
 * query.
 * <p>
 * Config: <code>categoryTopK</code>
 */
@Slf4j
public class RouteCategoryStep extends BaseStep {
    public static final String ID = "route_category";
    public static final String CATEGORY_TOP_K = "categoryTopK";

    public RouteCategoryStep() {
        super(ID,
              StepRole.ROUTING,
              Set.of(StateKeys.RETRIEVE_REQUEST, StateKeys.PROGRESS),
              Set.of(StateKeys.ROUTED_CATEGORIES, StateKeys.CATEGORIES_BY_VECTOR));
    }

    @Override
    public Set<String> options() {
        return Set.of(CATEGORY_TOP_K);
    }

    @Override
    public StepStatus execute(StepContext context, PipelineState state) {
        final var request = state.require(StateKeys.RETRIEVE_REQUEST);
        state.put(StateKeys.CATEGORIES_BY_VECTOR, false);
        if (!state.require(StateKeys.PROGRESS).isProceedToCategories()) {
            state.put(StateKeys.ROUTED_CATEGORIES, List.of());
            return StepStatus.SKIPPED;
        }
        final var selector = context.selector();
        final var policy = RetrieveSupport.policy(context);
        final var categories = new LinkedHashMap<String, MemoryCategory>();
        context.calls()
                .store("list categories", () -> context.services().getMetadataStore().listCategories(selector))
                .stream()
                .filter(category -> selector.matches(category.getScope()))
                .forEach(category -> categories.put(RetrieveSupport.entityKey(category.getScope(), category.getId()),
                                                    category));
        if (categories.isEmpty()) {
            state.put(StateKeys.ROUTED_CATEGORIES, List.of());
            return StepStatus.COMPLETED;
        }
        final var topK = Math.max(1, context.option(CATEGORY_TOP_K, request.getCategoryTopK()));
        final List<Scored<MemoryCategory>> routed;
        if (policy.isVectorSearchAllowed() && request.getMethod() != RecallMethod.LEXICAL) {
            final var vector = RetrieveSupport.queryVector(context, request.getQuery());
            final var k = Math.min(policy.getCandidateCap(), Math.max(topK, categories.size()));
            routed = context.calls()
                    .store("query category vectors",
                           () -> context.services().getVectorIndex().query(selector, EntityType.CATEGORY, vector, k))
                    .stream()
                    .filter(hit -> categories.containsKey(RetrieveSupport.entityKey(hit.getScope(),
                                                                                    hit.getEntityId())))
                    .limit(topK)
                    .map(hit -> Scored.of(categories.get(RetrieveSupport.entityKey(hit.getScope(),
                                                                                   hit.getEntityId())),
                                          hit.getScore()))
                    .toList();
            state.put(StateKeys.CATEGORIES_BY_VECTOR, true);
        }
        else {
            final var documents = new LinkedHashMap<String, String>();
            categories.forEach((key, category) -> documents.put(key, TaxonomySupport.categoryText(category)));
            routed = LexicalScorer.bm25(request.getQuery(), documents, topK)
                    .stream()
                    .map(hit -> Scored.of(categories.get(hit.id()), hit.score()))
                    .toList();
        }
        log.debug("Routed query to {} of {} categories", routed.size(), categories.size());
        state.put(StateKeys.ROUTED_CATEGORIES, routed);
        return StepStatus.COMPLETED;
    }
}
