package com.phonepe.memoria.core.pipeline.steps.retrieve;

import com.phonepe.memoria.core.config.RecallMethod;
import com.phonepe.memoria.core.model.EntityType;
import com.phonepe.memoria.core.model.MemoryItem;
import com.phonepe.memoria.core.model.Scored;
import com.phonepe.memoria.core.pipeline.BaseStep;
import com.phonepe.memoria.core.pipeline.PipelineState;
import com.phonepe.memoria.core.pipeline.StepContext;
import com.phonepe.memoria.core.pipeline.StepRole;
import com.phonepe.memoria.core.pipeline.steps.StateKeys;
import com.phonepe.memoria.core.policy.PolicyDecision;
import com.phonepe.memoria.core.runlog.StepStatus;
import com.phonepe.memoria.core.scope.Scope;
import com.phonepe.memoria.core.scope.ScopeSelector;
import com.phonepe.memoria.core.store.ItemFilter;
import com.phonepe.memoria.core.utils.LexicalScorer;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Recalls candidate items by vector similarity, BM25 or both fused by reciprocal rank. The candidate pool always
 * comes from the metadata store, so vector hits on superseded or foreign rows are dropped. When the policy limits
 * recall to categories the pool is the items linked to the routed categories.
 * <p>
 * Config: <code>topK</code> lowers the number of recalled items, <code>method</code> replaces the recall method.
 */
@Slf4j
public class RecallItemsStep extends BaseStep {
    public static final String ID = "recall_items";
    public static final String TOP_K = "topK";
    public static final String METHOD = "method";

    public RecallItemsStep() {
        super(ID,
              StepRole.RECALL,
              Set.of(StateKeys.RETRIEVE_REQUEST, StateKeys.PROGRESS, StateKeys.ROUTED_CATEGORIES),
              Set.of(StateKeys.RECALLED_ITEMS, StateKeys.VECTOR_SEARCH_USED));
    }

    @Override
    public Set<String> options() {
        return Set.of(TOP_K, METHOD);
    }

    @Override
    public StepStatus execute(StepContext context, PipelineState state) {
        final var request = state.require(StateKeys.RETRIEVE_REQUEST);
        state.put(StateKeys.VECTOR_SEARCH_USED, false);
        if (!state.require(StateKeys.PROGRESS).isProceedToItems()) {
            state.put(StateKeys.RECALLED_ITEMS, List.of());
            return StepStatus.SKIPPED;
        }
        final var policy = RetrieveSupport.policy(context);
        final var filter = ItemFilter.builder().memoryTypes(request.getMemoryTypes()).build();
        final var pool = policy.isCategoryOnly()
                         ? categoryPool(context, state, filter)
                         : scopePool(context, filter);
        if (pool.isEmpty()) {
            state.put(StateKeys.RECALLED_ITEMS, List.of());
            return StepStatus.COMPLETED;
        }
        final var query = RetrieveSupport.effectiveQuery(state);
        final int topK = context.option(TOP_K, policy.getCandidateCap());
        final var cap = Math.max(1, Math.min(pool.size(), Math.min(policy.getCandidateCap(), topK)));
        final var method = context.option(METHOD, request.getMethod());
        final var useVector = method != RecallMethod.LEXICAL && vectorUsable(policy);
        final var useLexical = method != RecallMethod.VECTOR || !useVector;
        final var lexical = useLexical
                            ? LexicalScorer.bm25(query, contents(pool), cap)
                            : List.<LexicalScorer.Hit>of();
        final var vector = useVector
                           ? vectorHits(context, query, pool, cap)
                           : List.<LexicalScorer.Hit>of();
        final List<LexicalScorer.Hit> ranked;
        if (useVector && useLexical) {
            ranked = LexicalScorer.reciprocalRankFusion(cap, vector, lexical);
        }
        else {
            ranked = useVector ? vector : lexical;
        }
        final var recalled = ranked.stream()
                .limit(cap)
                .map(hit -> Scored.of(pool.get(hit.id()), hit.score()))
                .toList();
        log.debug("Recalled {} of {} items (vector: {}, lexical: {})",
                  recalled.size(), pool.size(), useVector, useLexical);
        state.put(StateKeys.VECTOR_SEARCH_USED, useVector);
        state.put(StateKeys.RECALLED_ITEMS, recalled);
        return StepStatus.COMPLETED;
    }

    private static boolean vectorUsable(PolicyDecision policy) {
        return policy.isVectorSearchAllowed() && !policy.isCategoryOnly();
    }

    private static Map<String, MemoryItem> scopePool(StepContext context, ItemFilter filter) {
        final var selector = context.selector();
        final var pool = new LinkedHashMap<String, MemoryItem>();
        context.calls()
                .store("list items", () -> context.services().getMetadataStore().listItems(selector, filter))
                .stream()
                .filter(item -> item.isLive() && selector.matches(item.getScope()))
                .forEach(item -> pool.put(RetrieveSupport.entityKey(item.getScope(), item.getId()), item));
        return pool;
    }

    private static Map<String, MemoryItem> categoryPool(StepContext context, PipelineState state, ItemFilter filter) {
        final var selector = context.selector();
        final var store = context.services().getMetadataStore();
        final var idsByScope = new LinkedHashMap<Scope, Set<String>>();
        for (var routed : state.require(StateKeys.ROUTED_CATEGORIES)) {
            final var category = routed.getValue();
            context.calls()
                    .store("list category links", () -> store.listLinks(category.getScope(), category.getId(), null))
                    .forEach(link -> idsByScope.computeIfAbsent(category.getScope(), s -> new HashSet<>())
                            .add(link.getItemId()));
        }
        final var pool = new LinkedHashMap<String, MemoryItem>();
        idsByScope.forEach((scope, ids) -> {
            if (!selector.matches(scope)) {
                return;
            }
            final var scoped = ItemFilter.builder()
                    .memoryTypes(filter.getMemoryTypes())
                    .ids(ids)
                    .build();
            context.calls()
                    .store("list linked items", () -> store.listItems(ScopeSelector.exact(scope), scoped))
                    .stream()
                    .filter(MemoryItem::isLive)
                    .forEach(item -> pool.put(RetrieveSupport.entityKey(item.getScope(), item.getId()), item));
        });
        return pool;
    }

    private static List<LexicalScorer.Hit> vectorHits(
            StepContext context,
            String query,
            Map<String, MemoryItem> pool,
            int cap) {
        final var vector = RetrieveSupport.queryVector(context, query);
        return context.calls()
                .store("query item vectors",
                       () -> context.services().getVectorIndex().query(context.selector(), EntityType.ITEM, vector, cap))
                .stream()
                .map(hit -> new LexicalScorer.Hit(RetrieveSupport.entityKey(hit.getScope(), hit.getEntityId()),
                                                  hit.getScore()))
                .filter(hit -> pool.containsKey(hit.id()))
                .toList();
    }

    private static Map<String, String> contents(Map<String, MemoryItem> pool) {
        return pool.entrySet()
                .stream()
                .collect(Collectors.toMap(Map.Entry::getKey,
                                          e -> e.getValue().getContent(),
                                          (a, b) -> a,
                                          LinkedHashMap::new));
    }
}
