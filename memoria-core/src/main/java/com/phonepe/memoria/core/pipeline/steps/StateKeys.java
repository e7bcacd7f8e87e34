package com.phonepe.memoria.core.pipeline.steps;

import com.fasterxml.jackson.core.type.TypeReference;
import com.phonepe.memoria.core.model.EvolutionDiff;
import com.phonepe.memoria.core.model.Intention;
import com.phonepe.memoria.core.model.MemoryCategory;
import com.phonepe.memoria.core.model.MemoryItem;
import com.phonepe.memoria.core.model.Resource;
import com.phonepe.memoria.core.model.Scored;
import com.phonepe.memoria.core.pipeline.StateKey;
import com.phonepe.memoria.core.pipeline.steps.evolve.EvolveTargets;
import com.phonepe.memoria.core.pipeline.steps.retrieve.RetrievalProgress;
import com.phonepe.memoria.core.pipeline.steps.retrieve.RetrieveRequest;
import com.phonepe.memoria.core.service.EvolveOptions;
import com.phonepe.memoria.core.service.MemorizeOptions;
import com.phonepe.memoria.core.service.MemorizeResult;
import com.phonepe.memoria.core.service.ResourceInput;
import com.phonepe.memoria.core.service.RetrieveResult;
import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.Map;

/**
 * State keys used by the built in steps. Custom steps can declare these to read or replace built in outputs.
 */
@UtilityClass
public class StateKeys {
    // memorize
    public static final StateKey<ResourceInput> RESOURCE_INPUT
            = StateKey.of("memorize.input", new TypeReference<ResourceInput>() {});
    public static final StateKey<MemorizeOptions> MEMORIZE_OPTIONS
            = StateKey.of("memorize.options", new TypeReference<MemorizeOptions>() {});
    public static final StateKey<Resource> RESOURCE
            = StateKey.of("memorize.resource", new TypeReference<Resource>() {});
    public static final StateKey<byte[]> RESOURCE_BYTES
            = StateKey.of("memorize.resource_bytes", new TypeReference<byte[]>() {});
    public static final StateKey<Resource> SUPERSEDED_RESOURCE
            = StateKey.of("memorize.superseded_resource", new TypeReference<Resource>() {});
    public static final StateKey<Boolean> DEDUPLICATED
            = StateKey.of("memorize.deduplicated", new TypeReference<Boolean>() {});
    public static final StateKey<List<ItemCandidate>> CANDIDATES
            = StateKey.of("memorize.candidates", new TypeReference<List<ItemCandidate>>() {});
    public static final StateKey<MemorizeResult> MEMORIZE_RESULT
            = StateKey.of("memorize.result", new TypeReference<MemorizeResult>() {});

    // shared by memorize and evolve
    public static final StateKey<ItemPlan> ITEM_PLAN
            = StateKey.of("items.plan", new TypeReference<ItemPlan>() {});
    public static final StateKey<CategoryPlan> CATEGORY_PLAN
            = StateKey.of("categories.plan", new TypeReference<CategoryPlan>() {});
    public static final StateKey<Intention> INTENTION_UPDATE
            = StateKey.of("intention.update", new TypeReference<Intention>() {});

    // retrieve
    public static final StateKey<RetrieveRequest> RETRIEVE_REQUEST
            = StateKey.of("retrieve.request", new TypeReference<RetrieveRequest>() {});
    public static final StateKey<List<Intention>> INTENTIONS
            = StateKey.of("retrieve.intentions", new TypeReference<List<Intention>>() {});
    public static final StateKey<List<Scored<MemoryCategory>>> ROUTED_CATEGORIES
            = StateKey.of("retrieve.categories", new TypeReference<List<Scored<MemoryCategory>>>() {});
    public static final StateKey<Boolean> CATEGORIES_BY_VECTOR
            = StateKey.of("retrieve.categories_by_vector", new TypeReference<Boolean>() {});
    public static final StateKey<RetrievalProgress> PROGRESS
            = StateKey.of("retrieve.progress", new TypeReference<RetrievalProgress>() {});
    public static final StateKey<List<Scored<MemoryItem>>> RECALLED_ITEMS
            = StateKey.of("retrieve.items", new TypeReference<List<Scored<MemoryItem>>>() {});
    public static final StateKey<List<Scored<Resource>>> RECALLED_RESOURCES
            = StateKey.of("retrieve.resources", new TypeReference<List<Scored<Resource>>>() {});
    public static final StateKey<List<Scored<MemoryItem>>> RELATED_ITEMS
            = StateKey.of("retrieve.related_items", new TypeReference<List<Scored<MemoryItem>>>() {});
    public static final StateKey<Boolean> VECTOR_SEARCH_USED
            = StateKey.of("retrieve.vector_search_used", new TypeReference<Boolean>() {});
    public static final StateKey<RetrieveResult> RETRIEVE_RESULT
            = StateKey.of("retrieve.result", new TypeReference<RetrieveResult>() {});

    // evolve
    public static final StateKey<EvolveOptions> EVOLVE_OPTIONS
            = StateKey.of("evolve.options", new TypeReference<EvolveOptions>() {});
    public static final StateKey<EvolveTargets> EVOLVE_TARGETS
            = StateKey.of("evolve.targets", new TypeReference<EvolveTargets>() {});
    /**
     * Item id to the ids of its related items, for items whose relations change
     */
    public static final StateKey<Map<String, List<String>>> ITEM_RELATIONS
            = StateKey.of("evolve.item_relations", new TypeReference<Map<String, List<String>>>() {});
    public static final StateKey<Integer> EVOLVE_COMMITTED
            = StateKey.of("evolve.committed", new TypeReference<Integer>() {});
    public static final StateKey<EvolutionDiff> EVOLUTION_DIFF
            = StateKey.of("evolve.diff", new TypeReference<EvolutionDiff>() {});
}
