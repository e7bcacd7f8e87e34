package com.phonepe.memoria.storage.es;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.mapping.ObjectProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch._types.query_dsl.TermsQueryField;
import co.elastic.clients.util.ObjectBuilder;
import com.google.common.base.Strings;
import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;
import com.phonepe.memoria.core.model.EntityType;
import com.phonepe.memoria.core.scope.FieldSelector;
import com.phonepe.memoria.core.scope.Scope;
import com.phonepe.memoria.core.scope.ScopeSchema;
import com.phonepe.memoria.core.scope.ScopeSelector;
import com.phonepe.memoria.core.utils.VectorUtils;
import com.phonepe.memoria.core.vector.VectorHit;
import com.phonepe.memoria.core.vector.VectorIndex;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Vector index on an Elasticsearch dense vector field with an HNSW graph. Scope fields are mapped as keywords and
 * applied as knn pre-filters, so a query never ranks vectors of scopes outside the selector.
 */
@Slf4j
public class ESVectorIndex implements VectorIndex {
    private static final String VECTORS_INDEX = "memoria-vectors";
    /**
     * Upper bound Elasticsearch puts on both k and num_candidates
     */
    private static final int MAX_KNN_CANDIDATES = 10_000;

    private final ESClient client;
    private final String indexPrefix;
    private final IndexSettings settings;
    private volatile List<String> scopeFields;
    private volatile int dimension;

    @FunctionalInterface
    private interface ESCall<T> {
        T call(ElasticsearchClient client) throws IOException;
    }

    @Builder
    public ESVectorIndex(@NonNull ESClient client, String indexPrefix, IndexSettings settings) {
        this.client = client;
        this.indexPrefix = indexPrefix;
        this.settings = Objects.requireNonNullElse(settings, IndexSettings.DEFAULT);
    }

    @Override
    public synchronized void provision(ScopeSchema schema, int dimension) {
        final var indexName = indexName();
        final var exists = execute(es -> es.indices().exists(ex -> ex.index(indexName)).value());
        if (exists) {
            final var mapping = execute(es -> es.indices().getMapping(m -> m.index(indexName)));
            final var vectorField = mapping.get(indexName).mappings().properties().get(ESVectorDocument.Fields.vector);
            final var existingDims = vectorField == null ? null : vectorField.denseVector().dims();
            if (existingDims != null && existingDims != dimension) {
                throw MemoriaException.of(ErrorType.INVALID_INPUT,
                                          "index %s holds %d dimensional vectors, embeddings have %d"
                                                  .formatted(indexName, existingDims, dimension));
            }
            log.info("Index {} already exists", indexName);
        }
        else {
            log.info("Creating index {} for {} dimensional vectors", indexName, dimension);
            final var acknowledged = execute(es -> es.indices()
                    .create(create -> create
                            .index(indexName)
                            .mappings(mapping -> mapping
                                    .properties(ESVectorDocument.Fields.scope,
                                                p -> p.object(o -> scopeProperties(o, schema)))
                                    .properties(ESVectorDocument.Fields.scopeKey, p -> p.keyword(t -> t))
                                    .properties(ESVectorDocument.Fields.entityType, p -> p.keyword(t -> t))
                                    .properties(ESVectorDocument.Fields.entityId, p -> p.keyword(t -> t))
                                    .properties(ESVectorDocument.Fields.vector,
                                                p -> p.denseVector(t -> t.dims(dimension)
                                                        .elementType("float")
                                                        .similarity("cosine")
                                                        .index(true)
                                                        .indexOptions(i -> i.type("hnsw")))))
                            .settings(s -> s.numberOfShards(Integer.toString(settings.getShards()))
                                    .numberOfReplicas(Integer.toString(settings.getReplicas()))))
                    .acknowledged());
            log.info("Index creation status for index {}: {}", indexName, acknowledged);
        }
        this.scopeFields = schema.fieldNames();
        this.dimension = dimension;
    }

    @Override
    public void upsert(Scope scope, EntityType entityType, String entityId, float[] vector) {
        if (dimension > 0 && vector.length != dimension) {
            throw MemoriaException.of(ErrorType.INVALID_INPUT,
                                      "Vector dimension %d does not match index dimension %d"
                                              .formatted(vector.length, dimension));
        }
        final var document = ESVectorDocument.builder()
                .id(documentId(scope, entityType, entityId))
                .scope(scope.getValues())
                .scopeKey(scope.key())
                .entityType(entityType)
                .entityId(entityId)
                .vector(vector)
                .build();
        final var result = execute(es -> es.index(i -> i.index(indexName())
                .id(document.getId())
                .document(document)
                .refresh(Refresh.WaitFor))
                .result());
        log.debug("Indexed vector of {} {} in scope {}: {}", entityType, entityId, scope, result);
    }

    @Override
    public void delete(Scope scope, EntityType entityType, String entityId) {
        execute(es -> es.delete(d -> d.index(indexName())
                .id(documentId(scope, entityType, entityId))
                .refresh(Refresh.WaitFor)));
    }

    @Override
    public List<VectorHit> query(ScopeSelector selector, EntityType entityType, float[] vector, int topK) {
        final var k = Math.min(topK, MAX_KNN_CANDIDATES);
        final var numCandidates = (int) Math.min((long) k * settings.getCandidateMultiplier(), MAX_KNN_CANDIDATES);
        final var filters = scopeFilters(selector);
        filters.add(Query.of(q -> q.term(t -> t.field(ESVectorDocument.Fields.entityType)
                .value(entityType.name()))));
        final var response = execute(es -> es.search(
                s -> s.index(indexName())
                        .size(k)
                        .query(q -> q.knn(knn -> knn.field(ESVectorDocument.Fields.vector)
                                .queryVector(VectorUtils.toList(vector))
                                .k(k)
                                .numCandidates(Math.max(numCandidates, k))
                                .filter(filters))),
                ESVectorDocument.class));
        final var hits = new ArrayList<VectorHit>();
        for (var hit : response.hits().hits()) {
            final var source = hit.source();
            if (source == null) {
                continue;
            }
            final var scope = Scope.of(source.getScope());
            hits.add(new VectorHit(scopeFields == null ? scope : scope.inOrder(scopeFields),
                                   entityType,
                                   source.getEntityId(),
                                   toCosine(Objects.requireNonNullElse(hit.score(), 0.0))));
        }
        return hits;
    }

    @Override
    public int deleteScope(Scope scope) {
        final var deleted = execute(es -> es.deleteByQuery(d -> d.index(indexName())
                .query(q -> q.term(t -> t.field(ESVectorDocument.Fields.scopeKey).value(scope.key())))
                .refresh(true))
                .deleted());
        log.info("Removed {} vectors of scope {}", deleted, scope);
        return deleted == null ? 0 : deleted.intValue();
    }

    private static ObjectBuilder<ObjectProperty> scopeProperties(ObjectProperty.Builder builder, ScopeSchema schema) {
        for (var field : schema.fieldNames()) {
            builder.properties(field, p -> p.keyword(t -> t));
        }
        return builder;
    }

    private static List<Query> scopeFilters(ScopeSelector selector) {
        final var filters = new ArrayList<Query>();
        selector.getFields().forEach((name, fieldSelector) -> {
            final var field = ESVectorDocument.Fields.scope + "." + name;
            switch (fieldSelector.getMode()) {
                case EXACT -> filters.add(Query.of(q -> q.term(t -> t.field(field)
                        .value(fieldSelector.singleValue()))));
                case ANY_OF -> filters.add(Query.of(q -> q.terms(t -> t.field(field)
                        .terms(new TermsQueryField.Builder()
                                       .value(values(fieldSelector))
                                       .build()))));
                case WILDCARD -> filters.add(Query.of(q -> q.exists(e -> e.field(field))));
            }
        });
        return filters;
    }

    private static List<FieldValue> values(FieldSelector selector) {
        return selector.getValues().stream().map(FieldValue::of).toList();
    }

    /**
     * Elasticsearch reports cosine similarity rescaled to (1 + cos) / 2
     */
    private static double toCosine(double score) {
        return score * 2.0 - 1.0;
    }

    private static String documentId(Scope scope, EntityType entityType, String entityId) {
        return UUID.nameUUIDFromBytes("%s-%s-%s".formatted(scope.key(), entityType.name(), entityId)
                                              .getBytes(StandardCharsets.UTF_8))
                .toString();
    }

    private <T> T execute(ESCall<T> call) {
        try {
            return call.call(client.getElasticsearchClient());
        }
        catch (IOException e) {
            log.warn("Elasticsearch call failed: {}", e.getMessage());
            throw MemoriaException.wrap(ErrorType.TRANSIENT_STORE_ERROR, e);
        }
        catch (ElasticsearchException e) {
            log.error("Elasticsearch rejected request: {}", e.getMessage());
            throw MemoriaException.wrap(e.status() == 429 || e.status() >= 500
                                        ? ErrorType.TRANSIENT_STORE_ERROR
                                        : ErrorType.STORE_FAILURE, e);
        }
    }

    private String indexName() {
        return Strings.isNullOrEmpty(indexPrefix) ? VECTORS_INDEX : "%s.%s".formatted(indexPrefix, VECTORS_INDEX);
    }
}
