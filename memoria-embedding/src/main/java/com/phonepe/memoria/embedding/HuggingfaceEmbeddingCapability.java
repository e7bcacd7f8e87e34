package com.phonepe.memoria.embedding;

import ai.djl.MalformedModelException;
import ai.djl.huggingface.translator.TextEmbeddingTranslatorFactory;
import ai.djl.inference.Predictor;
import ai.djl.repository.zoo.Criteria;
import ai.djl.repository.zoo.ModelNotFoundException;
import ai.djl.repository.zoo.ZooModel;
import ai.djl.training.util.ProgressBar;
import ai.djl.translate.TranslateException;
import com.phonepe.memoria.core.capability.EmbeddingCapability;
import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;
import com.phonepe.memoria.core.utils.VectorUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.BasePooledObjectFactory;
import org.apache.commons.pool2.DestroyMode;
import org.apache.commons.pool2.PooledObject;
import org.apache.commons.pool2.impl.DefaultPooledObject;
import org.apache.commons.pool2.impl.GenericObjectPool;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;

/**
 * Embeddings from a Hugging Face sentence transformer run locally through DJL. The model is downloaded on first use.
 * Check <a href="https://docs.djl.ai/master/docs/load_model.html">...</a> for more information on how to load models.
 * Vectors are L2 normalised so they compare by cosine in every vector index.
 */
@Slf4j
public class HuggingfaceEmbeddingCapability implements EmbeddingCapability {
    public static final String DEFAULT_MODEL_URL =
            "djl://ai.djl.huggingface.pytorch/sentence-transformers/all-MiniLM-L6-v2";
    private static final String DEFAULT_ENGINE = "PyTorch";
    private static final Duration BORROW_TIMEOUT = Duration.ofSeconds(30);
    private static final String SAMPLE_TEXT = "dimension sample";

    private final ZooModel<String, float[]> zooModel;
    // The pool is needed as predictor is not threadsafe
    private final GenericObjectPool<Predictor<String, float[]>> predictors;
    private final int dimension;

    public HuggingfaceEmbeddingCapability() {
        this(null, null, 0, 0);
    }

    @Builder
    public HuggingfaceEmbeddingCapability(String modelUrl, String engine, int dimension, int maxPredictors) {
        this(loadModel(Objects.requireNonNullElse(modelUrl, DEFAULT_MODEL_URL),
                       Objects.requireNonNullElse(engine, DEFAULT_ENGINE)),
             dimension,
             maxPredictors);
    }

    HuggingfaceEmbeddingCapability(@NonNull ZooModel<String, float[]> zooModel, int dimension, int maxPredictors) {
        this.zooModel = zooModel;
        final var config = new GenericObjectPoolConfig<Predictor<String, float[]>>();
        config.setMaxTotal(maxPredictors > 0 ? maxPredictors : Runtime.getRuntime().availableProcessors());
        config.setMaxWait(BORROW_TIMEOUT);
        this.predictors = new GenericObjectPool<>(new PredictorFactory(zooModel), config);
        this.dimension = dimension > 0 ? dimension : predict(SAMPLE_TEXT).length;
        log.info("Embedding model {} ready with dimension {}", zooModel.getName(), this.dimension);
    }

    @Override
    public float[] embed(String input) {
        final var embedding = predict(Objects.requireNonNullElse(input, ""));
        if (embedding.length != dimension) {
            throw MemoriaException.of(ErrorType.CAPABILITY_FAILURE,
                                      "model returned %d dimensions instead of %d".formatted(embedding.length,
                                                                                             dimension));
        }
        return embedding;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public void close() {
        predictors.close();
        zooModel.close();
    }

    private float[] predict(String input) {
        final Predictor<String, float[]> predictor;
        try {
            predictor = predictors.borrowObject();
        }
        catch (Exception e) {
            log.warn("No embedding predictor available: {}", e.getMessage());
            throw MemoriaException.wrap(ErrorType.TRANSIENT_CAPABILITY_ERROR, e);
        }
        try {
            return VectorUtils.l2Normalize(predictor.predict(input));
        }
        catch (TranslateException e) {
            log.error("Embedding failed: {}", e.getMessage());
            throw MemoriaException.wrap(ErrorType.CAPABILITY_FAILURE, e);
        }
        finally {
            predictors.returnObject(predictor);
        }
    }

    private static ZooModel<String, float[]> loadModel(String modelUrl, String engine) {
        System.setProperty("OPT_OUT_TRACKING", "true"); //DJL DIALS HOME ...
        final var criteria = Criteria.builder()
                .setTypes(String.class, float[].class)
                .optModelUrls(modelUrl)
                .optEngine(engine)
                .optTranslatorFactory(new TextEmbeddingTranslatorFactory())
                .optProgress(new ProgressBar())
                .build();
        try {
            return criteria.loadModel();
        }
        catch (IOException | ModelNotFoundException | MalformedModelException e) {
            log.error("Could not load embedding model {}: {}", modelUrl, e.getMessage());
            throw MemoriaException.wrap(ErrorType.CAPABILITY_UNAVAILABLE, e);
        }
    }

    @RequiredArgsConstructor
    private static final class PredictorFactory extends BasePooledObjectFactory<Predictor<String, float[]>> {

        private final ZooModel<String, float[]> zooModel;

        @Override
        public Predictor<String, float[]> create() {
            log.debug("Creating new predictor");
            return zooModel.newPredictor();
        }

        @Override
        public PooledObject<Predictor<String, float[]>> wrap(Predictor<String, float[]> predictor) {
            return new DefaultPooledObject<>(predictor);
        }

        @Override
        public void destroyObject(PooledObject<Predictor<String, float[]>> predictor, DestroyMode destroyMode) {
            log.info("Closing predictor");
            predictor.getObject().close();
        }
    }
}
