package com.phonepe.memoria.embedding;

import ai.djl.inference.Predictor;
import ai.djl.repository.zoo.ZooModel;
import ai.djl.translate.TranslateException;
import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;
import com.phonepe.memoria.core.utils.VectorUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests {@link HuggingfaceEmbeddingCapability}
 */
class HuggingfaceEmbeddingCapabilityTest {

    @Test
    void testDimensionIsMeasuredAndVectorsNormalised() throws Exception {
        final var predictor = predictor();
        when(predictor.predict(anyString())).thenReturn(new float[]{3, 4});
        final var model = model(predictor);
        try (var capability = new HuggingfaceEmbeddingCapability(model, 0, 2)) {
            assertEquals(2, capability.dimension());
            final var embedding = capability.embed("My favorite color is blue");
            assertArrayEquals(new float[]{0.6f, 0.8f}, embedding, 1e-6f);
        }
        verify(model, atLeastOnce()).newPredictor();
        verify(model).close();
    }

    @Test
    void testPredictorsAreSharedAcrossThreads() throws Exception {
        final var predictor = predictor();
        when(predictor.predict(anyString())).thenReturn(new float[]{1, 0, 0});
        final var model = model(predictor);
        final var executor = Executors.newFixedThreadPool(4);
        try (var capability = new HuggingfaceEmbeddingCapability(model, 3, 1)) {
            final var tasks = new ArrayList<Callable<float[]>>();
            for (int i = 0; i < 20; i++) {
                final var text = "text " + i;
                tasks.add(() -> capability.embed(text));
            }
            for (var future : executor.invokeAll(tasks)) {
                assertEquals(1.0, VectorUtils.cosineSimilarity(new float[]{1, 0, 0}, future.get()), 1e-6);
            }
            verify(model, times(1)).newPredictor();
        }
        finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testFailuresAreClassified() throws Exception {
        final var predictor = predictor();
        when(predictor.predict(anyString())).thenReturn(new float[]{1, 0, 0});
        when(predictor.predict(eq("broken"))).thenThrow(new TranslateException("bad input"));
        when(predictor.predict(eq("short"))).thenReturn(new float[]{1, 0});
        try (var capability = new HuggingfaceEmbeddingCapability(model(predictor), 0, 1)) {
            assertEquals(ErrorType.CAPABILITY_FAILURE,
                         assertThrows(MemoriaException.class, () -> capability.embed("broken")).getErrorType());
            assertEquals(ErrorType.CAPABILITY_FAILURE,
                         assertThrows(MemoriaException.class, () -> capability.embed("short")).getErrorType());
            assertEquals(3, capability.embed("fine").length);
        }
    }

    @Test
    @EnabledIfEnvironmentVariable(named = "MEMORIA_DOWNLOAD_MODELS", matches = "true")
    void testEmbeddingWithDownloadedModel() {
        try (var capability = HuggingfaceEmbeddingCapability.builder().build()) {
            assertEquals(384, capability.dimension());
            final var blue = capability.embed("My favorite color is blue");
            final var colour = capability.embed("Which colour does the user like?");
            final var weather = capability.embed("It rained in Pune all week");
            assertTrue(VectorUtils.cosineSimilarity(blue, colour) > VectorUtils.cosineSimilarity(blue, weather));
            assertEquals(1.0, VectorUtils.cosineSimilarity(blue, blue), 1e-5);
            assertEquals(List.of(384, 384), capability.embedAll(List.of("a", "b")).stream().map(v -> v.length).toList());
        }
    }

    @SuppressWarnings("unchecked")
    private static Predictor<String, float[]> predictor() {
        return mock(Predictor.class);
    }

    @SuppressWarnings("unchecked")
    private static ZooModel<String, float[]> model(Predictor<String, float[]> predictor) {
        final ZooModel<String, float[]> model = mock(ZooModel.class);
        when(model.newPredictor()).thenReturn(predictor);
        return model;
    }
}
