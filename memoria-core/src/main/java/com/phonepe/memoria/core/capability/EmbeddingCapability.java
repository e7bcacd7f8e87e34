package com.phonepe.memoria.core.capability;

import java.util.List;

/**
 * A representation for an embedding model
 */
public interface EmbeddingCapability extends AutoCloseable {
    /**
     * Get the embedding for the given input
     *
     * @param input The input to get the embedding for
     * @return The embedding for the input. Length is always {@link #dimension()}
     */
    float[] embed(String input);

    int dimension();

    default List<float[]> embedAll(List<String> inputs) {
        return inputs.stream().map(this::embed).toList();
    }

    @Override
    default void close() throws Exception {
        //Nothing to release by default
    }
}
