package com.svsbrowser.springboot.service;

import java.util.List;

/**
 * Turns text into fixed-dimension vectors. One implementation is active per process, chosen by
 * {@code app.embedding.backend}.
 */
public interface EmbeddingBackend {

    String getModelName();

    String getModelVersion();

    int getDimensions();

    float[] embed(String text);

    /**
     * @return one vector per input, in input order
     */
    List<float[]> embedBatch(List<String> texts);
}
