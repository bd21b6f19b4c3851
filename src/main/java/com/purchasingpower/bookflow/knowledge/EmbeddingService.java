package com.purchasingpower.bookflow.knowledge;

import java.util.List;

/**
 * Turns text into fixed-length vectors for similarity matching of user
 * queries against the action catalog.
 */
public interface EmbeddingService {

    /**
     * Generate embedding for arbitrary text.
     *
     * @param text the text to embed
     * @return embedding vector (384 dimensions for all-minilm)
     * @throws IllegalArgumentException if the text is blank
     * @throws EmbeddingException if the backend fails
     */
    List<Double> generateTextEmbedding(String text);

    /**
     * Generate embeddings for several texts in one call.
     *
     * @return list of embedding vectors, same order as input
     */
    List<List<Double>> generateEmbeddingsBatch(List<String> texts);
}
