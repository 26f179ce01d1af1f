package com.peargent.providers;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EmbeddingProviderTest {

    @Test
    void cosineSimilarityOfParallelAndOrthogonalVectors() {
        assertEquals(1.0, EmbeddingProvider.cosineSimilarity(new float[]{1, 2}, new float[]{2, 4}), 1e-6);
        assertEquals(0.0, EmbeddingProvider.cosineSimilarity(new float[]{1, 0}, new float[]{0, 3}), 1e-6);
        assertEquals(-1.0, EmbeddingProvider.cosineSimilarity(new float[]{1, 0}, new float[]{-1, 0}), 1e-6);
    }

    @Test
    void degenerateInputsScoreZero() {
        assertEquals(0.0, EmbeddingProvider.cosineSimilarity(new float[]{0, 0}, new float[]{1, 1}));
        assertEquals(0.0, EmbeddingProvider.cosineSimilarity(new float[]{1}, new float[]{1, 1}));
        assertEquals(0.0, EmbeddingProvider.cosineSimilarity(null, new float[]{1}));
    }

    @Test
    void batchEmbedsEachText() {
        EmbeddingProvider lengths = text -> new float[]{text.length()};

        var vectors = lengths.embedBatch(List.of("a", "abc"));

        assertEquals(2, vectors.size());
        assertEquals(3f, vectors.get(1)[0]);
    }
}
