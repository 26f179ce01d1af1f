package com.peargent.providers;

import java.util.ArrayList;
import java.util.List;

@FunctionalInterface
public interface EmbeddingProvider {

    float[] embed(String text);

    default List<float[]> embedBatch(List<String> texts) {
        var vectors = new ArrayList<float[]>(texts.size());
        for (var text : texts) vectors.add(embed(text));
        return vectors;
    }

    static double cosineSimilarity(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length || a.length == 0) return 0.0;
        double dot = 0, normA = 0, normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) return 0.0;
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
