package uk.gegc.skillgrader.features.similarity.application;

import org.springframework.stereotype.Component;

/**
 * Cosine similarity between embedding vectors.
 * <p>
 * Mismatched or empty vectors and zero-magnitude vectors yield {@code 0}: they carry no evidence
 * of similarity. Negative cosine is clamped to {@code 0} as well, so callers always receive a value
 * in {@code [0, 1]}.
 * </p>
 */
@Component
public class SimilarityKernel {

    public double cosineSimilarity(float[] a, float[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            return 0.0;
        }

        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }

        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }

        double cosine = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        if (Double.isNaN(cosine)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, cosine));
    }
}
