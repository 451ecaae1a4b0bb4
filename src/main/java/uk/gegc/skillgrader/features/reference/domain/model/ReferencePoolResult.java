package uk.gegc.skillgrader.features.reference.domain.model;

import java.util.List;

/**
 * Resolved comparison pool and the statistics derived from it.
 * <p>
 * An empty pool is a neutral result: percentile 50 and every similarity and weight at zero.
 * {@code failed} is set when a lookup against the reference store failed; the statistics then cover
 * whatever part of the pool could still be resolved.
 * </p>
 */
public record ReferencePoolResult(
        List<PoolCandidate> references,
        double averageSimilarity,
        double bestMatchSimilarity,
        int bestMatchScore,
        int goodMatchCount,
        double weightedScore,
        int percentileEstimate,
        boolean usedCrossExerciseFallback,
        int fromCurrentExercise,
        int fromCrossExercise,
        List<String> sourceExercises,
        double poolWeight,
        boolean failed,
        String failureReason
) {

    public static ReferencePoolResult empty() {
        return new ReferencePoolResult(List.of(), 0.0, 0.0, 0, 0, 0.0, 50, false, 0, 0, List.of(), 0.0, false, null);
    }

    public static ReferencePoolResult failure(String reason) {
        return new ReferencePoolResult(List.of(), 0.0, 0.0, 0, 0, 0.0, 50, false, 0, 0, List.of(), 0.0, true, reason);
    }

    public boolean isEmpty() {
        return references.isEmpty();
    }
}
