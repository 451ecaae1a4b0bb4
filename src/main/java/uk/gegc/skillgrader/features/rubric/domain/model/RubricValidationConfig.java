package uk.gegc.skillgrader.features.rubric.domain.model;

/**
 * Per-call reconciliation settings.
 *
 * @param maxScoreDivergence divergence (in points) above which {@code score_mismatch} is raised
 */
public record RubricValidationConfig(
        boolean fuzzyMatchingEnabled,
        double fuzzyMatchThreshold,
        int maxScoreDivergence,
        boolean autoCorrectExceedingPoints,
        boolean autoCorrectScoreMismatch
) {

    public static RubricValidationConfig defaults() {
        return new RubricValidationConfig(true, 0.7, 5, true, false);
    }
}
