package uk.gegc.skillgrader.features.reference.domain.model;

/**
 * Per-call reference matching settings.
 */
public record ReferenceMatchConfig(
        int qualityThreshold,
        int topK,
        double matchThreshold,
        boolean crossExerciseEnabled,
        int fallbackMinimum,
        double crossExercisePenalty,
        double sameDifficultyBonus,
        double crossExerciseMinSimilarity,
        double crossExerciseWeightMultiplier,
        int maxCrossExerciseCandidates
) {

    public static ReferenceMatchConfig defaults() {
        return new ReferenceMatchConfig(80, 10, 0.70, true, 3, 0.10, 0.05, 0.60, 0.7, 15);
    }
}
