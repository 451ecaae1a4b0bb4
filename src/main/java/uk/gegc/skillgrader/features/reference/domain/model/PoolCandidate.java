package uk.gegc.skillgrader.features.reference.domain.model;

import uk.gegc.skillgrader.features.exercise.domain.model.Difficulty;

import java.util.UUID;

/**
 * A reference scored against a submission.
 *
 * @param similarity         raw cosine similarity
 * @param adjustedSimilarity similarity after tier penalties and bonuses, used for ranking and statistics
 * @param weight             contribution to the weighted score: adjusted similarity times the tier multiplier
 */
public record PoolCandidate(
        UUID referenceId,
        String exerciseId,
        String submissionText,
        int score,
        double similarity,
        double adjustedSimilarity,
        double weight,
        ReferenceSourceKind sourceKind,
        boolean verified,
        boolean crossExercise,
        Difficulty difficulty
) {
}
