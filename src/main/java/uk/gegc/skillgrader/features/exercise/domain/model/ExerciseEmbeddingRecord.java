package uk.gegc.skillgrader.features.exercise.domain.model;

import java.util.List;

/**
 * Read-only projection of an exercise used for cross-exercise similarity.
 *
 * @param contentEmbedding may be empty when no embedding could be produced
 */
public record ExerciseEmbeddingRecord(
        String exerciseId,
        String skillCategory,
        Difficulty difficulty,
        float[] contentEmbedding,
        List<String> derivedTags
) {
}
