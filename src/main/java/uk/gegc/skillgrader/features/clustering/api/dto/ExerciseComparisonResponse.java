package uk.gegc.skillgrader.features.clustering.api.dto;

import uk.gegc.skillgrader.features.clustering.domain.model.ExerciseSimilarity;
import uk.gegc.skillgrader.features.clustering.domain.model.RelationshipType;

/**
 * @param relationship relationship of exercise B as seen from exercise A
 */
public record ExerciseComparisonResponse(
        String exerciseIdA,
        String exerciseIdB,
        ExerciseSimilarity similarity,
        RelationshipType relationship
) {
}
