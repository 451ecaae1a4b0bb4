package uk.gegc.skillgrader.features.clustering.domain.model;

import uk.gegc.skillgrader.features.exercise.domain.model.Difficulty;

public record RelatedExercise(
        String exerciseId,
        String title,
        String skillCategory,
        Difficulty difficulty,
        double similarity,
        RelationshipType relationshipType
) {
}
