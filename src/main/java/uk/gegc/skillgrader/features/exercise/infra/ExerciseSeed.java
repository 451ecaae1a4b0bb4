package uk.gegc.skillgrader.features.exercise.infra;

import uk.gegc.skillgrader.features.exercise.domain.model.Difficulty;
import uk.gegc.skillgrader.features.rubric.domain.model.RubricCriterion;

import java.util.List;

/**
 * Shape of one entry in the exercise seed file.
 */
record ExerciseSeed(
        String id,
        String title,
        String description,
        String skillCategory,
        Difficulty difficulty,
        String exemplar,
        List<RubricCriterion> rubric,
        Long minExpectedTimeMs
) {
}
