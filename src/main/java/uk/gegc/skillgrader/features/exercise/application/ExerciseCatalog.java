package uk.gegc.skillgrader.features.exercise.application;

import uk.gegc.skillgrader.features.exercise.domain.model.Exercise;

import java.util.List;
import java.util.Optional;

/**
 * Read-only lookup of exercises: rubric, skill category, difficulty and exemplar.
 */
public interface ExerciseCatalog {

    Optional<Exercise> findById(String exerciseId);

    List<Exercise> findAll();

    List<Exercise> findBySkillCategory(String skillCategory);
}
