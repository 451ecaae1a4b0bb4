package uk.gegc.skillgrader.features.exercise.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.skillgrader.features.exercise.domain.model.Exercise;

import java.util.List;

public interface ExerciseRepository extends JpaRepository<Exercise, String> {

    List<Exercise> findBySkillCategoryIgnoreCaseOrderByIdAsc(String skillCategory);

    List<Exercise> findAllByOrderByIdAsc();
}
