package uk.gegc.skillgrader.features.exercise.infra;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.skillgrader.features.exercise.application.ExerciseCatalog;
import uk.gegc.skillgrader.features.exercise.domain.model.Exercise;
import uk.gegc.skillgrader.features.exercise.domain.repository.ExerciseRepository;

import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaExerciseCatalog implements ExerciseCatalog {

    private final ExerciseRepository exerciseRepository;

    @Override
    public Optional<Exercise> findById(String exerciseId) {
        if (exerciseId == null || exerciseId.isBlank()) {
            return Optional.empty();
        }
        return exerciseRepository.findById(exerciseId);
    }

    @Override
    public List<Exercise> findAll() {
        return exerciseRepository.findAllByOrderByIdAsc();
    }

    @Override
    public List<Exercise> findBySkillCategory(String skillCategory) {
        if (skillCategory == null || skillCategory.isBlank()) {
            return List.of();
        }
        return exerciseRepository.findBySkillCategoryIgnoreCaseOrderByIdAsc(skillCategory);
    }
}
