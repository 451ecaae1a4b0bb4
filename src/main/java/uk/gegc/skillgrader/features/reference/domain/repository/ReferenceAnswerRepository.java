package uk.gegc.skillgrader.features.reference.domain.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceAnswer;

import java.util.List;
import java.util.UUID;

public interface ReferenceAnswerRepository extends JpaRepository<ReferenceAnswer, UUID> {

    Slice<ReferenceAnswer> findByExerciseIdAndActiveTrueAndScoreGreaterThanEqual(
            String exerciseId, Integer minScore, Pageable pageable);

    @Query("""
            SELECT r FROM ReferenceAnswer r
            WHERE LOWER(r.skillCategory) = LOWER(:skillCategory)
              AND r.exerciseId <> :excludeExerciseId
              AND r.active = true
              AND r.score >= :minScore
            ORDER BY r.createdAt DESC
            """)
    List<ReferenceAnswer> findCrossExercise(@Param("skillCategory") String skillCategory,
                                            @Param("excludeExerciseId") String excludeExerciseId,
                                            @Param("minScore") Integer minScore,
                                            Pageable pageable);

    @Query("""
            SELECT r.exerciseId AS exerciseId, COUNT(r) AS total
            FROM ReferenceAnswer r
            WHERE r.active = true
            GROUP BY r.exerciseId
            """)
    List<ExerciseReferenceCount> countActiveGroupedByExercise();

    interface ExerciseReferenceCount {
        String getExerciseId();

        long getTotal();
    }
}
