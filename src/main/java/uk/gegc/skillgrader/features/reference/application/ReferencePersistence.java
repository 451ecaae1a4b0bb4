package uk.gegc.skillgrader.features.reference.application;

import uk.gegc.skillgrader.features.reference.domain.model.ReferenceAnswer;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceFilter;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Storage of the reference bank. Lookups only return active references. Implementations may throw
 * on storage failure; callers in the matcher convert that into a failed result.
 */
public interface ReferencePersistence {

    /**
     * Every active reference of the exercise scoring at least {@code minScore}, oldest first.
     * Implementations page through the store; the result is not capped.
     */
    List<ReferenceAnswer> findByExercise(String exerciseId, int minScore);

    /**
     * References from other exercises in the same skill category.
     */
    List<ReferenceAnswer> findCrossExercise(String skillCategory, String excludeExerciseId, ReferenceFilter filter);

    UUID insert(ReferenceAnswer reference);

    /**
     * @param promoteToCurated also upgrade the source kind to curated
     * @return {@code false} when no such reference exists
     */
    boolean markVerified(UUID id, boolean promoteToCurated);

    /**
     * Soft delete.
     *
     * @return {@code false} when no such reference exists
     */
    boolean deactivate(UUID id);

    /**
     * Active reference count per exercise id; exercises without references are absent.
     */
    Map<String, Long> countActiveByExercise();
}
