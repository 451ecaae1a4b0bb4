package uk.gegc.skillgrader.features.reference.application;

import uk.gegc.skillgrader.features.exercise.domain.model.Difficulty;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceCandidate;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceInsertOutcome;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceMatchConfig;
import uk.gegc.skillgrader.features.reference.domain.model.ReferencePoolResult;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceStats;
import uk.gegc.skillgrader.features.reference.domain.model.SeedingStatus;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Reference bank queries and maintenance. Storage failures never escape as exceptions: they surface as
 * failed results or rejected outcomes.
 */
public interface ReferenceMatcher {

    ReferencePoolResult matchReferences(String exerciseId,
                                        float[] embedding,
                                        String skillCategory,
                                        Difficulty difficulty,
                                        ReferenceMatchConfig config);

    ReferencePoolResult matchReferences(String exerciseId,
                                        float[] embedding,
                                        String skillCategory,
                                        Difficulty difficulty);

    ReferenceInsertOutcome addReferenceAnswer(ReferenceCandidate candidate);

    /**
     * Adds a curated answer, optionally marking it verified straight away.
     */
    ReferenceInsertOutcome seedReference(ReferenceCandidate candidate, boolean verifyImmediately);

    /**
     * Marks a reference verified and upgrades it to curated.
     *
     * @return {@code false} when the reference does not exist or could not be updated
     */
    boolean promoteToVerified(UUID referenceId);

    boolean deactivate(UUID referenceId);

    Optional<ReferenceStats> getReferenceStats(String exerciseId);

    SeedingStatus getSeedingStatus(List<String> exerciseIds);

    double calculateMultiReferenceWeight(ReferenceStats stats);

    /**
     * Bounded score adjustment derived from the pool: positive when the submission sits close to proven
     * answers, negative when it is far from them, zero without evidence.
     */
    int referenceAdjustment(ReferencePoolResult result);
}
