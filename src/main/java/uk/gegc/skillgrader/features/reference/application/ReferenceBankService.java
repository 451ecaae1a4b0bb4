package uk.gegc.skillgrader.features.reference.application;

import uk.gegc.skillgrader.features.reference.api.dto.MatchReferencesRequest;
import uk.gegc.skillgrader.features.reference.api.dto.ReferenceAnswerRequest;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceInsertOutcome;
import uk.gegc.skillgrader.features.reference.domain.model.ReferencePoolResult;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceStats;
import uk.gegc.skillgrader.features.reference.domain.model.SeedingStatus;

import java.util.List;
import java.util.UUID;

/**
 * Reference bank operations addressed by exercise id. Exercise metadata and missing embeddings are
 * resolved here before delegating to {@link ReferenceMatcher}.
 */
public interface ReferenceBankService {

    ReferenceInsertOutcome addReference(ReferenceAnswerRequest request);

    ReferenceInsertOutcome seedReference(ReferenceAnswerRequest request, boolean verifyImmediately);

    ReferencePoolResult match(MatchReferencesRequest request);

    /**
     * @throws uk.gegc.skillgrader.shared.exception.ResourceNotFoundException when the exercise is unknown
     * @throws IllegalStateException when the statistics could not be read
     */
    ReferenceStats getStats(String exerciseId);

    /**
     * @throws uk.gegc.skillgrader.shared.exception.ResourceNotFoundException when no active reference has this id
     */
    void verify(UUID referenceId);

    /**
     * @throws uk.gegc.skillgrader.shared.exception.ResourceNotFoundException when no active reference has this id
     */
    void deactivate(UUID referenceId);

    SeedingStatus getSeedingStatus(List<String> exerciseIds);
}
