package uk.gegc.skillgrader.features.reference.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.skillgrader.features.embedding.application.EmbeddingService;
import uk.gegc.skillgrader.features.exercise.application.ExerciseCatalog;
import uk.gegc.skillgrader.features.exercise.domain.model.Exercise;
import uk.gegc.skillgrader.features.reference.api.dto.MatchReferencesRequest;
import uk.gegc.skillgrader.features.reference.api.dto.ReferenceAnswerRequest;
import uk.gegc.skillgrader.features.reference.application.ReferenceBankService;
import uk.gegc.skillgrader.features.reference.application.ReferenceMatcher;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceCandidate;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceInsertOutcome;
import uk.gegc.skillgrader.features.reference.domain.model.ReferencePoolResult;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceSourceKind;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceStats;
import uk.gegc.skillgrader.features.reference.domain.model.SeedingStatus;
import uk.gegc.skillgrader.shared.exception.ResourceNotFoundException;
import uk.gegc.skillgrader.shared.exception.ValidationException;

import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReferenceBankServiceImpl implements ReferenceBankService {

    private final ReferenceMatcher referenceMatcher;
    private final ExerciseCatalog exerciseCatalog;
    private final EmbeddingService embeddingService;

    @Override
    public ReferenceInsertOutcome addReference(ReferenceAnswerRequest request) {
        return referenceMatcher.addReferenceAnswer(toCandidate(request));
    }

    @Override
    public ReferenceInsertOutcome seedReference(ReferenceAnswerRequest request, boolean verifyImmediately) {
        return referenceMatcher.seedReference(toCandidate(request), verifyImmediately);
    }

    private ReferenceCandidate toCandidate(ReferenceAnswerRequest request) {
        Exercise exercise = requireExercise(request.exerciseId());
        float[] embedding = hasEmbedding(request.embedding())
                ? request.embedding()
                : embeddingService.embed(request.submissionText()).orElse(null);

        return new ReferenceCandidate(
                exercise.getId(),
                request.submissionText(),
                request.score(),
                embedding,
                request.sourceKind() != null ? request.sourceKind() : ReferenceSourceKind.LEARNER,
                exercise.getSkillCategory(),
                exercise.getDifficulty(),
                request.judgmentScore(),
                request.validatorScore(),
                request.embeddingSimilarity()
        );
    }

    @Override
    public ReferencePoolResult match(MatchReferencesRequest request) {
        Exercise exercise = requireExercise(request.exerciseId());

        float[] embedding;
        if (hasEmbedding(request.embedding())) {
            embedding = request.embedding();
        } else if (request.text() != null && !request.text().isBlank()) {
            embedding = embeddingService.embed(request.text()).orElse(null);
        } else {
            throw new ValidationException("Either text or embedding must be provided");
        }

        if (embedding == null) {
            log.warn("No embedding available for reference match: exerciseId={}", exercise.getId());
            return ReferencePoolResult.empty();
        }
        return request.config() != null
                ? referenceMatcher.matchReferences(exercise.getId(), embedding, exercise.getSkillCategory(),
                exercise.getDifficulty(), request.config())
                : referenceMatcher.matchReferences(exercise.getId(), embedding, exercise.getSkillCategory(),
                exercise.getDifficulty());
    }

    @Override
    public ReferenceStats getStats(String exerciseId) {
        requireExercise(exerciseId);
        return referenceMatcher.getReferenceStats(exerciseId)
                .orElseThrow(() -> new IllegalStateException("Reference statistics unavailable for exercise " + exerciseId));
    }

    @Override
    public void verify(UUID referenceId) {
        if (!referenceMatcher.promoteToVerified(referenceId)) {
            throw new ResourceNotFoundException("Reference " + referenceId + " not found");
        }
    }

    @Override
    public void deactivate(UUID referenceId) {
        if (!referenceMatcher.deactivate(referenceId)) {
            throw new ResourceNotFoundException("Reference " + referenceId + " not found");
        }
    }

    @Override
    public SeedingStatus getSeedingStatus(List<String> exerciseIds) {
        List<String> ids = exerciseIds == null || exerciseIds.isEmpty()
                ? exerciseCatalog.findAll().stream().map(Exercise::getId).toList()
                : exerciseIds;
        return referenceMatcher.getSeedingStatus(ids);
    }

    private Exercise requireExercise(String exerciseId) {
        return exerciseCatalog.findById(exerciseId)
                .orElseThrow(() -> new ResourceNotFoundException("Exercise " + exerciseId + " not found"));
    }

    private static boolean hasEmbedding(float[] embedding) {
        return embedding != null && embedding.length > 0;
    }
}
