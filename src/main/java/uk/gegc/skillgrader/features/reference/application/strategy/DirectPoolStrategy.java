package uk.gegc.skillgrader.features.reference.application.strategy;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.skillgrader.features.reference.application.ReferencePersistence;
import uk.gegc.skillgrader.features.reference.domain.model.PoolCandidate;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceAnswer;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceMatchConfig;
import uk.gegc.skillgrader.features.similarity.application.SimilarityKernel;

import java.util.Comparator;
import java.util.List;

/**
 * References of the exercise itself, ranked over the whole active bank of the exercise. Low-similarity entries
 * are kept: they still count towards averages.
 */
@Component
@RequiredArgsConstructor
public class DirectPoolStrategy implements ReferencePoolStrategy {

    private final ReferencePersistence referencePersistence;
    private final SimilarityKernel similarityKernel;

    @Override
    public PoolTier tier() {
        return PoolTier.DIRECT;
    }

    @Override
    public double weightMultiplier(ReferenceMatchConfig config) {
        return 1.0;
    }

    @Override
    public boolean isRequired(int evidenceSoFar, ReferenceMatchConfig config) {
        return true;
    }

    @Override
    public List<ReferenceAnswer> fetch(PoolQuery query, ReferenceMatchConfig config) {
        return referencePersistence.findByExercise(query.exerciseId(), config.qualityThreshold());
    }

    @Override
    public List<PoolCandidate> rank(List<ReferenceAnswer> fetched, PoolQuery query, ReferenceMatchConfig config, int limit) {
        return fetched.stream()
                .filter(reference -> reference.getEmbedding() != null)
                .map(reference -> {
                    double similarity = similarityKernel.cosineSimilarity(query.embedding(), reference.getEmbedding());
                    return new PoolCandidate(
                            reference.getId(),
                            reference.getExerciseId(),
                            reference.getSubmissionText(),
                            reference.getScore(),
                            similarity,
                            similarity,
                            similarity * weightMultiplier(config),
                            reference.getSourceKind(),
                            reference.isVerified(),
                            false,
                            reference.getDifficulty()
                    );
                })
                .sorted(Comparator.comparingDouble(PoolCandidate::adjustedSimilarity).reversed())
                .limit(Math.max(0, limit))
                .toList();
    }
}
