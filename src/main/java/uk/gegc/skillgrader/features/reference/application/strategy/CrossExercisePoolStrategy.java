package uk.gegc.skillgrader.features.reference.application.strategy;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.skillgrader.features.reference.application.ReferencePersistence;
import uk.gegc.skillgrader.features.reference.domain.model.PoolCandidate;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceAnswer;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceFilter;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceMatchConfig;
import uk.gegc.skillgrader.features.similarity.application.SimilarityKernel;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Borrowed evidence from other exercises in the same skill category. Similarities are penalised for the
 * different context, nudged up for the same difficulty, and must clear a stricter minimum.
 */
@Component
@RequiredArgsConstructor
public class CrossExercisePoolStrategy implements ReferencePoolStrategy {

    private final ReferencePersistence referencePersistence;
    private final SimilarityKernel similarityKernel;

    @Override
    public PoolTier tier() {
        return PoolTier.CROSS_EXERCISE;
    }

    @Override
    public double weightMultiplier(ReferenceMatchConfig config) {
        return config.crossExerciseWeightMultiplier();
    }

    @Override
    public boolean isRequired(int evidenceSoFar, ReferenceMatchConfig config) {
        return config.crossExerciseEnabled() && evidenceSoFar < config.fallbackMinimum();
    }

    @Override
    public List<ReferenceAnswer> fetch(PoolQuery query, ReferenceMatchConfig config) {
        if (!config.crossExerciseEnabled() || query.skillCategory() == null || query.skillCategory().isBlank()) {
            return List.of();
        }
        // over-fetch: many candidates fall below the minimum after the penalty
        return referencePersistence.findCrossExercise(
                query.skillCategory(),
                query.exerciseId(),
                new ReferenceFilter(config.qualityThreshold(), config.maxCrossExerciseCandidates() * 2)
        );
    }

    @Override
    public List<PoolCandidate> rank(List<ReferenceAnswer> fetched, PoolQuery query, ReferenceMatchConfig config, int limit) {
        int effectiveLimit = Math.max(0, Math.min(limit, config.maxCrossExerciseCandidates()));
        return fetched.stream()
                .filter(reference -> reference.getEmbedding() != null)
                .filter(reference -> !Objects.equals(reference.getExerciseId(), query.exerciseId()))
                .map(reference -> toCandidate(reference, query, config))
                .filter(candidate -> candidate.adjustedSimilarity() >= config.crossExerciseMinSimilarity())
                .sorted(Comparator.comparingDouble(PoolCandidate::adjustedSimilarity).reversed())
                .limit(effectiveLimit)
                .toList();
    }

    private PoolCandidate toCandidate(ReferenceAnswer reference, PoolQuery query, ReferenceMatchConfig config) {
        double similarity = similarityKernel.cosineSimilarity(query.embedding(), reference.getEmbedding());
        double adjusted = similarity - config.crossExercisePenalty();
        if (query.difficulty() != null && query.difficulty() == reference.getDifficulty()) {
            adjusted += config.sameDifficultyBonus();
        }
        adjusted = round4(Math.max(0.0, Math.min(1.0, adjusted)));

        return new PoolCandidate(
                reference.getId(),
                reference.getExerciseId(),
                reference.getSubmissionText(),
                reference.getScore(),
                similarity,
                adjusted,
                adjusted * weightMultiplier(config),
                reference.getSourceKind(),
                reference.isVerified(),
                true,
                reference.getDifficulty()
        );
    }

    // float embeddings leave artefacts like 0.59999 at the minimum boundary
    private static double round4(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
