package uk.gegc.skillgrader.features.reference.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import uk.gegc.skillgrader.features.exercise.domain.model.Difficulty;
import uk.gegc.skillgrader.features.reference.application.ReferenceMatcher;
import uk.gegc.skillgrader.features.reference.application.ReferencePersistence;
import uk.gegc.skillgrader.features.reference.application.strategy.PoolQuery;
import uk.gegc.skillgrader.features.reference.application.strategy.PoolTier;
import uk.gegc.skillgrader.features.reference.application.strategy.ReferencePoolStrategy;
import uk.gegc.skillgrader.features.reference.application.strategy.ReferencePoolStrategyRegistry;
import uk.gegc.skillgrader.features.reference.config.ReferenceProperties;
import uk.gegc.skillgrader.features.reference.domain.model.PoolCandidate;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceAnswer;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceCandidate;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceInsertOutcome;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceMatchConfig;
import uk.gegc.skillgrader.features.reference.domain.model.ReferencePoolResult;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceSourceKind;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceStats;
import uk.gegc.skillgrader.features.reference.domain.model.SeedingStatus;
import uk.gegc.skillgrader.features.scoring.application.ScoringMetricsService;
import uk.gegc.skillgrader.features.similarity.application.SimilarityKernel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.IntSummaryStatistics;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

@Slf4j
@Service
public class ReferenceMatcherImpl implements ReferenceMatcher {

    static final String PERSISTENCE_ERROR = "Persistence error";

    private final ReferencePersistence referencePersistence;
    private final ReferencePoolStrategyRegistry strategyRegistry;
    private final SimilarityKernel similarityKernel;
    private final ReferenceProperties referenceProperties;
    private final ScoringMetricsService metricsService;
    private final Executor scoringTaskExecutor;

    public ReferenceMatcherImpl(ReferencePersistence referencePersistence,
                                ReferencePoolStrategyRegistry strategyRegistry,
                                SimilarityKernel similarityKernel,
                                ReferenceProperties referenceProperties,
                                ScoringMetricsService metricsService,
                                @Qualifier("scoringTaskExecutor") Executor scoringTaskExecutor) {
        this.referencePersistence = referencePersistence;
        this.strategyRegistry = strategyRegistry;
        this.similarityKernel = similarityKernel;
        this.referenceProperties = referenceProperties;
        this.metricsService = metricsService;
        this.scoringTaskExecutor = scoringTaskExecutor;
    }

    @Override
    public ReferencePoolResult matchReferences(String exerciseId,
                                               float[] embedding,
                                               String skillCategory,
                                               Difficulty difficulty) {
        return matchReferences(exerciseId, embedding, skillCategory, difficulty, referenceProperties.toMatchConfig());
    }

    @Override
    public ReferencePoolResult matchReferences(String exerciseId,
                                               float[] embedding,
                                               String skillCategory,
                                               Difficulty difficulty,
                                               ReferenceMatchConfig config) {
        if (embedding == null || embedding.length == 0) {
            return ReferencePoolResult.empty();
        }

        PoolQuery query = new PoolQuery(exerciseId, embedding, skillCategory, difficulty);
        List<ReferencePoolStrategy> strategies = strategyRegistry.ordered();

        // every tier is fetched up front; tiers are combined only after all fetches resolve
        List<CompletableFuture<List<ReferenceAnswer>>> fetches = strategies.stream()
                .map(strategy -> CompletableFuture.supplyAsync(() -> strategy.fetch(query, config), scoringTaskExecutor))
                .toList();

        List<String> failures = new ArrayList<>();
        List<PoolCandidate> combined = new ArrayList<>();

        for (int i = 0; i < strategies.size(); i++) {
            ReferencePoolStrategy strategy = strategies.get(i);
            List<ReferenceAnswer> fetched = await(fetches.get(i), strategy.tier(), exerciseId, failures);
            int evidence = combined.size();
            if (fetched == null || !strategy.isRequired(evidence, config)) {
                continue;
            }
            List<PoolCandidate> ranked = strategy.rank(fetched, query, config, config.topK() - evidence);
            log.debug("Pool tier resolved: exerciseId={}, tier={}, fetched={}, accepted={}",
                    exerciseId, strategy.tier(), fetched.size(), ranked.size());
            combined.addAll(ranked);
        }

        List<PoolCandidate> pool = combined.stream()
                .sorted(Comparator.comparingDouble(PoolCandidate::adjustedSimilarity).reversed())
                .limit(config.topK())
                .toList();

        ReferencePoolResult result = summarize(pool, config, failures);
        if (result.usedCrossExerciseFallback()) {
            metricsService.recordCrossExerciseFallback();
        }
        if (result.failed()) {
            metricsService.recordReferenceLookupFailure();
        }

        log.info("Reference pool resolved: exerciseId={}, direct={}, cross={}, avgSimilarity={}, percentile={}, failed={}",
                exerciseId, result.fromCurrentExercise(), result.fromCrossExercise(),
                String.format("%.3f", result.averageSimilarity()), result.percentileEstimate(), result.failed());
        return result;
    }

    private List<ReferenceAnswer> await(CompletableFuture<List<ReferenceAnswer>> fetch,
                                        PoolTier tier,
                                        String exerciseId,
                                        List<String> failures) {
        try {
            List<ReferenceAnswer> fetched = fetch.join();
            return fetched != null ? fetched : List.of();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Reference lookup failed: exerciseId={}, tier={}, error={}", exerciseId, tier, cause.getMessage());
            failures.add(tier.name().toLowerCase(Locale.ROOT) + " lookup failed: " + cause.getMessage());
            return null;
        }
    }

    private ReferencePoolResult summarize(List<PoolCandidate> pool, ReferenceMatchConfig config, List<String> failures) {
        boolean failed = !failures.isEmpty();
        String failureReason = failed ? String.join("; ", failures) : null;

        if (pool.isEmpty()) {
            return new ReferencePoolResult(List.of(), 0.0, 0.0, 0, 0, 0.0, 50, false, 0, 0, List.of(), 0.0,
                    failed, failureReason);
        }

        double averageSimilarity = pool.stream().mapToDouble(PoolCandidate::adjustedSimilarity).average().orElse(0.0);
        PoolCandidate best = pool.get(0);
        int goodMatches = (int) pool.stream()
                .filter(candidate -> candidate.adjustedSimilarity() >= config.matchThreshold())
                .count();

        double totalWeight = pool.stream().mapToDouble(PoolCandidate::weight).sum();
        double weightedScore = totalWeight > 0
                ? pool.stream().mapToDouble(candidate -> candidate.weight() * candidate.score()).sum() / totalWeight
                : 0.0;

        long percentile = Math.round(averageSimilarity * 50
                + best.adjustedSimilarity() * 30
                + (double) goodMatches / pool.size() * 20);
        int percentileEstimate = (int) Math.min(99, Math.max(1, percentile));

        List<PoolCandidate> crossCandidates = pool.stream().filter(PoolCandidate::crossExercise).toList();
        List<String> sourceExercises = crossCandidates.stream()
                .map(PoolCandidate::exerciseId)
                .distinct()
                .toList();

        int verified = (int) pool.stream().filter(PoolCandidate::verified).count();
        double poolWeight = calculateMultiReferenceWeight(ReferenceStats.of(pool.size(), verified));

        return new ReferencePoolResult(
                pool,
                averageSimilarity,
                best.adjustedSimilarity(),
                best.score(),
                goodMatches,
                weightedScore,
                percentileEstimate,
                !crossCandidates.isEmpty(),
                pool.size() - crossCandidates.size(),
                crossCandidates.size(),
                sourceExercises,
                poolWeight,
                failed,
                failureReason
        );
    }

    @Override
    public ReferenceInsertOutcome addReferenceAnswer(ReferenceCandidate candidate) {
        ReferenceInsertOutcome outcome = insert(candidate);
        metricsService.recordReferenceInsert(outcome.added());
        if (outcome.added()) {
            log.info("Reference added: exerciseId={}, id={}, score={}, source={}",
                    candidate.exerciseId(), outcome.id(), candidate.score(), candidate.sourceKind());
        } else {
            log.debug("Reference rejected: exerciseId={}, reason={}", candidate.exerciseId(), outcome.reason());
        }
        return outcome;
    }

    private ReferenceInsertOutcome insert(ReferenceCandidate candidate) {
        int threshold = referenceProperties.getQualityThreshold();
        if (candidate.score() < threshold) {
            return ReferenceInsertOutcome.rejected("Score " + candidate.score() + " below threshold " + threshold);
        }
        if (candidate.embedding() == null || candidate.embedding().length == 0) {
            return ReferenceInsertOutcome.rejected("Missing embedding");
        }

        try {
            List<ReferenceAnswer> existing = referencePersistence.findByExercise(candidate.exerciseId(), 0);
            double duplicateThreshold = referenceProperties.getDuplicateThreshold();
            for (ReferenceAnswer reference : existing) {
                if (reference.getEmbedding() != null
                        && similarityKernel.cosineSimilarity(candidate.embedding(), reference.getEmbedding()) > duplicateThreshold) {
                    return ReferenceInsertOutcome.rejected(
                            "Duplicate detected (>" + Math.round(duplicateThreshold * 100) + "% similarity)");
                }
            }

            UUID id = referencePersistence.insert(toReference(candidate));
            return ReferenceInsertOutcome.added(id);
        } catch (RuntimeException e) {
            log.warn("Reference insert failed: exerciseId={}, error={}", candidate.exerciseId(), e.getMessage());
            return ReferenceInsertOutcome.rejected(PERSISTENCE_ERROR);
        }
    }

    private static ReferenceAnswer toReference(ReferenceCandidate candidate) {
        ReferenceAnswer reference = new ReferenceAnswer();
        reference.setExerciseId(candidate.exerciseId());
        reference.setSubmissionText(candidate.submissionText());
        reference.setScore(candidate.score());
        reference.setEmbedding(candidate.embedding());
        reference.setSourceKind(candidate.sourceKind() != null ? candidate.sourceKind() : ReferenceSourceKind.LEARNER);
        reference.setVerified(false);
        reference.setActive(true);
        reference.setSkillCategory(candidate.skillCategory());
        reference.setDifficulty(candidate.difficulty());
        reference.setJudgmentScore(candidate.judgmentScore());
        reference.setValidatorScore(candidate.validatorScore());
        reference.setEmbeddingSimilarity(candidate.embeddingSimilarity());
        return reference;
    }

    @Override
    public ReferenceInsertOutcome seedReference(ReferenceCandidate candidate, boolean verifyImmediately) {
        ReferenceInsertOutcome outcome = addReferenceAnswer(candidate.withSourceKind(ReferenceSourceKind.CURATED));
        if (outcome.added() && verifyImmediately) {
            try {
                referencePersistence.markVerified(outcome.id(), false);
            } catch (RuntimeException e) {
                log.warn("Seeded reference could not be verified: id={}, error={}", outcome.id(), e.getMessage());
            }
        }
        return outcome;
    }

    @Override
    public boolean promoteToVerified(UUID referenceId) {
        try {
            boolean promoted = referencePersistence.markVerified(referenceId, true);
            if (promoted) {
                log.info("Reference {} promoted to verified", referenceId);
            }
            return promoted;
        } catch (RuntimeException e) {
            log.warn("Error promoting reference {}: {}", referenceId, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean deactivate(UUID referenceId) {
        try {
            boolean deactivated = referencePersistence.deactivate(referenceId);
            if (deactivated) {
                log.info("Reference {} deactivated", referenceId);
            }
            return deactivated;
        } catch (RuntimeException e) {
            log.warn("Error deactivating reference {}: {}", referenceId, e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<ReferenceStats> getReferenceStats(String exerciseId) {
        try {
            List<ReferenceAnswer> references = referencePersistence.findByExercise(exerciseId, 0);
            if (references.isEmpty()) {
                return Optional.of(new ReferenceStats(0, 0, 0.0, 0, 0, 0, 0, 0));
            }

            IntSummaryStatistics scores = references.stream().mapToInt(ReferenceAnswer::getScore).summaryStatistics();
            return Optional.of(new ReferenceStats(
                    references.size(),
                    (int) references.stream().filter(ReferenceAnswer::isVerified).count(),
                    scores.getAverage(),
                    scores.getMin(),
                    scores.getMax(),
                    countBySource(references, ReferenceSourceKind.LEARNER),
                    countBySource(references, ReferenceSourceKind.CURATED),
                    countBySource(references, ReferenceSourceKind.SEED_EXAMPLE)
            ));
        } catch (RuntimeException e) {
            log.warn("Error getting reference stats: exerciseId={}, error={}", exerciseId, e.getMessage());
            return Optional.empty();
        }
    }

    private static int countBySource(List<ReferenceAnswer> references, ReferenceSourceKind kind) {
        return (int) references.stream().filter(reference -> reference.getSourceKind() == kind).count();
    }

    @Override
    public SeedingStatus getSeedingStatus(List<String> exerciseIds) {
        List<String> ids = exerciseIds == null ? List.of() : exerciseIds;
        Map<String, Long> counts;
        try {
            counts = referencePersistence.countActiveByExercise();
        } catch (RuntimeException e) {
            log.warn("Error getting seeding status: {}", e.getMessage());
            return new SeedingStatus(0, ids.size(), List.of(), List.of(), List.copyOf(ids));
        }

        List<String> wellSeeded = new ArrayList<>();
        List<String> partiallySeeded = new ArrayList<>();
        List<String> notSeeded = new ArrayList<>();
        for (String exerciseId : ids) {
            long count = counts.getOrDefault(exerciseId, 0L);
            if (count >= 5) {
                wellSeeded.add(exerciseId);
            } else if (count > 0) {
                partiallySeeded.add(exerciseId);
            } else {
                notSeeded.add(exerciseId);
            }
        }
        return new SeedingStatus(
                wellSeeded.size() + partiallySeeded.size(),
                notSeeded.size(),
                wellSeeded,
                partiallySeeded,
                notSeeded
        );
    }

    @Override
    public double calculateMultiReferenceWeight(ReferenceStats stats) {
        if (stats == null || stats.totalReferences() == 0) {
            return 0.0;
        }
        ReferenceProperties.Weight weight = referenceProperties.getWeight();

        double result = weight.getBase();
        result += Math.min(weight.getMaxVerifiedBonus(), stats.verifiedCount() * weight.getPerVerified());
        if (stats.totalReferences() >= 10) {
            result += 0.02;
        } else if (stats.totalReferences() >= 5) {
            result += 0.01;
        }
        return Math.min(weight.getCap(), result);
    }

    @Override
    public int referenceAdjustment(ReferencePoolResult result) {
        if (result == null || result.isEmpty()) {
            return 0;
        }
        double poolWeight = result.poolWeight();
        if (result.usedCrossExerciseFallback()) {
            poolWeight *= referenceProperties.getCrossExercise().getWeightMultiplier();
        }
        return (int) Math.round((result.averageSimilarity() - 0.5) * 20 * poolWeight * 10);
    }
}
