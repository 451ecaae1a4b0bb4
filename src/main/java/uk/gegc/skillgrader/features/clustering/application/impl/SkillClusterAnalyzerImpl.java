package uk.gegc.skillgrader.features.clustering.application.impl;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import uk.gegc.skillgrader.features.clustering.application.SkillClusterAnalyzer;
import uk.gegc.skillgrader.features.clustering.config.ClusteringProperties;
import uk.gegc.skillgrader.features.clustering.domain.model.ClusterInsight;
import uk.gegc.skillgrader.features.clustering.domain.model.ClusterProgress;
import uk.gegc.skillgrader.features.clustering.domain.model.ExerciseSimilarity;
import uk.gegc.skillgrader.features.clustering.domain.model.InsightMetrics;
import uk.gegc.skillgrader.features.clustering.domain.model.InsightType;
import uk.gegc.skillgrader.features.clustering.domain.model.RelatedExercise;
import uk.gegc.skillgrader.features.clustering.domain.model.RelationshipType;
import uk.gegc.skillgrader.features.clustering.domain.model.ScoreTrend;
import uk.gegc.skillgrader.features.clustering.domain.model.SkillCluster;
import uk.gegc.skillgrader.features.embedding.application.EmbeddingService;
import uk.gegc.skillgrader.features.exercise.application.ExerciseCatalog;
import uk.gegc.skillgrader.features.exercise.domain.event.ExerciseCatalogChangedEvent;
import uk.gegc.skillgrader.features.exercise.domain.model.Difficulty;
import uk.gegc.skillgrader.features.exercise.domain.model.Exercise;
import uk.gegc.skillgrader.features.exercise.domain.model.ExerciseEmbeddingRecord;
import uk.gegc.skillgrader.features.similarity.application.SimilarityKernel;
import uk.gegc.skillgrader.shared.exception.ResourceNotFoundException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

@Slf4j
@Service
@RequiredArgsConstructor
public class SkillClusterAnalyzerImpl implements SkillClusterAnalyzer {

    private final ExerciseCatalog exerciseCatalog;
    private final EmbeddingService embeddingService;
    private final SimilarityKernel similarityKernel;
    private final ClusteringProperties clusteringProperties;
    private final Cache<String, ExerciseSimilarity> exerciseSimilarityCache;

    @Override
    public ExerciseSimilarity computeExerciseSimilarity(ExerciseEmbeddingRecord a, ExerciseEmbeddingRecord b) {
        // pairs missing an embedding are recomputed so a provider outage is not remembered
        if (a.exerciseId() == null || b.exerciseId() == null || !hasEmbedding(a) || !hasEmbedding(b)) {
            return calculate(a, b);
        }
        return exerciseSimilarityCache.get(pairKey(a.exerciseId(), b.exerciseId()), key -> calculate(a, b));
    }

    private ExerciseSimilarity calculate(ExerciseEmbeddingRecord a, ExerciseEmbeddingRecord b) {
        double content = similarityKernel.cosineSimilarity(a.contentEmbedding(), b.contentEmbedding());
        double skill = sameSkill(a, b) ? 1.0 : 0.3;

        int tierDelta = Math.abs(tier(a.difficulty()) - tier(b.difficulty()));
        double difficulty = tierDelta == 0 ? 1.0 : tierDelta == 1 ? 0.7 : 0.4;

        double overall = content * clusteringProperties.getContentWeight()
                + skill * clusteringProperties.getSkillWeight()
                + difficulty * clusteringProperties.getDifficultyWeight();
        return new ExerciseSimilarity(Math.min(1.0, overall), content, skill, difficulty);
    }

    private static boolean hasEmbedding(ExerciseEmbeddingRecord record) {
        return record.contentEmbedding() != null && record.contentEmbedding().length > 0;
    }

    static String pairKey(String idA, String idB) {
        return idA.compareTo(idB) <= 0 ? idA + ":" + idB : idB + ":" + idA;
    }

    @Override
    public RelationshipType determineRelationship(ExerciseEmbeddingRecord a,
                                                  ExerciseEmbeddingRecord b,
                                                  double contentSimilarity) {
        if (sameSkill(a, b)) {
            int tierA = tier(a.difficulty());
            int tierB = tier(b.difficulty());
            if (tierB < tierA) {
                return RelationshipType.PREREQUISITE;
            }
            if (tierB > tierA) {
                return RelationshipType.ADVANCED;
            }
            return RelationshipType.PARALLEL;
        }
        if (contentSimilarity > clusteringProperties.getVariationThreshold()) {
            return RelationshipType.VARIATION;
        }
        return RelationshipType.RELATED;
    }

    @Override
    public List<RelatedExercise> findRelatedExercises(String exerciseId, int limit) {
        return findRelatedExercises(exerciseId, limit, clusteringProperties.getMinSimilarity());
    }

    @Override
    public List<RelatedExercise> findRelatedExercises(String exerciseId, int limit, double minSimilarity) {
        Exercise source = exerciseCatalog.findById(exerciseId)
                .orElseThrow(() -> new ResourceNotFoundException("Exercise " + exerciseId + " not found"));
        ExerciseEmbeddingRecord sourceRecord = describe(source);

        List<RelatedExercise> related = new ArrayList<>();
        for (Exercise candidate : exerciseCatalog.findAll()) {
            if (candidate.getId().equals(exerciseId)) {
                continue;
            }
            ExerciseEmbeddingRecord candidateRecord = describe(candidate);
            ExerciseSimilarity similarity = computeExerciseSimilarity(sourceRecord, candidateRecord);
            if (similarity.overall() < minSimilarity) {
                continue;
            }
            related.add(new RelatedExercise(
                    candidate.getId(),
                    candidate.getTitle(),
                    candidate.getSkillCategory(),
                    candidate.getDifficulty(),
                    round4(similarity.overall()),
                    determineRelationship(sourceRecord, candidateRecord, similarity.content())
            ));
        }

        List<RelatedExercise> result = related.stream()
                .sorted(Comparator.comparingDouble(RelatedExercise::similarity).reversed()
                        .thenComparing(RelatedExercise::exerciseId))
                .limit(Math.max(0, limit))
                .toList();
        log.debug("Related exercises resolved: exerciseId={}, candidates={}, returned={}",
                exerciseId, related.size(), result.size());
        return result;
    }

    @Override
    public List<ClusterInsight> generateInsights(int currentScore, List<RelatedExercise> related, ClusterProgress progress) {
        List<RelatedExercise> relatedExercises = related != null ? related : List.of();
        List<ClusterInsight> insights = new ArrayList<>();

        if (currentScore >= clusteringProperties.getMasteryScore()) {
            insights.add(new ClusterInsight(
                    InsightType.MASTERY,
                    "Skill Mastery",
                    "Excellent! Your score of " + currentScore + " shows strong mastery in this skill area.",
                    relatedExercises.stream().limit(3).map(RelatedExercise::exerciseId).toList(),
                    new InsightMetrics(null, currentScore, null, null)
            ));
        }

        if (progress != null) {
            if (progress.trend() == ScoreTrend.IMPROVING) {
                insights.add(new ClusterInsight(
                        InsightType.IMPROVEMENT,
                        "Skill Growth",
                        String.format(Locale.ROOT, "You're improving in %s exercises! Your average has increased by %.0f%%.",
                                progress.primarySkill(), progress.improvementRate()),
                        List.of(),
                        new InsightMetrics(null, null, progress.improvementRate(), progress.avgScore())
                ));
            } else if (progress.trend() == ScoreTrend.DECLINING
                    && progress.gamesPlayed() >= clusteringProperties.getDecliningMinAttempts()) {
                insights.add(new ClusterInsight(
                        InsightType.STRUGGLE,
                        "Area for Focus",
                        "Your recent " + progress.primarySkill()
                                + " scores are lower than usual. Consider reviewing fundamentals.",
                        List.of(),
                        new InsightMetrics(progress.bestScore(), currentScore, null, progress.avgScore())
                ));
            }

            double completion = progress.completionRate();
            if (completion > 0 && completion < 1) {
                int remaining = progress.totalGames() - progress.gamesPlayed();
                insights.add(new ClusterInsight(
                        InsightType.RECOMMENDATION,
                        "Cluster Progress",
                        "You've completed " + progress.gamesPlayed() + "/" + progress.totalGames()
                                + " exercises in this skill cluster. " + remaining + " more to go!",
                        relatedExercises.stream()
                                .filter(exercise -> exercise.skillCategory() != null
                                        && exercise.skillCategory().equalsIgnoreCase(progress.primarySkill()))
                                .map(RelatedExercise::exerciseId)
                                .toList(),
                        null
                ));
            }
        }

        List<String> prerequisites = idsOf(relatedExercises, RelationshipType.PREREQUISITE);
        if (!prerequisites.isEmpty() && currentScore < clusteringProperties.getProficientScore()) {
            insights.add(new ClusterInsight(
                    InsightType.RECOMMENDATION,
                    "Build Foundation First",
                    "Consider trying some easier related exercises to build your foundational skills.",
                    prerequisites,
                    null
            ));
        }

        List<String> advanced = idsOf(relatedExercises, RelationshipType.ADVANCED);
        if (!advanced.isEmpty() && currentScore >= clusteringProperties.getProficientScore()) {
            insights.add(new ClusterInsight(
                    InsightType.RECOMMENDATION,
                    "Ready for More Challenge",
                    "Great performance! Try some more advanced exercises in this area.",
                    advanced,
                    null
            ));
        }

        return insights;
    }

    private static List<String> idsOf(List<RelatedExercise> related, RelationshipType type) {
        return related.stream()
                .filter(exercise -> exercise.relationshipType() == type)
                .limit(2)
                .map(RelatedExercise::exerciseId)
                .toList();
    }

    @Override
    public List<SkillCluster> buildSkillClusters(List<Exercise> exercises) {
        Map<String, List<Exercise>> bySkill = new TreeMap<>();
        for (Exercise exercise : exercises) {
            String skill = exercise.getSkillCategory() == null ? "general"
                    : exercise.getSkillCategory().trim().toLowerCase(Locale.ROOT);
            bySkill.computeIfAbsent(skill, key -> new ArrayList<>()).add(exercise);
        }

        List<SkillCluster> clusters = new ArrayList<>();
        bySkill.forEach((skill, members) -> {
            double averageDifficulty = members.stream()
                    .mapToInt(exercise -> tier(exercise.getDifficulty()))
                    .average()
                    .orElse(Difficulty.MEDIUM.getTier());
            clusters.add(new SkillCluster(
                    "skill:" + skill,
                    displayName(skill),
                    skill,
                    members.stream().map(Exercise::getId).sorted().toList(),
                    Math.round(averageDifficulty * 100.0) / 100.0,
                    members.size()
            ));
        });
        return clusters;
    }

    private static String displayName(String skill) {
        if (skill.isEmpty()) {
            return skill;
        }
        return Character.toUpperCase(skill.charAt(0)) + skill.substring(1) + " Skills";
    }

    @Override
    public List<String> extractSkillTags(Exercise exercise) {
        Set<String> tags = new LinkedHashSet<>();
        if (exercise.getSkillCategory() != null) {
            tags.add(exercise.getSkillCategory());
        }
        String text = (exercise.getTitle() + " " + exercise.getDescription()).toLowerCase(Locale.ROOT);

        for (Map.Entry<String, String> entry : clusteringProperties.getSkillTagPatterns().entrySet()) {
            try {
                if (Pattern.compile(entry.getValue(), Pattern.CASE_INSENSITIVE).matcher(text).find()) {
                    tags.add(entry.getKey());
                }
            } catch (PatternSyntaxException e) {
                log.warn("Invalid skill tag pattern: tag={}, pattern={}, error={}",
                        entry.getKey(), entry.getValue(), e.getDescription());
            }
        }
        return List.copyOf(tags);
    }

    @Override
    public ExerciseEmbeddingRecord describe(Exercise exercise) {
        float[] embedding = exercise.getContentEmbedding();
        if (embedding == null || embedding.length == 0) {
            embedding = embeddingService.embedForExercise(exercise.getId(), exercise.contentText())
                    .orElse(new float[0]);
        }
        return new ExerciseEmbeddingRecord(
                exercise.getId(),
                exercise.getSkillCategory(),
                exercise.getDifficulty(),
                embedding,
                extractSkillTags(exercise)
        );
    }

    @Override
    public void invalidate() {
        exerciseSimilarityCache.invalidateAll();
        log.debug("Exercise similarity cache cleared");
    }

    @EventListener
    public void onCatalogChanged(ExerciseCatalogChangedEvent event) {
        invalidate();
    }

    private static boolean sameSkill(ExerciseEmbeddingRecord a, ExerciseEmbeddingRecord b) {
        return a.skillCategory() != null && a.skillCategory().equalsIgnoreCase(b.skillCategory());
    }

    private static int tier(Difficulty difficulty) {
        return difficulty != null ? difficulty.getTier() : Difficulty.MEDIUM.getTier();
    }

    private static double round4(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
