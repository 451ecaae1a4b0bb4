package uk.gegc.skillgrader.features.clustering.application;

import uk.gegc.skillgrader.features.clustering.domain.model.ClusterInsight;
import uk.gegc.skillgrader.features.clustering.domain.model.ClusterProgress;
import uk.gegc.skillgrader.features.clustering.domain.model.ExerciseSimilarity;
import uk.gegc.skillgrader.features.clustering.domain.model.RelatedExercise;
import uk.gegc.skillgrader.features.clustering.domain.model.RelationshipType;
import uk.gegc.skillgrader.features.clustering.domain.model.SkillCluster;
import uk.gegc.skillgrader.features.exercise.domain.model.Exercise;
import uk.gegc.skillgrader.features.exercise.domain.model.ExerciseEmbeddingRecord;

import java.util.List;

/**
 * Groups exercises by skill, difficulty and content, and turns a learner's cluster progress into insights.
 */
public interface SkillClusterAnalyzer {

    /**
     * Weighted blend of content, skill and difficulty similarity. Cached per unordered pair of exercise ids.
     */
    ExerciseSimilarity computeExerciseSimilarity(ExerciseEmbeddingRecord a, ExerciseEmbeddingRecord b);

    /**
     * Relationship of {@code b} as seen from {@code a}.
     */
    RelationshipType determineRelationship(ExerciseEmbeddingRecord a, ExerciseEmbeddingRecord b, double contentSimilarity);

    /**
     * @throws uk.gegc.skillgrader.shared.exception.ResourceNotFoundException when the exercise is unknown
     */
    List<RelatedExercise> findRelatedExercises(String exerciseId, int limit, double minSimilarity);

    List<RelatedExercise> findRelatedExercises(String exerciseId, int limit);

    /**
     * @param progress may be {@code null} when no snapshot exists for the learner
     */
    List<ClusterInsight> generateInsights(int currentScore, List<RelatedExercise> related, ClusterProgress progress);

    List<SkillCluster> buildSkillClusters(List<Exercise> exercises);

    List<String> extractSkillTags(Exercise exercise);

    ExerciseEmbeddingRecord describe(Exercise exercise);

    void invalidate();
}
