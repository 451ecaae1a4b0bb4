package uk.gegc.skillgrader.features.clustering.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import uk.gegc.skillgrader.features.clustering.api.dto.ClusterInsightsRequest;
import uk.gegc.skillgrader.features.clustering.api.dto.ExerciseComparisonResponse;
import uk.gegc.skillgrader.features.clustering.config.ClusteringProperties;
import uk.gegc.skillgrader.features.clustering.domain.model.ClusterInsight;
import uk.gegc.skillgrader.features.clustering.domain.model.ClusterProgress;
import uk.gegc.skillgrader.features.clustering.domain.model.ExerciseSimilarity;
import uk.gegc.skillgrader.features.clustering.domain.model.RelatedExercise;
import uk.gegc.skillgrader.features.clustering.domain.model.SkillCluster;
import uk.gegc.skillgrader.features.exercise.application.ExerciseCatalog;
import uk.gegc.skillgrader.features.exercise.domain.model.Exercise;
import uk.gegc.skillgrader.features.exercise.domain.model.ExerciseEmbeddingRecord;
import uk.gegc.skillgrader.shared.exception.ResourceNotFoundException;

import java.util.List;

/**
 * Catalog-backed entry points for cluster queries.
 */
@Service
@RequiredArgsConstructor
public class ClusterQueryService {

    private final SkillClusterAnalyzer skillClusterAnalyzer;
    private final ClusterProgressProvider clusterProgressProvider;
    private final ExerciseCatalog exerciseCatalog;
    private final ClusteringProperties clusteringProperties;

    public ExerciseComparisonResponse compare(String exerciseIdA, String exerciseIdB) {
        ExerciseEmbeddingRecord a = skillClusterAnalyzer.describe(requireExercise(exerciseIdA));
        ExerciseEmbeddingRecord b = skillClusterAnalyzer.describe(requireExercise(exerciseIdB));
        ExerciseSimilarity similarity = skillClusterAnalyzer.computeExerciseSimilarity(a, b);
        return new ExerciseComparisonResponse(
                exerciseIdA,
                exerciseIdB,
                similarity,
                skillClusterAnalyzer.determineRelationship(a, b, similarity.content())
        );
    }

    public List<RelatedExercise> related(String exerciseId, Integer limit, Double minSimilarity) {
        return skillClusterAnalyzer.findRelatedExercises(
                exerciseId,
                limit != null ? limit : clusteringProperties.getRelatedLimit(),
                minSimilarity != null ? minSimilarity : clusteringProperties.getMinSimilarity()
        );
    }

    public List<ClusterInsight> insights(ClusterInsightsRequest request) {
        Exercise exercise = requireExercise(request.exerciseId());
        ClusterProgress progress = request.progress();
        if (progress == null && request.learnerId() != null) {
            progress = clusterProgressProvider.findProgress(request.learnerId(), exercise.getSkillCategory()).orElse(null);
        }
        List<RelatedExercise> related = skillClusterAnalyzer.findRelatedExercises(
                exercise.getId(), clusteringProperties.getRelatedLimit());
        return skillClusterAnalyzer.generateInsights(request.currentScore(), related, progress);
    }

    public List<SkillCluster> clusters() {
        return skillClusterAnalyzer.buildSkillClusters(exerciseCatalog.findAll());
    }

    private Exercise requireExercise(String exerciseId) {
        return exerciseCatalog.findById(exerciseId)
                .orElseThrow(() -> new ResourceNotFoundException("Exercise " + exerciseId + " not found"));
    }
}
