package uk.gegc.skillgrader.features.scoring.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import uk.gegc.skillgrader.features.clustering.application.ClusterProgressProvider;
import uk.gegc.skillgrader.features.clustering.application.SkillClusterAnalyzer;
import uk.gegc.skillgrader.features.clustering.config.ClusteringProperties;
import uk.gegc.skillgrader.features.clustering.domain.model.ClusterInsight;
import uk.gegc.skillgrader.features.clustering.domain.model.ClusterProgress;
import uk.gegc.skillgrader.features.clustering.domain.model.RelatedExercise;
import uk.gegc.skillgrader.features.scoring.domain.event.SubmissionScoredEvent;

import java.util.List;

/**
 * Derives progression insights for the learner after scoring. Results are logged only.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ClusterInsightListener {

    private final SkillClusterAnalyzer skillClusterAnalyzer;
    private final ClusterProgressProvider clusterProgressProvider;
    private final ClusteringProperties clusteringProperties;

    @Async("generalTaskExecutor")
    @EventListener
    public void onSubmissionScored(SubmissionScoredEvent event) {
        String exerciseId = event.getEvaluation().exerciseId();
        try {
            List<RelatedExercise> related = skillClusterAnalyzer.findRelatedExercises(
                    exerciseId, clusteringProperties.getRelatedLimit());
            ClusterProgress progress = event.getLearnerId() == null ? null
                    : clusterProgressProvider.findProgress(event.getLearnerId(), event.getSkillCategory()).orElse(null);

            List<ClusterInsight> insights = skillClusterAnalyzer.generateInsights(
                    event.getEvaluation().finalScore(), related, progress);
            log.info("Cluster insights: exerciseId={}, learnerId={}, related={}, insights={}",
                    exerciseId, event.getLearnerId(), related.size(),
                    insights.stream().map(ClusterInsight::title).toList());
        } catch (Exception e) {
            log.warn("Cluster insight generation failed for exercise {}: {}", exerciseId, e.getMessage());
        }
    }
}
