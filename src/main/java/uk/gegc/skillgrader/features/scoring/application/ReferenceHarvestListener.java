package uk.gegc.skillgrader.features.scoring.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import uk.gegc.skillgrader.features.integrity.domain.model.RiskLevel;
import uk.gegc.skillgrader.features.reference.application.ReferenceMatcher;
import uk.gegc.skillgrader.features.reference.config.ReferenceProperties;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceCandidate;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceInsertOutcome;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceSourceKind;
import uk.gegc.skillgrader.features.scoring.domain.event.SubmissionScoredEvent;
import uk.gegc.skillgrader.features.scoring.domain.model.SubmissionEvaluation;

/**
 * Offers high-scoring submissions to the reference bank once scoring has finished.
 * <p>
 * High-risk submissions are never harvested so that copied answers cannot seed the bank.
 * </p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReferenceHarvestListener {

    private final ReferenceMatcher referenceMatcher;
    private final ReferenceProperties referenceProperties;

    @Async("generalTaskExecutor")
    @EventListener
    public void onSubmissionScored(SubmissionScoredEvent event) {
        SubmissionEvaluation evaluation = event.getEvaluation();
        if (event.getSubmissionEmbedding() == null
                || evaluation.finalScore() < referenceProperties.getQualityThreshold()
                || evaluation.integrity().riskLevel() == RiskLevel.HIGH) {
            return;
        }

        try {
            ReferenceInsertOutcome outcome = referenceMatcher.addReferenceAnswer(new ReferenceCandidate(
                    evaluation.exerciseId(),
                    event.getSubmission(),
                    evaluation.finalScore(),
                    event.getSubmissionEmbedding(),
                    ReferenceSourceKind.LEARNER,
                    event.getSkillCategory(),
                    event.getDifficulty(),
                    evaluation.judgmentScore(),
                    evaluation.validatorScore(),
                    evaluation.embeddingSimilarity()
            ));
            log.debug("Reference harvest: exerciseId={}, added={}, reason={}",
                    evaluation.exerciseId(), outcome.added(), outcome.reason());
        } catch (Exception e) {
            log.warn("Reference harvest failed for exercise {}: {}", evaluation.exerciseId(), e.getMessage());
        }
    }
}
