package uk.gegc.skillgrader.features.scoring.application;

import uk.gegc.skillgrader.features.scoring.api.dto.EvaluateSubmissionRequest;
import uk.gegc.skillgrader.features.scoring.domain.model.SubmissionEvaluation;

public interface SubmissionScoringService {

    /**
     * Runs the full scoring pipeline for one submission.
     *
     * @throws uk.gegc.skillgrader.shared.exception.ResourceNotFoundException when the exercise is unknown
     */
    SubmissionEvaluation evaluate(EvaluateSubmissionRequest request);
}
