package uk.gegc.skillgrader.features.scoring.domain.event;

import org.springframework.context.ApplicationEvent;
import uk.gegc.skillgrader.features.exercise.domain.model.Difficulty;
import uk.gegc.skillgrader.features.scoring.domain.model.SubmissionEvaluation;

/**
 * Published after a submission has been scored. Listeners run after the response is built and cannot
 * change the evaluation.
 */
public class SubmissionScoredEvent extends ApplicationEvent {

    private final String learnerId;
    private final String submission;
    private final float[] submissionEmbedding;
    private final String skillCategory;
    private final Difficulty difficulty;
    private final SubmissionEvaluation evaluation;

    public SubmissionScoredEvent(Object source,
                                 String learnerId,
                                 String submission,
                                 float[] submissionEmbedding,
                                 String skillCategory,
                                 Difficulty difficulty,
                                 SubmissionEvaluation evaluation) {
        super(source);
        this.learnerId = learnerId;
        this.submission = submission;
        this.submissionEmbedding = submissionEmbedding;
        this.skillCategory = skillCategory;
        this.difficulty = difficulty;
        this.evaluation = evaluation;
    }

    public String getLearnerId() {
        return learnerId;
    }

    public String getSubmission() {
        return submission;
    }

    /**
     * @return the submission embedding, or {@code null} when none could be produced
     */
    public float[] getSubmissionEmbedding() {
        return submissionEmbedding;
    }

    public String getSkillCategory() {
        return skillCategory;
    }

    public Difficulty getDifficulty() {
        return difficulty;
    }

    public SubmissionEvaluation getEvaluation() {
        return evaluation;
    }
}
