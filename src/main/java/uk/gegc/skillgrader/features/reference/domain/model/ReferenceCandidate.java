package uk.gegc.skillgrader.features.reference.domain.model;

import uk.gegc.skillgrader.features.exercise.domain.model.Difficulty;

/**
 * A submission proposed for the reference bank. Optional fields may be {@code null}.
 */
public record ReferenceCandidate(
        String exerciseId,
        String submissionText,
        int score,
        float[] embedding,
        ReferenceSourceKind sourceKind,
        String skillCategory,
        Difficulty difficulty,
        Integer judgmentScore,
        Integer validatorScore,
        Double embeddingSimilarity
) {

    public ReferenceCandidate withSourceKind(ReferenceSourceKind kind) {
        return new ReferenceCandidate(exerciseId, submissionText, score, embedding, kind, skillCategory,
                difficulty, judgmentScore, validatorScore, embeddingSimilarity);
    }
}
