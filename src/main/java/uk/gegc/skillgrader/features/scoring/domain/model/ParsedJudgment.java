package uk.gegc.skillgrader.features.scoring.domain.model;

import uk.gegc.skillgrader.features.rubric.domain.model.CriterionJudgment;

import java.util.List;

/**
 * Judge output after schema checking.
 * <p>
 * A malformed judgment still carries whatever could be recovered. Without a score the judgment
 * contributes no signal to the ensemble.
 * </p>
 *
 * @param score           claimed overall score clamped to {@code [0, 100]}, {@code null} when absent or unreadable
 * @param malformedReason {@code null} unless {@code malformed}
 */
public record ParsedJudgment(
        Integer score,
        String feedback,
        List<CriterionJudgment> breakdown,
        List<String> strengths,
        List<String> improvements,
        boolean malformed,
        String malformedReason
) {

    public static ParsedJudgment malformed(String reason) {
        return new ParsedJudgment(null, null, List.of(), List.of(), List.of(), true, reason);
    }

    public boolean hasScore() {
        return score != null;
    }
}
