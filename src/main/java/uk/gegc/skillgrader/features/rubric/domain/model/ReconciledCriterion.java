package uk.gegc.skillgrader.features.rubric.domain.model;

/**
 * Reconciled score of one canonical criterion.
 *
 * @param matchedLabel judge label mapped onto this criterion, {@code null} when defaulted
 */
public record ReconciledCriterion(
        double pointsAwarded,
        int maxPoints,
        String rationale,
        String matchedLabel
) {

    public boolean defaulted() {
        return matchedLabel == null;
    }
}
