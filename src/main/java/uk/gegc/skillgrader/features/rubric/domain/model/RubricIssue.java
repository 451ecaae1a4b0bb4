package uk.gegc.skillgrader.features.rubric.domain.model;

/**
 * A structured rubric finding. {@code criterion}, {@code expected} and {@code actual} are optional.
 */
public record RubricIssue(
        RubricIssueType type,
        IssueSeverity severity,
        String criterion,
        String message,
        Double expected,
        Double actual
) {

    public boolean isError() {
        return severity == IssueSeverity.ERROR;
    }
}
