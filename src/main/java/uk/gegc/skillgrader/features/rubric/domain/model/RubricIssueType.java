package uk.gegc.skillgrader.features.rubric.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RubricIssueType {
    MISSING_CRITERION("missing_criterion"),
    EXTRA_CRITERION("extra_criterion"),
    EXCEEDS_MAX("exceeds_max"),
    NEGATIVE_POINTS("negative_points"),
    INVALID_MAX("invalid_max"),
    SCORE_MISMATCH("score_mismatch");

    private final String code;

    RubricIssueType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
