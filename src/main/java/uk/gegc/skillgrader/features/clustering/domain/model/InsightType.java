package uk.gegc.skillgrader.features.clustering.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum InsightType {
    MASTERY,
    IMPROVEMENT,
    STRUGGLE,
    RECOMMENDATION;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
