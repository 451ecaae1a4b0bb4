package uk.gegc.skillgrader.features.clustering.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ScoreTrend {
    IMPROVING,
    STABLE,
    DECLINING,
    NEW;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
