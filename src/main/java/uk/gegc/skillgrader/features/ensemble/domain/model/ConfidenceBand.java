package uk.gegc.skillgrader.features.ensemble.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ConfidenceBand {
    HIGH,
    MEDIUM,
    LOW;

    public static ConfidenceBand fromConfidence(int confidence) {
        if (confidence >= 75) {
            return HIGH;
        }
        if (confidence >= 50) {
            return MEDIUM;
        }
        return LOW;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
