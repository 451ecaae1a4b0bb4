package uk.gegc.skillgrader.features.reference.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ReferenceSourceKind {
    LEARNER,
    CURATED,
    SEED_EXAMPLE;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
