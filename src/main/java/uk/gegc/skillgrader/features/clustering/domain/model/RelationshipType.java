package uk.gegc.skillgrader.features.clustering.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a related exercise stands relative to the one it was compared against.
 */
public enum RelationshipType {
    /** Same skill, easier. */
    PREREQUISITE,
    /** Same skill, same tier. */
    PARALLEL,
    /** Same skill, harder. */
    ADVANCED,
    /** Different skill, very similar content. */
    VARIATION,
    RELATED;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
