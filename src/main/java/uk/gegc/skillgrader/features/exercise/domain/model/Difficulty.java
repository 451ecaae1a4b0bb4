package uk.gegc.skillgrader.features.exercise.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Exercise difficulty tier. Unknown or missing values resolve to {@link #MEDIUM}.
 */
public enum Difficulty {
    EASY(1),
    MEDIUM(2),
    HARD(3);

    private final int tier;

    Difficulty(int tier) {
        this.tier = tier;
    }

    public int getTier() {
        return tier;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Difficulty fromValue(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        for (Difficulty difficulty : values()) {
            if (difficulty.name().equalsIgnoreCase(value.trim())) {
                return difficulty;
            }
        }
        return MEDIUM;
    }
}
