package uk.gegc.skillgrader.features.reference.domain.model;

import java.util.List;

/**
 * Exercises grouped by how many active references they have: well seeded (5+), partially seeded (1-4)
 * and not seeded (0).
 */
public record SeedingStatus(
        int seeded,
        int needsSeeding,
        List<String> wellSeeded,
        List<String> partiallySeeded,
        List<String> notSeeded
) {
}
