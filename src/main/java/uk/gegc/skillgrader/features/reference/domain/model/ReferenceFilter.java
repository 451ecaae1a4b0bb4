package uk.gegc.skillgrader.features.reference.domain.model;

/**
 * Query restriction for reference lookups. Only active references are ever returned.
 *
 * @param minScore minimum stored score, inclusive
 * @param limit    maximum rows to fetch
 */
public record ReferenceFilter(int minScore, int limit) {
}
