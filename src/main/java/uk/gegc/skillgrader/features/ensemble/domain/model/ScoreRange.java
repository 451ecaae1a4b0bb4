package uk.gegc.skillgrader.features.ensemble.domain.model;

public record ScoreRange(int low, int high) {
}
