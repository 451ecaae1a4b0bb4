package uk.gegc.skillgrader.features.reference.domain.model;

public record ReferenceStats(
        int totalReferences,
        int verifiedCount,
        double averageScore,
        int minScore,
        int maxScore,
        int learnerSubmissions,
        int curatedSubmissions,
        int seedExamples
) {

    public static ReferenceStats of(int totalReferences, int verifiedCount) {
        return new ReferenceStats(totalReferences, verifiedCount, 0.0, 0, 0, 0, 0, 0);
    }
}
