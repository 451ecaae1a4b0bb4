package uk.gegc.skillgrader.features.clustering.domain.model;

/**
 * Snapshot of a learner's standing within one skill cluster. Computed and stored elsewhere.
 *
 * @param gamesPlayed     distinct exercises of the cluster the learner has attempted
 * @param totalGames      exercises in the cluster
 * @param improvementRate percentage change of the recent average over the earlier one
 */
public record ClusterProgress(
        String clusterId,
        String primarySkill,
        int gamesPlayed,
        int totalGames,
        double avgScore,
        int bestScore,
        ScoreTrend trend,
        double improvementRate
) {

    public double completionRate() {
        return totalGames > 0 ? (double) gamesPlayed / totalGames : 0.0;
    }
}
