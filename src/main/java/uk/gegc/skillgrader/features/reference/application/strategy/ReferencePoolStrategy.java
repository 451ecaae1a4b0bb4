package uk.gegc.skillgrader.features.reference.application.strategy;

import uk.gegc.skillgrader.features.reference.domain.model.PoolCandidate;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceAnswer;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceMatchConfig;

import java.util.List;

/**
 * One tier of the comparison pool. Fetching (I/O) is separated from ranking (pure) so the matcher can
 * issue every tier's fetch concurrently and combine only once all of them have resolved.
 */
public interface ReferencePoolStrategy {

    PoolTier tier();

    /**
     * Multiplier applied to this tier's similarities when folded into weighted aggregates.
     */
    double weightMultiplier(ReferenceMatchConfig config);

    /**
     * Minimum-evidence gate: whether this tier contributes given the pool size resolved by earlier tiers.
     */
    boolean isRequired(int evidenceSoFar, ReferenceMatchConfig config);

    List<ReferenceAnswer> fetch(PoolQuery query, ReferenceMatchConfig config);

    /**
     * Scores fetched references, drops those this tier does not accept and returns at most {@code limit},
     * best first.
     */
    List<PoolCandidate> rank(List<ReferenceAnswer> fetched, PoolQuery query, ReferenceMatchConfig config, int limit);
}
