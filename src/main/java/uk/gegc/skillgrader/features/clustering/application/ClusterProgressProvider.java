package uk.gegc.skillgrader.features.clustering.application;

import uk.gegc.skillgrader.features.clustering.domain.model.ClusterProgress;

import java.util.Optional;

/**
 * Source of learner progress snapshots. Progress is aggregated and stored outside this service.
 */
public interface ClusterProgressProvider {

    Optional<ClusterProgress> findProgress(String learnerId, String skillCategory);
}
