package uk.gegc.skillgrader.features.clustering.infra;

import org.springframework.stereotype.Component;
import uk.gegc.skillgrader.features.clustering.application.ClusterProgressProvider;
import uk.gegc.skillgrader.features.clustering.domain.model.ClusterProgress;

import java.util.Optional;

/**
 * Used until a progress store is wired in; insights then rely on the current score and related exercises only.
 */
@Component
public class NoOpClusterProgressProvider implements ClusterProgressProvider {

    @Override
    public Optional<ClusterProgress> findProgress(String learnerId, String skillCategory) {
        return Optional.empty();
    }
}
