package uk.gegc.skillgrader.features.embedding.application;

import java.util.Optional;

/**
 * Produces an embedding vector for a text. Implementations never throw: a failed or slow call yields
 * an empty result, which downstream scoring treats as a missing signal.
 */
public interface EmbeddingProvider {

    Optional<float[]> embed(String text);
}
