package uk.gegc.skillgrader.features.reference.application.strategy;

/**
 * Evaluation order of pool strategies.
 */
public enum PoolTier {
    DIRECT,
    CROSS_EXERCISE
}
