package com.turbosentinel.core.config;

/**
 * How a tag's confidence score is computed.
 *
 * @since 1.0.0
 */
public enum ConfidenceStrategy {

    /** Base points plus recency, persistence and candidate-rate components. */
    ADDITIVE,

    /** Sum of fixed per-detector budgets for the detectors that fired. */
    FIXED_BUDGET
}
