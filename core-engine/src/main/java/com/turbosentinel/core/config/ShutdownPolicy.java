package com.turbosentinel.core.config;

/**
 * What happens to tag analysis while the unit is shut down.
 *
 * @since 1.0.0
 */
public enum ShutdownPolicy {

    /** No candidates are generated; every tag is reported as suppressed. */
    SUPPRESS_ANALYSIS,

    /** Tags are analysed normally and the report only carries the state. */
    ANNOTATE_ONLY
}
