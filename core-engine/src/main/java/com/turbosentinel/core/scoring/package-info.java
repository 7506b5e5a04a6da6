/**
 * Confidence scoring strategies, priority derivation and the recency-based
 * actionability gate.
 *
 * @since 1.0.0
 */
package com.turbosentinel.core.scoring;
