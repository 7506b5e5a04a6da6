/**
 * Unit-level aggregation and selection of actionable anomalies.
 *
 * @since 1.0.0
 */
package com.turbosentinel.core.report;
