/**
 * Immutable domain model of the anomaly engine: sensor samples and series,
 * detection candidates, verification verdicts, per-tag summaries and unit
 * reports.
 *
 * <p>
 * Classes in this package are thread-safe value objects with no behaviour
 * beyond validation, except {@link com.turbosentinel.core.model.TagLifecycle}
 * which is owned by a single tag task.
 * </p>
 *
 * @since 1.0.0
 */
package com.turbosentinel.core.model;
