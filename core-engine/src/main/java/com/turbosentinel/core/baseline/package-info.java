/**
 * Rolling per-tag baseline used to standardise readings.
 *
 * @since 1.0.0
 */
package com.turbosentinel.core.baseline;
