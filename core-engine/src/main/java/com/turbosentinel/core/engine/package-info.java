/**
 * The unit analysis engine and its per-tag pipeline.
 *
 * @since 1.0.0
 */
package com.turbosentinel.core.engine;
