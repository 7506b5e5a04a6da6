/**
 * Unchecked exceptions raised by the engine, rooted at
 * {@link com.turbosentinel.core.error.DetectionException}.
 *
 * @since 1.0.0
 */
package com.turbosentinel.core.error;
