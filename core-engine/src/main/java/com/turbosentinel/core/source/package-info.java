/**
 * Boundary to the storage collaborator that supplies sensor series.
 *
 * @since 1.0.0
 */
package com.turbosentinel.core.source;
