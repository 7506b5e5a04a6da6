/**
 * Independent verification of detection candidates: the local tau test, the
 * random cut forest and the layer that combines them.
 *
 * @since 1.0.0
 */
package com.turbosentinel.core.verification;
