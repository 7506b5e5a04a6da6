/**
 * Operating-state classification from explicitly configured speed tags.
 *
 * @since 1.0.0
 */
package com.turbosentinel.core.state;
