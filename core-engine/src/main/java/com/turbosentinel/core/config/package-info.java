/**
 * Engine configuration: the immutable
 * {@link com.turbosentinel.core.config.DetectionConfig} and
 * {@link com.turbosentinel.core.config.UnitProfile} values used at runtime,
 * and the mutable YAML settings POJOs loaded by
 * {@link com.turbosentinel.core.config.EngineConfigLoader}.
 *
 * @since 1.0.0
 */
package com.turbosentinel.core.config;
