/**
 * Configuration loading and validation for the Signal Sentinel engine.
 *
 * <p>
 * Thresholds and cooldowns are defined in YAML and loaded by
 * {@link com.signalsentinel.core.config.EngineConfigLoader} into an
 * {@link com.signalsentinel.core.config.EngineConfig}. Validation runs
 * automatically after parsing so a misconfigured deployment fails at startup.
 * </p>
 *
 * @since 1.0.0
 */
package com.signalsentinel.core.config;
