/**
 * Schema loading, validation and discovery, plus the environment-driven
 * {@link com.fleetaudit.core.config.NormalizerConfig}.
 *
 * <p>
 * Schemas are defined in YAML and loaded by
 * {@link com.fleetaudit.core.config.SchemaLoader}. Validation runs right after
 * parsing so that a bad schema fails fast instead of producing empty reports.
 * </p>
 *
 * @since 1.0.0
 */
package com.fleetaudit.core.config;
