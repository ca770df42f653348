/**
 * Domain model for schema-driven normalization.
 *
 * <p>
 * A {@link com.fleetaudit.core.model.Schema} declares typed
 * {@link com.fleetaudit.core.model.FieldSpec}s, alert rules and widgets.
 * Normalizing a host produces {@link com.fleetaudit.core.model.Alert}s and an
 * overall {@link com.fleetaudit.core.model.Health}.
 * </p>
 *
 * @since 1.0.0
 */
package com.fleetaudit.core.model;
