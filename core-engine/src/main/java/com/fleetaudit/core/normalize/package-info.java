/**
 * Entry point: {@link com.fleetaudit.core.normalize.SchemaNormalizer} turns a
 * raw bundle into a {@link com.fleetaudit.core.normalize.NormalizedReport}.
 *
 * @since 1.0.0
 */
package com.fleetaudit.core.normalize;
