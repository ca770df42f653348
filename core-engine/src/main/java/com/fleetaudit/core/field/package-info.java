/**
 * Field extraction: path resolution with transforms, type coercion and the
 * multi-pass {@link com.fleetaudit.core.field.FieldExtractor}.
 *
 * @since 1.0.0
 */
package com.fleetaudit.core.field;
