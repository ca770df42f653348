package com.fleetaudit.core.field;

/**
 * A named post-processing step applied to a resolved path value, written
 * {@code "some.path | name"} in a schema.
 *
 * <p>
 * Transforms receive {@code null} when the path did not resolve and may
 * return {@code null} to signal "absent".
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface FieldTransform {

    /**
     * @param value resolved value, or {@code null} if absent
     * @return transformed value, or {@code null} for absent
     */
    Object apply(Object value);
}
