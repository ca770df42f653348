package com.fleetaudit.core.field;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Typed fields extracted for one host plus path coverage.
 *
 * @param fields   field name to coerced value (unmodifiable, may hold {@code null})
 * @param coverage path coverage
 */
public record ExtractionResult(Map<String, Object> fields, Coverage coverage) {

    public ExtractionResult {
        Objects.requireNonNull(fields, "fields must not be null");
        Objects.requireNonNull(coverage, "coverage must not be null");
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }
}
