package com.fleetaudit.core.condition;

import java.util.Objects;

/**
 * Counts the items of a list field whose {@code filterField} equals
 * {@code filterValue}; fires when the count is strictly greater than
 * {@code threshold}.
 */
public record FilterCountCondition(String field, String filterField, Object filterValue, double threshold)
        implements Condition {

    public FilterCountCondition {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(filterField, "filterField must not be null");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitFilterCount(this);
    }
}
