package com.fleetaudit.core.condition;

import java.util.Objects;

/**
 * Fires when a numeric field lies in the half-open interval {@code [min, max)}.
 */
public record RangeCondition(String field, double min, double max) implements Condition {

    public RangeCondition {
        Objects.requireNonNull(field, "field must not be null");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitRange(this);
    }
}
