package com.fleetaudit.core.condition;

import java.util.Objects;

/**
 * Compares a numeric field against a literal, e.g. {@code cpu_pct gt 90}.
 */
public record ThresholdCondition(String field, Comparison op, double threshold) implements Condition {

    public ThresholdCondition {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(op, "op must not be null");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitThreshold(this);
    }
}
