package com.fleetaudit.core.condition;

import java.util.Objects;

/**
 * Compares the age in days of an ISO-8601 timestamp field against a
 * threshold ({@code age_gt}, {@code age_lt}, {@code age_gte}, {@code age_lte}).
 *
 * <p>
 * Age is measured against {@code referenceField} when declared and parseable,
 * otherwise against the current time.
 * </p>
 */
public record DateThresholdCondition(String field, Comparison op, double days, String referenceField)
        implements Condition {

    public DateThresholdCondition {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(op, "op must not be null");
        if (op == Comparison.EQ || op == Comparison.NE) {
            throw new IllegalArgumentException("Date thresholds support gt, lt, gte and lte only, got: " + op.op());
        }
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitDateThreshold(this);
    }
}
