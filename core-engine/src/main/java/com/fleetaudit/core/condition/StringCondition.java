package com.fleetaudit.core.condition;

import java.util.Objects;

/**
 * {@code eq_str} / {@code ne_str}: case-sensitive string comparison.
 */
public record StringCondition(String field, String value, boolean negated) implements Condition {

    public StringCondition {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitString(this);
    }
}
