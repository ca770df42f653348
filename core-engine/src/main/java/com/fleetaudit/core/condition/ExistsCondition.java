package com.fleetaudit.core.condition;

import java.util.Objects;

/**
 * {@code exists} / {@code not_exists}: a field exists when it is present,
 * non-null and not an empty list or map.
 *
 * @param field    field name
 * @param negated  {@code true} for {@code not_exists}
 */
public record ExistsCondition(String field, boolean negated) implements Condition {

    public ExistsCondition {
        Objects.requireNonNull(field, "field must not be null");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitExists(this);
    }
}
