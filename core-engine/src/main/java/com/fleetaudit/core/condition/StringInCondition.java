package com.fleetaudit.core.condition;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * {@code in_str} / {@code not_in_str}: membership of the field's string form
 * in a literal set.
 */
public record StringInCondition(String field, Set<String> values, boolean negated) implements Condition {

    public StringInCondition {
        Objects.requireNonNull(field, "field must not be null");
        values = values != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(values))
                : Set.of();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitStringIn(this);
    }
}
