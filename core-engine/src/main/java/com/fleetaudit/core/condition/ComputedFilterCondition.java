package com.fleetaudit.core.condition;

import java.util.Objects;

/**
 * Evaluates an arithmetic expression against every item of a list field,
 * substituting the item's own keys, and fires when any item matches.
 *
 * <p>
 * Either {@code cmp} and {@code threshold} are set, or {@code cmp} is
 * {@code null} and the item matches when the result lies in
 * {@code [min, max)}. Missing parameters make the condition never fire.
 * </p>
 *
 * @param field      list field
 * @param expression expression such as {@code "{freeSpace} / {capacity} * 100"}
 * @param cmp        comparison, or {@code null} for a range test
 * @param threshold  threshold for {@code cmp}
 * @param min        inclusive lower bound for a range test
 * @param max        exclusive upper bound for a range test
 */
public record ComputedFilterCondition(String field, String expression, Comparison cmp,
                                      Double threshold, Double min, Double max) implements Condition {

    public ComputedFilterCondition {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(expression, "expression must not be null");
    }

    public static ComputedFilterCondition compare(String field, String expression, Comparison cmp, double threshold) {
        return new ComputedFilterCondition(field, expression, Objects.requireNonNull(cmp, "cmp must not be null"),
                threshold, null, null);
    }

    public static ComputedFilterCondition range(String field, String expression, double min, double max) {
        return new ComputedFilterCondition(field, expression, null, null, min, max);
    }

    /**
     * @return {@code true} when this is a range test rather than a comparison
     */
    public boolean isRange() {
        return cmp == null;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitComputedFilter(this);
    }
}
