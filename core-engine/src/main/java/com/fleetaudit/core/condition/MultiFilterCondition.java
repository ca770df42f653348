package com.fleetaudit.core.condition;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Like {@link FilterCountCondition}, but an item is only counted when it
 * matches <em>all</em> of the filters.
 */
public record MultiFilterCondition(String field, List<Filter> filters, double threshold) implements Condition {

    public MultiFilterCondition {
        Objects.requireNonNull(field, "field must not be null");
        filters = filters != null ? List.copyOf(filters) : List.of();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitMultiFilter(this);
    }

    /**
     * One equality test applied to a list item.
     */
    public record Filter(String filterField, Object filterValue) implements Serializable {
        public Filter {
            Objects.requireNonNull(filterField, "filterField must not be null");
        }
    }
}
