package com.fleetaudit.core.condition;

import java.io.Serializable;

/**
 * A predicate over an extracted field map, declared by an alert rule.
 *
 * <p>
 * The hierarchy is closed: every variant is listed in the {@code permits}
 * clause and has a matching method on {@link Visitor}, so adding a variant
 * forces every visitor (in particular {@link ConditionEvaluator}) to handle
 * it.
 * </p>
 *
 * @since 1.0.0
 */
public sealed interface Condition extends Serializable
        permits ThresholdCondition, RangeCondition, ExistsCondition, FilterCountCondition,
        MultiFilterCondition, StringCondition, StringInCondition, ComputedFilterCondition,
        DateThresholdCondition {

    /**
     * @return name of the field the condition inspects
     */
    String field();

    /**
     * Dispatch to the visitor method for this variant.
     *
     * @param visitor the visitor
     * @param <R>     visitor result type
     * @return the visitor's result
     */
    <R> R accept(Visitor<R> visitor);

    /**
     * One method per condition variant.
     *
     * @param <R> result type
     */
    interface Visitor<R> {

        R visitThreshold(ThresholdCondition condition);

        R visitRange(RangeCondition condition);

        R visitExists(ExistsCondition condition);

        R visitFilterCount(FilterCountCondition condition);

        R visitMultiFilter(MultiFilterCondition condition);

        R visitString(StringCondition condition);

        R visitStringIn(StringInCondition condition);

        R visitComputedFilter(ComputedFilterCondition condition);

        R visitDateThreshold(DateThresholdCondition condition);
    }
}
