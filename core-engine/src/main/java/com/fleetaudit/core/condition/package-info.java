/**
 * Alert conditions and their evaluation.
 *
 * <p>
 * Every condition variant is a record implementing the sealed
 * {@link com.fleetaudit.core.condition.Condition} interface;
 * {@link com.fleetaudit.core.condition.ConditionEvaluator} visits them.
 * </p>
 *
 * @since 1.0.0
 */
package com.fleetaudit.core.condition;
