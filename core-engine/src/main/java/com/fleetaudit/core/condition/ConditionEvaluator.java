package com.fleetaudit.core.condition;

import com.fleetaudit.core.expression.ExpressionEvaluator;
import com.fleetaudit.core.expression.ExpressionException;
import com.fleetaudit.core.model.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Evaluates alert {@link Condition}s against an extracted field map.
 *
 * <p>
 * Each variant is handled by its own visitor method. A condition whose field
 * is missing or has the wrong shape is simply {@code false}; any unexpected
 * runtime error is logged and also yields {@code false}, so one bad rule never
 * prevents the others from being evaluated.
 * </p>
 *
 * <p>
 * Instances hold only immutable collaborators and are thread-safe. The
 * {@link Clock} is used as "now" for date conditions without a reference
 * field.
 * </p>
 *
 * @since 1.0.0
 */
public class ConditionEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(ConditionEvaluator.class);

    private static final double SECONDS_PER_DAY = 86_400.0;

    private final ExpressionEvaluator expressions;
    private final Clock clock;

    public ConditionEvaluator(ExpressionEvaluator expressions, Clock clock) {
        this.expressions = Objects.requireNonNull(expressions, "expressions must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public ConditionEvaluator() {
        this(new ExpressionEvaluator(), Clock.systemUTC());
    }

    /**
     * @param condition condition to test
     * @param fields    extracted fields
     * @return whether the condition holds; {@code false} on any error
     */
    public boolean evaluate(Condition condition, Map<String, ?> fields) {
        Objects.requireNonNull(condition, "condition must not be null");
        try {
            return condition.accept(new Visit(fields != null ? fields : Map.of()));
        } catch (RuntimeException e) {
            LOG.warn("Condition on field '{}' failed: {}", condition.field(), e.toString());
            return false;
        }
    }

    private final class Visit implements Condition.Visitor<Boolean> {

        private final Map<String, ?> fields;

        Visit(Map<String, ?> fields) {
            this.fields = fields;
        }

        @Override
        public Boolean visitThreshold(ThresholdCondition c) {
            return Values.toDouble(fields.get(c.field()))
                    .map(v -> c.op().test(v, c.threshold()))
                    .orElse(false);
        }

        @Override
        public Boolean visitRange(RangeCondition c) {
            // a missing field counts as 0, a present non-numeric one never matches
            Optional<Double> value = fields.containsKey(c.field())
                    ? Values.toDouble(fields.get(c.field()))
                    : Optional.of(0.0);
            return value.map(v -> c.min() <= v && v < c.max()).orElse(false);
        }

        @Override
        public Boolean visitExists(ExistsCondition c) {
            boolean exists = !Values.isEmpty(fields.get(c.field()));
            return c.negated() != exists;
        }

        @Override
        public Boolean visitFilterCount(FilterCountCondition c) {
            long count = items(c.field()).stream()
                    .filter(item -> item instanceof Map<?, ?> m
                            && Values.looselyEquals(m.get(c.filterField()), c.filterValue()))
                    .count();
            return count > c.threshold();
        }

        @Override
        public Boolean visitMultiFilter(MultiFilterCondition c) {
            long count = items(c.field()).stream()
                    .filter(item -> item instanceof Map<?, ?> m && c.filters().stream()
                            .allMatch(f -> Values.looselyEquals(m.get(f.filterField()), f.filterValue())))
                    .count();
            return count > c.threshold();
        }

        @Override
        public Boolean visitString(StringCondition c) {
            boolean equal = Values.stringify(fields.get(c.field())).equals(c.value());
            return c.negated() != equal;
        }

        @Override
        public Boolean visitStringIn(StringInCondition c) {
            boolean member = c.values().contains(Values.stringify(fields.get(c.field())));
            return c.negated() != member;
        }

        @Override
        public Boolean visitComputedFilter(ComputedFilterCondition c) {
            if (c.isRange() ? (c.min() == null || c.max() == null) : c.threshold() == null) {
                return false;
            }
            for (Object item : items(c.field())) {
                if (!(item instanceof Map<?, ?> m)) {
                    continue;
                }
                Optional<Double> value = evaluateItem(c.expression(), m);
                if (value.isPresent() && matches(c, value.get())) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public Boolean visitDateThreshold(DateThresholdCondition c) {
            Optional<Instant> timestamp = Timestamps.parse(fields.get(c.field()));
            if (timestamp.isEmpty()) {
                return false;
            }
            Instant reference = c.referenceField() != null
                    ? Timestamps.parse(fields.get(c.referenceField())).orElseGet(clock::instant)
                    : clock.instant();
            Duration age = Duration.between(timestamp.get(), reference);
            double days = (age.getSeconds() + age.getNano() / 1_000_000_000.0) / SECONDS_PER_DAY;
            return c.op().test(days, c.days());
        }

        private List<Object> items(String field) {
            return Values.asList(fields.get(field));
        }
    }

    private static boolean matches(ComputedFilterCondition c, double value) {
        if (c.isRange()) {
            return c.min() <= value && value < c.max();
        }
        return c.cmp().test(value, c.threshold());
    }

    private Optional<Double> evaluateItem(String expression, Map<?, ?> item) {
        Map<String, Object> copy = new LinkedHashMap<>();
        item.forEach((k, v) -> copy.put(String.valueOf(k), v));
        try {
            return Optional.of(expressions.evaluate(expression, copy));
        } catch (ExpressionException e) {
            LOG.trace("Skipping item: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
