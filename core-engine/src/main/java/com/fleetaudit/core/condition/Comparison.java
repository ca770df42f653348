package com.fleetaudit.core.condition;

import java.util.Locale;

/**
 * Numeric comparison operators shared by threshold, computed-filter and date
 * conditions.
 *
 * @since 1.0.0
 */
public enum Comparison {

    GT("gt") {
        @Override
        public boolean test(double value, double threshold) {
            return value > threshold;
        }
    },
    LT("lt") {
        @Override
        public boolean test(double value, double threshold) {
            return value < threshold;
        }
    },
    GTE("gte") {
        @Override
        public boolean test(double value, double threshold) {
            return value >= threshold;
        }
    },
    LTE("lte") {
        @Override
        public boolean test(double value, double threshold) {
            return value <= threshold;
        }
    },
    EQ("eq") {
        @Override
        public boolean test(double value, double threshold) {
            return value == threshold;
        }
    },
    NE("ne") {
        @Override
        public boolean test(double value, double threshold) {
            return value != threshold;
        }
    };

    private final String op;

    Comparison(String op) {
        this.op = op;
    }

    /**
     * Apply the operator with the value on the left-hand side.
     *
     * @param value     observed value
     * @param threshold configured threshold
     * @return comparison outcome
     */
    public abstract boolean test(double value, double threshold);

    /**
     * @return the operator name used in schema YAML, e.g. {@code "gte"}
     */
    public String op() {
        return op;
    }

    /**
     * Parse a schema operator name.
     *
     * @param op operator name such as {@code "lte"}
     * @return the comparison
     * @throws IllegalArgumentException if the name is unknown
     */
    public static Comparison fromOp(String op) {
        if (op != null) {
            String normalized = op.trim().toLowerCase(Locale.ROOT);
            for (Comparison c : values()) {
                if (c.op.equals(normalized)) {
                    return c;
                }
            }
        }
        throw new IllegalArgumentException("Unknown comparison operator: '" + op
                + "'. Supported: gt, lt, gte, lte, eq, ne");
    }
}
