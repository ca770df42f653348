package com.fleetaudit.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Helpers for reading the untyped values found in raw bundles and field maps.
 *
 * <p>
 * Raw audit data arrives as nested {@link Map}s produced by a JSON or YAML
 * parser, so values can be any of {@link String}, {@link Number},
 * {@link Boolean}, {@link List} or {@link Map}. These helpers give every
 * component the same view of "numeric", "empty" and "equal".
 * </p>
 *
 * @since 1.0.0
 */
public final class Values {

    /** Decimal literal accepted for string-encoded numbers. */
    private static final Pattern NUMERIC = Pattern.compile(
            "[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private Values() {
        // utility class
    }

    /**
     * Read a value as a {@code double}.
     *
     * <p>
     * Handles {@link Number} subclasses natively, booleans as {@code 1}/{@code 0},
     * and parses string-encoded decimal numbers (surrounding whitespace
     * tolerated).
     * </p>
     *
     * @param value any value, may be {@code null}
     * @return the numeric value, or empty if the value is absent or not numeric
     */
    public static Optional<Double> toDouble(Object value) {
        if (value instanceof Boolean b) {
            return Optional.of(b ? 1.0 : 0.0);
        }
        if (value instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (value instanceof String s) {
            String trimmed = s.trim();
            if (NUMERIC.matcher(trimmed).matches()) {
                return Optional.of(Double.parseDouble(trimmed));
            }
            String lower = trimmed.toLowerCase(Locale.ROOT);
            if (lower.equals("inf") || lower.equals("+inf") || lower.equals("infinity")) {
                return Optional.of(Double.POSITIVE_INFINITY);
            }
            if (lower.equals("-inf") || lower.equals("-infinity")) {
                return Optional.of(Double.NEGATIVE_INFINITY);
            }
            if (lower.equals("nan")) {
                return Optional.of(Double.NaN);
            }
        }
        return Optional.empty();
    }

    /**
     * A value is empty when it is {@code null}, an empty collection or an
     * empty map. Empty strings are <strong>not</strong> empty.
     *
     * @param value any value
     * @return {@code true} if the value carries no data
     */
    public static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Collection<?> c) {
            return c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return m.isEmpty();
        }
        return false;
    }

    /**
     * Copy a value into a list, or return an empty list if it is not a
     * sequence.
     *
     * @param value any value
     * @return a new mutable list, never {@code null}
     */
    public static List<Object> asList(Object value) {
        if (value instanceof Collection<?> c) {
            return new ArrayList<>(c);
        }
        if (value instanceof Object[] array) {
            return new ArrayList<>(Arrays.asList(array));
        }
        return new ArrayList<>();
    }

    /**
     * Equality as a schema author expects it: numbers compare by value
     * regardless of their boxed type, everything else with
     * {@link Objects#equals(Object, Object)}.
     *
     * @param left  first value
     * @param right second value
     * @return {@code true} if both values are considered equal
     */
    public static boolean looselyEquals(Object left, Object right) {
        if (left instanceof Number a && right instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
        }
        return Objects.equals(left, right);
    }

    /**
     * String form used for string comparisons and message interpolation;
     * {@code null} renders as the empty string and booleans as {@code True} /
     * {@code False}, the form collectors emit.
     *
     * @param value any value
     * @return string form, never {@code null}
     */
    public static String stringify(Object value) {
        if (value instanceof Boolean b) {
            return b ? "True" : "False";
        }
        return value == null ? "" : String.valueOf(value);
    }
}
