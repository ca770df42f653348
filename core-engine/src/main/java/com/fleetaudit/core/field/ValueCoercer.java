package com.fleetaudit.core.field;

import com.fleetaudit.core.model.FieldType;
import com.fleetaudit.core.model.Values;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Coerces resolved values to a field's declared {@link FieldType}.
 *
 * <p>
 * Coercion never throws: an absent value, or one that cannot be converted,
 * yields the supplied fallback.
 * </p>
 *
 * <ul>
 * <li>{@code str}: {@link String#valueOf(Object)}</li>
 * <li>{@code int}: {@link Long}; decimals truncate toward zero, strings must
 * hold an integer literal</li>
 * <li>{@code float}: {@link Double}</li>
 * <li>{@code bool}: strings use a falsy table ({@code false, no, 0, off} and
 * empty), because some collectors serialize booleans as text</li>
 * <li>{@code list}: lists as-is, anything else becomes an empty list</li>
 * <li>{@code dict}: maps as-is, anything else the fallback</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class ValueCoercer {

    private static final Set<String> FALSY_STRINGS = Set.of("false", "no", "0", "off", "");

    private ValueCoercer() {
        // utility class
    }

    /**
     * @param value    value to coerce, {@code null} when absent
     * @param type     declared type
     * @param fallback value used when absent or not convertible
     * @return coerced value
     */
    public static Object coerce(Object value, FieldType type, Object fallback) {
        if (value == null) {
            return fallback;
        }
        return switch (type) {
            case STR -> Values.stringify(value);
            case INT -> toLong(value).map(Object.class::cast).orElse(fallback);
            case FLOAT -> toFloat(value).map(Object.class::cast).orElse(fallback);
            case BOOL -> toBoolean(value);
            case LIST -> Values.asList(value);
            case DICT -> value instanceof Map<?, ?> ? value : fallback;
        };
    }

    /**
     * Truthiness with the falsy string table applied to text.
     *
     * @param value any non-null value
     * @return boolean interpretation
     */
    static boolean toBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            return !FALSY_STRINGS.contains(s.toLowerCase(Locale.ROOT));
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        return true;
    }

    private static Optional<Long> toLong(Object value) {
        if (value instanceof Boolean b) {
            return Optional.of(b ? 1L : 0L);
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return Optional.empty();
            }
            return Optional.of((long) d);
        }
        if (value instanceof BigDecimal bd) {
            return Optional.of(bd.longValue());
        }
        if (value instanceof BigInteger bi) {
            return Optional.of(bi.longValue());
        }
        if (value instanceof Number n) {
            return Optional.of(n.longValue());
        }
        if (value instanceof String s) {
            try {
                return Optional.of(Long.parseLong(s.trim().replace("_", "")));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static Optional<Double> toFloat(Object value) {
        if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
            return Optional.empty();
        }
        return Values.toDouble(value);
    }
}
