package com.fleetaudit.core.alert;

import com.fleetaudit.core.model.Values;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Interpolates field values into alert messages.
 *
 * <h3>Syntax</h3>
 * <ul>
 * <li>{@code {name}}: the field's string form</li>
 * <li>{@code {name:spec}}: formatted with a format spec of the form
 * {@code [[fill]align][sign][0][width][,][.precision][type]}, where type is one
 * of {@code s d f F e E %}; e.g. {@code {used_pct:.1f}}</li>
 * <li><code>{{</code> and <code>}}</code>: literal braces</li>
 * </ul>
 *
 * <p>
 * If any placeholder names a missing field, is malformed, or its spec does not
 * fit the value, the raw template is returned unchanged.
 * </p>
 *
 * @since 1.0.0
 */
public final class MessageTemplate {

    private static final Pattern NAME = Pattern.compile("\\w+");

    private static final Pattern SPEC = Pattern.compile(
            "(?:(.)?([<>^=]))?([+\\- ])?(0)?(\\d+)?(,)?(?:\\.(\\d+))?([sdfFeE%])?");

    private MessageTemplate() {
    }

    /**
     * @param template message template, may be {@code null}
     * @param fields   values for placeholders
     * @return the interpolated message, or the raw template if interpolation fails
     */
    public static String render(String template, Map<String, ?> fields) {
        if (template == null) {
            return "";
        }
        try {
            return interpolate(template, fields != null ? fields : Map.of());
        } catch (IllegalArgumentException e) {
            return template;
        }
    }

    private static String interpolate(String template, Map<String, ?> fields) {
        StringBuilder out = new StringBuilder(template.length() + 16);
        int i = 0;
        int n = template.length();
        while (i < n) {
            char c = template.charAt(i);
            if (c == '{') {
                if (i + 1 < n && template.charAt(i + 1) == '{') {
                    out.append('{');
                    i += 2;
                    continue;
                }
                int close = template.indexOf('}', i + 1);
                if (close < 0) {
                    throw new IllegalArgumentException("unclosed placeholder");
                }
                out.append(placeholder(template.substring(i + 1, close), fields));
                i = close + 1;
            } else if (c == '}') {
                if (i + 1 < n && template.charAt(i + 1) == '}') {
                    out.append('}');
                    i += 2;
                    continue;
                }
                throw new IllegalArgumentException("single '}'");
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private static String placeholder(String body, Map<String, ?> fields) {
        int colon = body.indexOf(':');
        String name = colon >= 0 ? body.substring(0, colon) : body;
        if (!NAME.matcher(name).matches() || !fields.containsKey(name)) {
            throw new IllegalArgumentException("unknown field '" + name + "'");
        }
        Object value = fields.get(name);
        return colon >= 0 ? format(value, body.substring(colon + 1)) : Values.stringify(value);
    }

    // ---------------------------------------------------------------
    // Format specs
    // ---------------------------------------------------------------

    static String format(Object value, String spec) {
        if (spec.isEmpty()) {
            return Values.stringify(value);
        }
        Matcher m = SPEC.matcher(spec);
        if (!m.matches()) {
            throw new IllegalArgumentException("bad format spec '" + spec + "'");
        }
        String fillGroup = m.group(1);
        String align = m.group(2);
        String sign = m.group(3);
        boolean zero = m.group(4) != null;
        int width = m.group(5) != null ? Integer.parseInt(m.group(5)) : 0;
        boolean grouping = m.group(6) != null;
        Integer precision = m.group(7) != null ? Integer.valueOf(m.group(7)) : null;
        String type = m.group(8);

        boolean numeric = isNumber(value);
        String body;
        if (type == null || type.equals("s")) {
            if (type != null && numeric) {
                throw new IllegalArgumentException("'s' applied to a number");
            }
            if (numeric && (precision != null || grouping || sign != null)) {
                throw new IllegalArgumentException("numeric spec without a type");
            }
            body = Values.stringify(value);
            if (precision != null && body.length() > precision) {
                body = body.substring(0, precision);
            }
        } else {
            body = formatNumber(value, type, sign, grouping, precision);
        }

        char fill = fillGroup != null ? fillGroup.charAt(0) : ' ';
        if (align == null) {
            if (zero) {
                fill = '0';
                align = "=";
            } else {
                align = numeric ? ">" : "<";
            }
        }
        return pad(body, width, fill, align.charAt(0));
    }

    private static String formatNumber(Object value, String type, String sign, boolean grouping, Integer precision) {
        if (!isNumber(value)) {
            throw new IllegalArgumentException("'" + type + "' applied to a non-number");
        }
        String flags = (sign != null && !sign.equals("-") ? sign : "") + (grouping ? "," : "");
        Number number = (Number) value;
        return switch (type) {
            case "d" -> {
                if (precision != null || !isIntegral(number)) {
                    throw new IllegalArgumentException("'d' applied to a non-integer");
                }
                yield String.format(Locale.ROOT, "%" + flags + "d", new BigInteger(number.toString()));
            }
            case "f", "F" -> fixed(number.doubleValue(), flags, precision, type.equals("F"));
            case "e", "E" -> {
                String s = String.format(Locale.ROOT, "%" + flags.replace(",", "") + "."
                        + (precision != null ? precision : 6) + "e", number.doubleValue());
                yield type.equals("E") ? s.toUpperCase(Locale.ROOT) : s;
            }
            case "%" -> fixed(number.doubleValue() * 100, flags, precision, false) + "%";
            default -> throw new IllegalArgumentException("unsupported type '" + type + "'");
        };
    }

    private static String fixed(double d, String flags, Integer precision, boolean upper) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            String s = Double.isNaN(d) ? "nan" : (d > 0 ? (flags.contains("+") ? "+inf" : "inf") : "-inf");
            return upper ? s.toUpperCase(Locale.ROOT) : s;
        }
        return String.format(Locale.ROOT, "%" + flags + "." + (precision != null ? precision : 6) + "f", d);
    }

    private static String pad(String body, int width, char fill, char align) {
        int missing = width - body.length();
        if (missing <= 0) {
            return body;
        }
        String padding = String.valueOf(fill).repeat(missing);
        return switch (align) {
            case '<' -> body + padding;
            case '^' -> String.valueOf(fill).repeat(missing / 2) + body
                    + String.valueOf(fill).repeat(missing - missing / 2);
            case '=' -> {
                boolean signed = !body.isEmpty() && (body.charAt(0) == '-' || body.charAt(0) == '+'
                        || body.charAt(0) == ' ');
                yield signed ? body.charAt(0) + padding + body.substring(1) : padding + body;
            }
            default -> padding + body;
        };
    }

    private static boolean isNumber(Object value) {
        return value instanceof Number;
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte
                || n instanceof BigInteger;
    }
}
