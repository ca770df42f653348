package com.fleetaudit.core.expression;

import com.fleetaudit.core.model.Values;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates restricted arithmetic expressions with field placeholders, as used
 * by {@code compute} fields and {@code computed_filter} conditions.
 *
 * <p>
 * {@code {name}} placeholders are replaced with the numeric value of
 * {@code context.get(name)}, or {@code 0} if that value is absent or not
 * numeric. The substituted text may only contain decimal literals,
 * {@code + - * /}, unary {@code + -} and parentheses.
 * </p>
 *
 * <p>
 * Division by zero evaluates to {@code 0.0} rather than failing, so
 * percentage formulas over empty capacities never break a field.
 * </p>
 *
 * <p>
 * Instances are stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class ExpressionEvaluator {

    private static final Pattern FIELD_REF = Pattern.compile("\\{(\\w+)}");

    /**
     * Evaluate an expression against a context map.
     *
     * @param expression expression such as {@code "{used} / {total} * 100"}
     * @param context    values for placeholders (fields, or one list item)
     * @return the result
     * @throws ExpressionException if the expression is malformed or
     *                             non-numeric
     */
    public double evaluate(String expression, Map<String, ?> context) throws ExpressionException {
        Objects.requireNonNull(expression, "Expression must not be null");
        String substituted = substitute(expression, context != null ? context : Map.of());
        try {
            return ExpressionParser.parse(substituted).evaluate();
        } catch (ExpressionException e) {
            throw new ExpressionException("Expression error in '" + expression + "': " + e.getMessage(), e);
        }
    }

    private static String substitute(String expression, Map<String, ?> context) {
        Matcher m = FIELD_REF.matcher(expression);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String literal = Values.toDouble(context.get(m.group(1)))
                    .map(d -> Double.toString(d))
                    .orElse("0");
            m.appendReplacement(sb, Matcher.quoteReplacement(literal));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
