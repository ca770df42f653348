package com.fleetaudit.core.expression;

/**
 * Raised when an arithmetic expression is malformed or contains anything
 * other than numbers, {@code + - * /} and parentheses.
 *
 * @since 1.0.0
 */
public class ExpressionException extends Exception {

    private static final long serialVersionUID = 1L;

    public ExpressionException(String message) {
        super(message);
    }

    public ExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
