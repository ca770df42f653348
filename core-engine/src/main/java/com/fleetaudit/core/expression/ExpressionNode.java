package com.fleetaudit.core.expression;

/**
 * Node of a parsed arithmetic expression.
 *
 * @since 1.0.0
 */
sealed interface ExpressionNode
        permits ExpressionNode.Literal, ExpressionNode.Negate, ExpressionNode.Binary {

    double evaluate();

    record Literal(double value) implements ExpressionNode {
        @Override
        public double evaluate() {
            return value;
        }
    }

    record Negate(ExpressionNode operand) implements ExpressionNode {
        @Override
        public double evaluate() {
            return -operand.evaluate();
        }
    }

    record Binary(char operator, ExpressionNode left, ExpressionNode right) implements ExpressionNode {
        @Override
        public double evaluate() {
            double l = left.evaluate();
            double r = right.evaluate();
            return switch (operator) {
                case '+' -> l + r;
                case '-' -> l - r;
                case '*' -> l * r;
                // Division by zero is defined as 0 so ratio formulas never fail a field
                case '/' -> r == 0.0 ? 0.0 : l / r;
                default -> throw new IllegalStateException("Unsupported operator: " + operator);
            };
        }
    }
}
