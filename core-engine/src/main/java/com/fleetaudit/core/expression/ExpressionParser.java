package com.fleetaudit.core.expression;

/**
 * Recursive-descent parser for the arithmetic grammar:
 *
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := unary (('*' | '/') unary)*
 * unary      := ('+' | '-') unary | primary
 * primary    := NUMBER | '(' expression ')'
 * </pre>
 *
 * <p>
 * Numbers are decimal literals with an optional fraction and exponent.
 * Anything else (identifiers, strings, other operators) is rejected.
 * </p>
 */
final class ExpressionParser {

    private final String source;
    private int pos;

    private ExpressionParser(String source) {
        this.source = source;
    }

    /**
     * @param source expression text with all placeholders already substituted
     * @return root node
     * @throws ExpressionException if the text is not a valid expression
     */
    static ExpressionNode parse(String source) throws ExpressionException {
        ExpressionParser parser = new ExpressionParser(source);
        ExpressionNode root = parser.expression();
        parser.skipWhitespace();
        if (parser.pos < source.length()) {
            throw parser.error("unexpected '" + source.charAt(parser.pos) + "'");
        }
        return root;
    }

    private ExpressionNode expression() throws ExpressionException {
        ExpressionNode left = term();
        while (true) {
            char op = peek();
            if (op != '+' && op != '-') {
                return left;
            }
            pos++;
            left = new ExpressionNode.Binary(op, left, term());
        }
    }

    private ExpressionNode term() throws ExpressionException {
        ExpressionNode left = unary();
        while (true) {
            char op = peek();
            if (op != '*' && op != '/') {
                return left;
            }
            pos++;
            if (peek() == op) {
                // '**' and '//' are valid elsewhere but not in this grammar
                throw error("unsupported operator '" + op + op + "'");
            }
            left = new ExpressionNode.Binary(op, left, unary());
        }
    }

    private ExpressionNode unary() throws ExpressionException {
        char c = peek();
        if (c == '-') {
            pos++;
            return new ExpressionNode.Negate(unary());
        }
        if (c == '+') {
            pos++;
            return unary();
        }
        return primary();
    }

    private ExpressionNode primary() throws ExpressionException {
        char c = peek();
        if (c == '(') {
            pos++;
            ExpressionNode inner = expression();
            if (peek() != ')') {
                throw error("missing ')'");
            }
            pos++;
            return inner;
        }
        if (Character.isDigit(c) || c == '.') {
            return number();
        }
        if (c == 0) {
            throw error("unexpected end of expression");
        }
        if (Character.isLetter(c) || c == '_' || c == '\'' || c == '"') {
            throw error("non-numeric token at position " + pos);
        }
        throw error("unsupported token '" + c + "'");
    }

    private ExpressionNode number() throws ExpressionException {
        int start = pos;
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
            pos++;
        }
        if (pos < source.length() && source.charAt(pos) == '.') {
            pos++;
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                pos++;
            }
        }
        if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
            int mark = pos++;
            if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                pos++;
            }
            if (pos >= source.length() || !Character.isDigit(source.charAt(pos))) {
                pos = mark;
                throw error("malformed exponent");
            }
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                pos++;
            }
        }
        String literal = source.substring(start, pos);
        if (literal.equals(".")) {
            throw error("malformed number");
        }
        if (pos < source.length() && Character.isLetter(source.charAt(pos))) {
            throw error("non-numeric token after '" + literal + "'");
        }
        return new ExpressionNode.Literal(Double.parseDouble(literal));
    }

    private char peek() {
        skipWhitespace();
        return pos < source.length() ? source.charAt(pos) : 0;
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private ExpressionException error(String detail) {
        return new ExpressionException(detail);
    }
}
