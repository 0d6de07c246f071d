package io.github.cyfko.logicopt.core.exception;

/**
 * Exception thrown when an expression violates the grammar.
 * <p>
 * Raised for empty input, unbalanced parentheses, missing operands and trailing or
 * unexpected tokens. The offending position in the source text is carried when known.
 * </p>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * LogicOptimizer.parse("");
 * // → "Expression cannot be null or empty"
 *
 * LogicOptimizer.parse("(a & b");
 * // → "Unbalanced parentheses: unmatched '(' at position 0"
 *
 * LogicOptimizer.parse("a &");
 * // → "Unexpected end of expression at position 3"
 *
 * LogicOptimizer.parse("a b");
 * // → "Unexpected token 'b' at position 2"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ExpressionSyntaxException extends LogicOptimizerException {

    private final int position;

    /**
     * Creates an exception whose position is unknown.
     *
     * @param message the message describing the syntax error
     */
    public ExpressionSyntaxException(String message) {
        this(message, -1);
    }

    /**
     * @param message  the message describing the syntax error, should already mention the position
     * @param position zero-based offset in the source text, or {@code -1} when unknown
     */
    public ExpressionSyntaxException(String message, int position) {
        super(message);
        this.position = position;
    }

    /**
     * Returns the zero-based offset of the offending character or token.
     *
     * @return the position, or {@code -1} when unknown
     */
    public int getPosition() {
        return position;
    }
}
