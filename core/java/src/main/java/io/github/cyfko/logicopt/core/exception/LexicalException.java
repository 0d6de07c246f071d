package io.github.cyfko.logicopt.core.exception;

/**
 * Exception thrown by the lexer on an unexpected character, a multi-digit numeral or a
 * malformed variable token.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class LexicalException extends ExpressionSyntaxException {

    /**
     * @param message  the message describing the bad input
     * @param position zero-based offset of the offending character
     */
    public LexicalException(String message, int position) {
        super(message, position);
    }
}
