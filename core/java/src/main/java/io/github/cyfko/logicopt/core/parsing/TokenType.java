package io.github.cyfko.logicopt.core.parsing;

/**
 * Kinds of lexical tokens.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum TokenType {
    /** A variable name or one of the constants {@code 0}/{@code 1}. */
    VARIABLE,
    AND,
    OR,
    NOT,
    LEFT_PAREN,
    RIGHT_PAREN,
    /** End of input; always the last token of a tokenized expression. */
    END
}
