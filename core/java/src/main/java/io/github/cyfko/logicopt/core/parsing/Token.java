package io.github.cyfko.logicopt.core.parsing;

import java.util.Objects;

/**
 * A lexical token with its position in the source text.
 *
 * @param type     the token kind
 * @param text     the matched text, empty for {@link TokenType#END}
 * @param position zero-based offset of the first character in the source text
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Token(TokenType type, String text, int position) {

    public Token {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(text, "text is required");
    }

    /**
     * @return a printable description used in error messages
     */
    public String describe() {
        return type == TokenType.END ? "end of input" : "'" + text + "'";
    }
}
