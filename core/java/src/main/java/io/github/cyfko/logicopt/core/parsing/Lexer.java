package io.github.cyfko.logicopt.core.parsing;

import io.github.cyfko.logicopt.core.config.PatternConfig;
import io.github.cyfko.logicopt.core.config.ReservedSymbol;
import io.github.cyfko.logicopt.core.exception.LexicalException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits an expression into {@link Token}s.
 * <p>
 * Recognized tokens are the operators {@code !}, {@code &}, {@code |}, the parentheses, variable
 * names matching {@link PatternConfig#IDENTIFIER_PATTERN} and the single-digit constants {@code 0}
 * and {@code 1}. A run of letters, digits and underscores is scanned as one word, then checked. Whitespace only separates tokens. The returned list always ends with an
 * {@link TokenType#END} token positioned at the end of the text.
 * </p>
 *
 * <h2>Rejected input</h2>
 * <ul>
 *   <li>any other character: {@code "a $ b"}</li>
 *   <li>multi-digit numerals: {@code "10"}, {@code "a & 00"}</li>
 *   <li>malformed variables: {@code "2"}, {@code "1a"}, {@code "0_x"}, {@code "10a"}</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Lexer {

    private Lexer() {}

    /**
     * Tokenizes {@code text}.
     *
     * @param text the expression source
     * @return the tokens, terminated by {@link TokenType#END}
     * @throws LexicalException on an unexpected character or a malformed literal
     */
    public static List<Token> tokenize(String text) {
        Objects.requireNonNull(text, "text is required");

        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int length = text.length();

        while (i < length) {
            char c = text.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            switch (c) {
                case '&' -> tokens.add(new Token(TokenType.AND, "&", i));
                case '|' -> tokens.add(new Token(TokenType.OR, "|", i));
                case '!' -> tokens.add(new Token(TokenType.NOT, "!", i));
                case '(' -> tokens.add(new Token(TokenType.LEFT_PAREN, "(", i));
                case ')' -> tokens.add(new Token(TokenType.RIGHT_PAREN, ")", i));
                default -> {
                    if (isWordPart(c)) {
                        int end = scanWord(text, i);
                        tokens.add(wordToken(text.substring(i, end), i));
                        i = end;
                        continue;
                    }
                    throw new LexicalException(
                            String.format("Unexpected character '%c' at position %d", c, i), i);
                }
            }
            i++;
        }

        tokens.add(new Token(TokenType.END, "", length));
        return tokens;
    }

    /**
     * Turns a run of letters, digits and underscores into a variable token.
     */
    private static Token wordToken(String word, int start) {
        if (PatternConfig.IDENTIFIER_PATTERN.matcher(word).matches() || ReservedSymbol.isConstant(word)) {
            return new Token(TokenType.VARIABLE, word, start);
        }
        if (word.length() > 1 && word.chars().allMatch(ch -> isDigit((char) ch))) {
            throw new LexicalException(String.format(
                    "Multi-digit number '%s' at position %d: only the constants %s and %s are allowed",
                    word, start, ReservedSymbol.FALSE, ReservedSymbol.TRUE), start);
        }
        throw new LexicalException(String.format(
                "Malformed variable '%s' at position %d: variables must start with a letter or underscore",
                word, start), start);
    }

    private static int scanWord(String text, int start) {
        int end = start + 1;
        while (end < text.length() && isWordPart(text.charAt(end))) end++;
        return end;
    }

    private static boolean isWordPart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
