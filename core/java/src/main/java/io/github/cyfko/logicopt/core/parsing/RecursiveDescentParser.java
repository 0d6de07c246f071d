package io.github.cyfko.logicopt.core.parsing;

import io.github.cyfko.logicopt.core.api.AstNode;
import io.github.cyfko.logicopt.core.api.Binary;
import io.github.cyfko.logicopt.core.api.Not;
import io.github.cyfko.logicopt.core.api.Variable;
import io.github.cyfko.logicopt.core.exception.ExpressionSyntaxException;

import java.util.List;
import java.util.Objects;

/**
 * Recursive-descent parser building an {@link AstNode} from a token list.
 * <p>
 * Grammar, from lowest to highest precedence:
 * </p>
 * <pre>
 * Or      := And ('|' And)*
 * And     := Not ('&amp;' Not)*
 * Not     := '!' Not | Primary
 * Primary := Variable | '(' Or ')'
 * </pre>
 * <p>
 * Binary chains associate to the left ({@code a | b | c} is {@code (a | b) | c}), stacked
 * negations nest ({@code !!a} is {@code Not(Not(a))}) and parentheses only group: the parser
 * never sets {@code forceParens}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class RecursiveDescentParser {

    private final List<Token> tokens;
    private int current;

    private RecursiveDescentParser(List<Token> tokens) {
        this.tokens = tokens;
        this.current = 0;
    }

    /**
     * Parses a token list produced by {@link Lexer#tokenize(String)}.
     *
     * @param tokens the tokens, terminated by {@link TokenType#END}
     * @return the root of the parsed tree
     * @throws ExpressionSyntaxException on empty input, a missing {@code ')'} or an unexpected token
     */
    public static AstNode parse(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens are required");
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.END) {
            throw new IllegalArgumentException("Token list must be terminated by an END token");
        }
        if (tokens.get(0).type() == TokenType.END) {
            throw new ExpressionSyntaxException("Empty expression", tokens.get(0).position());
        }

        RecursiveDescentParser parser = new RecursiveDescentParser(tokens);
        AstNode root = parser.parseOr();

        Token trailing = parser.peek();
        if (trailing.type() != TokenType.END) {
            throw unexpected(trailing);
        }
        return root;
    }

    private AstNode parseOr() {
        AstNode left = parseAnd();
        while (match(TokenType.OR)) {
            left = Binary.or(left, parseAnd());
        }
        return left;
    }

    private AstNode parseAnd() {
        AstNode left = parseNot();
        while (match(TokenType.AND)) {
            left = Binary.and(left, parseNot());
        }
        return left;
    }

    private AstNode parseNot() {
        // long '!!!...' runs are counted instead of recursed into
        int negations = 0;
        while (match(TokenType.NOT)) {
            negations++;
        }
        AstNode node = parsePrimary();
        for (int i = 0; i < negations; i++) {
            node = new Not(node);
        }
        return node;
    }

    private AstNode parsePrimary() {
        Token token = peek();
        switch (token.type()) {
            case VARIABLE -> {
                current++;
                return new Variable(token.text());
            }
            case LEFT_PAREN -> {
                current++;
                AstNode inner = parseOr();
                Token closing = peek();
                if (closing.type() != TokenType.RIGHT_PAREN) {
                    throw new ExpressionSyntaxException(String.format(
                            "Expected ')' to close '(' at position %d but found %s at position %d",
                            token.position(), closing.describe(), closing.position()), closing.position());
                }
                current++;
                return inner;
            }
            default -> throw unexpected(token);
        }
    }

    private boolean match(TokenType type) {
        if (peek().type() == type) {
            current++;
            return true;
        }
        return false;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private static ExpressionSyntaxException unexpected(Token token) {
        return new ExpressionSyntaxException(
                String.format("Unexpected token %s at position %d", token.describe(), token.position()),
                token.position());
    }
}
