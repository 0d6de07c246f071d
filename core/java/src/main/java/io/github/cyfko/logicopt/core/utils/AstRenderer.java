package io.github.cyfko.logicopt.core.utils;

import io.github.cyfko.logicopt.core.api.AstNode;
import io.github.cyfko.logicopt.core.api.Binary;
import io.github.cyfko.logicopt.core.api.BinaryOperator;
import io.github.cyfko.logicopt.core.api.Not;
import io.github.cyfko.logicopt.core.api.Variable;

/**
 * Precedence-aware infix rendering of {@link AstNode} trees.
 * <p>
 * {@code !} binds tightest, then {@code &}, then {@code |}. Operands are separated by single
 * spaces ({@code a & !b | c}); parentheses are emitted only where precedence requires them:
 * </p>
 * <ul>
 *   <li>an AND parenthesizes every binary child that is not itself an AND</li>
 *   <li>an OR parenthesizes every binary child other than AND and OR</li>
 *   <li>XOR, NAND, NOR and IMP parenthesize every binary child</li>
 *   <li>a negation parenthesizes a binary operand</li>
 *   <li>a node carrying {@code forceParens} is always parenthesized</li>
 * </ul>
 *
 * <p>
 * Any tree produced by the parser renders to text that parses back to the same tree.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class AstRenderer {

    private AstRenderer() {}

    /**
     * Renders {@code node} as infix text.
     *
     * @param node the tree to render
     * @return the rendered expression
     * @throws NullPointerException if {@code node} is null
     */
    public static String render(AstNode node) {
        StringBuilder sb = new StringBuilder();
        append(sb, node);
        return sb.toString();
    }

    private static void append(StringBuilder sb, AstNode node) {
        if (node instanceof Variable variable) {
            sb.append(variable.name());
        } else if (node instanceof Not not) {
            sb.append('!');
            appendChild(sb, not.operand(), not.operand() instanceof Binary);
        } else if (node instanceof Binary binary) {
            if (binary.forceParens()) {
                sb.append('(');
                appendBinary(sb, binary);
                sb.append(')');
            } else {
                appendBinary(sb, binary);
            }
        } else {
            throw new IllegalArgumentException("Unsupported node type: " + node.getClass().getName());
        }
    }

    private static void appendBinary(StringBuilder sb, Binary binary) {
        appendChild(sb, binary.left(), needsParens(binary.op(), binary.left()));
        sb.append(' ').append(binary.op().symbol()).append(' ');
        appendChild(sb, binary.right(), needsParens(binary.op(), binary.right()));
    }

    private static boolean needsParens(BinaryOperator parent, AstNode child) {
        if (!(child instanceof Binary binaryChild)) {
            return false;
        }
        return switch (parent) {
            case AND -> binaryChild.op() != BinaryOperator.AND;
            case OR -> binaryChild.op() != BinaryOperator.AND && binaryChild.op() != BinaryOperator.OR;
            default -> true;
        };
    }

    private static void appendChild(StringBuilder sb, AstNode child, boolean parenthesize) {
        // a forced node brings its own parentheses
        if (parenthesize && !(child instanceof Binary b && b.forceParens())) {
            sb.append('(');
            append(sb, child);
            sb.append(')');
        } else {
            append(sb, child);
        }
    }
}
