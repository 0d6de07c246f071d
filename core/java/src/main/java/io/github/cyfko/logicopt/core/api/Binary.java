package io.github.cyfko.logicopt.core.api;

import io.github.cyfko.logicopt.core.utils.AstRenderer;

import java.util.Objects;

/**
 * Binary operation node.
 * <p>
 * {@code forceParens} only affects rendering: a node carrying it is always printed inside
 * parentheses. It takes no part in {@link #equals(Object)} or {@link #hashCode()}, and it is a
 * constructor argument so that every rule rebuilding a node decides explicitly whether to keep it.
 * </p>
 *
 * @param op          the operator
 * @param left        left operand
 * @param right       right operand
 * @param forceParens whether the rendering of this node is always parenthesized
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Binary(BinaryOperator op, AstNode left, AstNode right, boolean forceParens) implements AstNode {

    public Binary {
        Objects.requireNonNull(op, "op is required");
        Objects.requireNonNull(left, "left operand is required");
        Objects.requireNonNull(right, "right operand is required");
    }

    public static Binary and(AstNode left, AstNode right) {
        return new Binary(BinaryOperator.AND, left, right, false);
    }

    public static Binary or(AstNode left, AstNode right) {
        return new Binary(BinaryOperator.OR, left, right, false);
    }

    /**
     * @param operator the operator to test
     * @return whether this node uses {@code operator}
     */
    public boolean is(BinaryOperator operator) {
        return op == operator;
    }

    /**
     * Returns a node with the same operator and {@code forceParens} flag but new operands.
     *
     * @param newLeft  the new left operand
     * @param newRight the new right operand
     * @return the rebuilt node
     */
    public Binary withOperands(AstNode newLeft, AstNode newRight) {
        return new Binary(op, newLeft, newRight, forceParens);
    }

    @Override
    public int nodeCount() {
        return 1 + left.nodeCount() + right.nodeCount();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Binary other)) return false;
        return op == other.op && left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, left, right);
    }

    @Override
    public String toString() {
        return AstRenderer.render(this);
    }
}
