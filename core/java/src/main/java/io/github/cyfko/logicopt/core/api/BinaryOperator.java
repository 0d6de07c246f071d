package io.github.cyfko.logicopt.core.api;

/**
 * Operators of {@link Binary} nodes.
 * <p>
 * Only {@link #AND} and {@link #OR} are produced by the parser. The remaining operators appear
 * when the pattern recognizer folds primitive encodings back into derived operators, or when a
 * caller builds a tree directly.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum BinaryOperator {
    AND("&", true),
    OR("|", true),
    XOR("^", true),
    NAND("~&", true),
    NOR("~|", true),
    IMP("→", false);

    private final String symbol;
    private final boolean commutative;

    BinaryOperator(String symbol, boolean commutative) {
        this.symbol = symbol;
        this.commutative = commutative;
    }

    /**
     * @return the infix symbol used when rendering
     */
    public String symbol() {
        return symbol;
    }

    /**
     * @return whether swapping the operands preserves the meaning
     */
    public boolean isCommutative() {
        return commutative;
    }

    /**
     * Applies this operator to two truth values.
     *
     * @param left  value of the left operand
     * @param right value of the right operand
     * @return the result of the operation
     */
    public boolean apply(boolean left, boolean right) {
        return switch (this) {
            case AND -> left && right;
            case OR -> left || right;
            case XOR -> left ^ right;
            case NAND -> !(left && right);
            case NOR -> !(left || right);
            case IMP -> !left || right;
        };
    }
}
