package io.github.cyfko.logicopt.core.rewrite.rules;

import io.github.cyfko.logicopt.core.api.AstNode;
import io.github.cyfko.logicopt.core.api.Binary;
import io.github.cyfko.logicopt.core.api.BinaryOperator;
import io.github.cyfko.logicopt.core.api.Not;
import io.github.cyfko.logicopt.core.api.Variable;
import io.github.cyfko.logicopt.core.model.OptimizationMetrics;
import io.github.cyfko.logicopt.core.rewrite.AbstractRewriteRule;
import io.github.cyfko.logicopt.core.utils.AstNodes;

/**
 * Removes double negations, then folds constants.
 * <ul>
 *   <li>{@code !!A → A}</li>
 *   <li>{@code A & 0 → 0}, {@code A & 1 → A}, {@code A | 1 → 1}, {@code A | 0 → A}</li>
 *   <li>{@code !0 → 1}, {@code !1 → 0}</li>
 *   <li>{@code A & !A → 0}, {@code A | !A → 1} for directly adjacent operands</li>
 *   <li>XOR: {@code A ^ A → 0}, {@code A ^ 0 → A}, {@code A ^ 1 → !A}, {@code A ^ !A → 1}</li>
 *   <li>NAND: {@code A ~& A → !A}, {@code A ~& 0 → 1}, {@code A ~& 1 → !A}</li>
 *   <li>NOR: {@code A ~| A → !A}, {@code A ~| 1 → 0}, {@code A ~| 0 → !A}</li>
 *   <li>IMP: {@code A → A}, {@code 0 → A} and {@code A → 1} become {@code 1}; {@code 1 → A} becomes {@code A}</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ConstantsRule extends AbstractRewriteRule {

    public static final String NAME = "Constants";

    public ConstantsRule() {
        super(NAME, false);
    }

    @Override
    protected AstNode rewrite(AstNode node, OptimizationMetrics metrics) {
        return fold(removeDoubleNegation(node));
    }

    private AstNode removeDoubleNegation(AstNode node) {
        if (node instanceof Not outer && outer.operand() instanceof Not inner) {
            return removeDoubleNegation(inner.operand());
        }
        return AstNodes.mapChildren(node, this::removeDoubleNegation);
    }

    private AstNode fold(AstNode node) {
        if (node instanceof Binary b && b.is(BinaryOperator.AND)) {
            AstNode left = fold(b.left());
            AstNode right = fold(b.right());

            if (AstNodes.isFalse(left) || AstNodes.isFalse(right)) return Variable.FALSE;
            if (AstNodes.isTrue(left)) return right;
            if (AstNodes.isTrue(right)) return left;
            if (AstNodes.areComplementary(left, right)) return Variable.FALSE;
            return rebuild(b, left, right);
        }

        if (node instanceof Binary b && b.is(BinaryOperator.OR)) {
            AstNode left = fold(b.left());
            AstNode right = fold(b.right());

            if (AstNodes.isTrue(left) || AstNodes.isTrue(right)) return Variable.TRUE;
            if (AstNodes.isFalse(left)) return right;
            if (AstNodes.isFalse(right)) return left;
            if (AstNodes.areComplementary(left, right)) return Variable.TRUE;
            return rebuild(b, left, right);
        }

        if (node instanceof Not not) {
            AstNode operand = fold(not.operand());
            if (AstNodes.isTrue(operand)) return Variable.FALSE;
            if (AstNodes.isFalse(operand)) return Variable.TRUE;
            return operand == not.operand() ? node : new Not(operand);
        }

        if (node instanceof Binary b) {
            AstNode left = fold(b.left());
            AstNode right = fold(b.right());
            AstNode folded = foldExtended(b.op(), left, right);
            return folded != null ? folded : rebuild(b, left, right);
        }

        return node;
    }

    /**
     * Applies the identities of the derived operators, or returns null when none matches.
     */
    private static AstNode foldExtended(BinaryOperator op, AstNode left, AstNode right) {
        switch (op) {
            case XOR:
                if (left.equals(right)) return Variable.FALSE;
                if (AstNodes.isFalse(left)) return right;
                if (AstNodes.isFalse(right)) return left;
                if (AstNodes.isTrue(left)) return negate(right);
                if (AstNodes.isTrue(right)) return negate(left);
                if (AstNodes.areComplementary(left, right)) return Variable.TRUE;
                return null;
            case NAND:
                if (AstNodes.isFalse(left) || AstNodes.isFalse(right)) return Variable.TRUE;
                if (left.equals(right) || AstNodes.isTrue(right)) return negate(left);
                if (AstNodes.isTrue(left)) return negate(right);
                return null;
            case NOR:
                if (AstNodes.isTrue(left) || AstNodes.isTrue(right)) return Variable.FALSE;
                if (left.equals(right) || AstNodes.isFalse(right)) return negate(left);
                if (AstNodes.isFalse(left)) return negate(right);
                return null;
            case IMP:
                if (AstNodes.isFalse(left) || AstNodes.isTrue(right) || left.equals(right)) return Variable.TRUE;
                if (AstNodes.isTrue(left)) return right;
                return null;
            default:
                return null;
        }
    }

    private static AstNode negate(AstNode node) {
        if (AstNodes.isTrue(node)) return Variable.FALSE;
        if (AstNodes.isFalse(node)) return Variable.TRUE;
        if (node instanceof Not not) return not.operand();
        return new Not(node);
    }
}
