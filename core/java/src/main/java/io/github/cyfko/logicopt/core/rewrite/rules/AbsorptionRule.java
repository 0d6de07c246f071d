package io.github.cyfko.logicopt.core.rewrite.rules;

import io.github.cyfko.logicopt.core.api.AstNode;
import io.github.cyfko.logicopt.core.api.Binary;
import io.github.cyfko.logicopt.core.api.BinaryOperator;
import io.github.cyfko.logicopt.core.model.OptimizationMetrics;
import io.github.cyfko.logicopt.core.rewrite.AbstractRewriteRule;
import io.github.cyfko.logicopt.core.utils.AstNodes;

/**
 * Absorption laws, applied bottom-up on AND/OR nodes.
 * <ul>
 *   <li>standard: {@code A & (A | B) → A}, {@code A | (A & B) → A}, either operand order</li>
 *   <li>extended: {@code A & (!A | B) → A & B}, {@code A | (!A & B) → A | B}, either operand order</li>
 *   <li>idempotence: {@code A & A → A}, {@code A | A → A}</li>
 * </ul>
 * Only direct operands are inspected; chains are handled once they are regrouped.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class AbsorptionRule extends AbstractRewriteRule {

    public static final String NAME = "Absorption";

    public AbsorptionRule() {
        super(NAME, false);
    }

    @Override
    protected AstNode rewrite(AstNode node, OptimizationMetrics metrics) {
        return absorb(node);
    }

    private AstNode absorb(AstNode node) {
        if (!(node instanceof Binary b) || !(b.is(BinaryOperator.AND) || b.is(BinaryOperator.OR))) {
            return AstNodes.mapChildren(node, this::absorb);
        }

        BinaryOperator dual = b.is(BinaryOperator.AND) ? BinaryOperator.OR : BinaryOperator.AND;
        AstNode left = absorb(b.left());
        AstNode right = absorb(b.right());

        if (left.equals(right)) {
            return left;
        }
        if (right instanceof Binary rb && rb.op() == dual && (rb.left().equals(left) || rb.right().equals(left))) {
            return left;
        }
        if (left instanceof Binary lb && lb.op() == dual && (lb.left().equals(right) || lb.right().equals(right))) {
            return right;
        }

        if (right instanceof Binary rb && rb.op() == dual) {
            AstNode rest = remainderAfterComplement(rb, left);
            if (rest != null) {
                return new Binary(b.op(), left, rest, b.forceParens());
            }
        }
        if (left instanceof Binary lb && lb.op() == dual) {
            AstNode rest = remainderAfterComplement(lb, right);
            if (rest != null) {
                return new Binary(b.op(), rest, right, b.forceParens());
            }
        }

        return rebuild(b, left, right);
    }

    /**
     * Returns {@code X} when {@code dual} is {@code !a op X} or {@code X op !a}, null otherwise.
     */
    private static AstNode remainderAfterComplement(Binary dual, AstNode a) {
        if (AstNodes.areComplementary(dual.left(), a)) return dual.right();
        if (AstNodes.areComplementary(dual.right(), a)) return dual.left();
        return null;
    }
}
