package io.github.cyfko.logicopt.core.rewrite.rules;

import io.github.cyfko.logicopt.core.api.AstNode;
import io.github.cyfko.logicopt.core.api.Binary;
import io.github.cyfko.logicopt.core.api.BinaryOperator;
import io.github.cyfko.logicopt.core.api.Not;
import io.github.cyfko.logicopt.core.model.OptimizationMetrics;
import io.github.cyfko.logicopt.core.rewrite.AbstractRewriteRule;
import io.github.cyfko.logicopt.core.utils.AstNodes;

/**
 * De Morgan's laws: {@code !(A & B) → !A | !B} and {@code !(A | B) → !A & !B}.
 * <p>
 * Negations are pushed through AND/OR nodes recursively; negated extended operators are kept.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class DeMorganRule extends AbstractRewriteRule {

    public static final String NAME = "DeMorgan";

    public DeMorganRule() {
        super(NAME, false);
    }

    @Override
    protected AstNode rewrite(AstNode node, OptimizationMetrics metrics) {
        return push(node);
    }

    private AstNode push(AstNode node) {
        if (node instanceof Not not && not.operand() instanceof Binary b
                && (b.is(BinaryOperator.AND) || b.is(BinaryOperator.OR))) {
            BinaryOperator dual = b.is(BinaryOperator.AND) ? BinaryOperator.OR : BinaryOperator.AND;
            return new Binary(dual, push(new Not(b.left())), push(new Not(b.right())), false);
        }
        return AstNodes.mapChildren(node, this::push);
    }
}
