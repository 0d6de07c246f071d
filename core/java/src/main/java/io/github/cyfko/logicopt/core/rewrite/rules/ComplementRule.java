package io.github.cyfko.logicopt.core.rewrite.rules;

import io.github.cyfko.logicopt.core.api.AstNode;
import io.github.cyfko.logicopt.core.api.Binary;
import io.github.cyfko.logicopt.core.api.BinaryOperator;
import io.github.cyfko.logicopt.core.api.Variable;
import io.github.cyfko.logicopt.core.model.OptimizationMetrics;
import io.github.cyfko.logicopt.core.rewrite.AbstractRewriteRule;
import io.github.cyfko.logicopt.core.utils.AstNodes;

/**
 * Complement laws over whole chains: an AND chain containing some term and its negation
 * collapses to {@code 0}, an OR chain to {@code 1}.
 * <p>
 * Unlike {@link ConstantsRule} the complementary terms need not be adjacent:
 * {@code a & b & !a → 0}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ComplementRule extends AbstractRewriteRule {

    public static final String NAME = "Complement";

    public ComplementRule() {
        super(NAME, false);
    }

    @Override
    protected AstNode rewrite(AstNode node, OptimizationMetrics metrics) {
        return complement(node);
    }

    private AstNode complement(AstNode node) {
        if (node instanceof Binary b && (b.is(BinaryOperator.AND) || b.is(BinaryOperator.OR))) {
            AstNode mapped = AstNodes.mapChainTerms(b, b.op(), this::complement);
            if (AstNodes.containsComplementaryPair(AstNodes.flatten(mapped, b.op()))) {
                return b.is(BinaryOperator.AND) ? Variable.FALSE : Variable.TRUE;
            }
            return mapped;
        }
        return AstNodes.mapChildren(node, this::complement);
    }
}
