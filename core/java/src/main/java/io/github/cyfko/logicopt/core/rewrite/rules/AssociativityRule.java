package io.github.cyfko.logicopt.core.rewrite.rules;

import io.github.cyfko.logicopt.core.api.AstNode;
import io.github.cyfko.logicopt.core.api.Binary;
import io.github.cyfko.logicopt.core.api.BinaryOperator;
import io.github.cyfko.logicopt.core.model.OptimizationMetrics;
import io.github.cyfko.logicopt.core.rewrite.AbstractRewriteRule;
import io.github.cyfko.logicopt.core.utils.AstNodes;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Regroups AND/OR chains: nested same-operator nodes are flattened, structural duplicates removed
 * and the chain rebuilt left-associated, {@code a & (b & a) → a & b}.
 * <p>
 * The {@code forceParens} flag of the chain root is carried to the outermost rebuilt node only.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class AssociativityRule extends AbstractRewriteRule {

    public static final String NAME = "Associativity";

    public AssociativityRule() {
        super(NAME, false);
    }

    @Override
    protected AstNode rewrite(AstNode node, OptimizationMetrics metrics) {
        return regroup(node);
    }

    private AstNode regroup(AstNode node) {
        if (!(node instanceof Binary b) || !(b.is(BinaryOperator.AND) || b.is(BinaryOperator.OR))) {
            return AstNodes.mapChildren(node, this::regroup);
        }

        Set<AstNode> distinct = new LinkedHashSet<>();
        for (AstNode term : AstNodes.flatten(b, b.op())) {
            // a regrouped term may itself collapse into a chain of the same operator
            distinct.addAll(AstNodes.flatten(regroup(term), b.op()));
        }

        List<AstNode> terms = new ArrayList<>(distinct);
        if (terms.size() == 1) {
            return terms.get(0);
        }
        AstNode chain = AstNodes.foldLeft(b.op(), terms);
        return b.forceParens() ? AstNodes.withForcedParens(chain) : chain;
    }
}
