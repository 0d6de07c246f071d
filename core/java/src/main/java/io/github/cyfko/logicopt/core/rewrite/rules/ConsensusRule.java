package io.github.cyfko.logicopt.core.rewrite.rules;

import io.github.cyfko.logicopt.core.api.AstNode;
import io.github.cyfko.logicopt.core.api.Binary;
import io.github.cyfko.logicopt.core.api.BinaryOperator;
import io.github.cyfko.logicopt.core.api.Variable;
import io.github.cyfko.logicopt.core.model.OptimizationMetrics;
import io.github.cyfko.logicopt.core.rewrite.AbstractRewriteRule;
import io.github.cyfko.logicopt.core.utils.AstNodes;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Consensus theorem: {@code (X & A) | (!X & B) → (X & A) | (!X & B) | (A & B)}.
 * <p>
 * For every OR chain, each pair of terms with a complementary factor contributes the AND of
 * their remaining factors. Derived terms are added to the chain, then every term having another
 * term among its AND-factors is dropped ({@code b | a & b → b}). Adding terms can grow the tree,
 * so the engine rolls this rule back whenever it does.
 * </p>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * a & b | !a & b   →  b        (consensus b absorbs both terms)
 * a & b | !a & c   →  a & b | !a & c | b & c   (rolled back by the engine)
 * }</pre>
 *
 * <p>
 * Each derived term counts as one application of {@value #NAME}, whether or not the result is
 * later rolled back.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ConsensusRule extends AbstractRewriteRule {

    public static final String NAME = "Consensus";

    public ConsensusRule() {
        super(NAME, true);
    }

    @Override
    protected boolean recordsPassApplications() {
        return false;
    }

    @Override
    protected AstNode rewrite(AstNode node, OptimizationMetrics metrics) {
        return derive(node, metrics);
    }

    private AstNode derive(AstNode node, OptimizationMetrics metrics) {
        if (!(node instanceof Binary b) || !b.is(BinaryOperator.OR)) {
            return AstNodes.mapChildren(node, child -> derive(child, metrics));
        }

        List<AstNode> terms = AstNodes.flatten(b, BinaryOperator.OR);
        List<AstNode> derived = new ArrayList<>();
        for (int i = 0; i < terms.size(); i++) {
            for (int j = i + 1; j < terms.size(); j++) {
                consensusOf(terms.get(i), terms.get(j))
                        .filter(c -> !terms.contains(c) && !derived.contains(c))
                        .ifPresent(derived::add);
            }
        }
        metrics.recordRule(NAME, derived.size());

        Set<AstNode> all = new LinkedHashSet<>();
        for (AstNode term : terms) {
            all.add(derive(term, metrics));
        }
        for (AstNode term : derived) {
            all.add(derive(term, metrics));
        }

        List<AstNode> kept = removeAbsorbed(new ArrayList<>(all));
        if (kept.size() == 1) {
            return kept.get(0);
        }
        AstNode chain = AstNodes.foldLeft(BinaryOperator.OR, kept);
        return b.forceParens() ? AstNodes.withForcedParens(chain) : chain;
    }

    /**
     * Computes the consensus of two OR-terms.
     * <p>
     * Two AND-terms sharing a complementary factor pair yield the AND of their remaining,
     * deduplicated factors ({@code 1} when none remain); no consensus exists when those factors
     * contain a contradiction. Two complementary terms yield {@code 1}.
     * </p>
     *
     * @param first  an OR-term
     * @param second another OR-term
     * @return the consensus term, if any
     */
    public static Optional<AstNode> consensusOf(AstNode first, AstNode second) {
        if (AstNodes.isBinary(first, BinaryOperator.AND) && AstNodes.isBinary(second, BinaryOperator.AND)) {
            List<AstNode> factors1 = AstNodes.flatten(first, BinaryOperator.AND);
            List<AstNode> factors2 = AstNodes.flatten(second, BinaryOperator.AND);

            for (int i = 0; i < factors1.size(); i++) {
                for (int j = 0; j < factors2.size(); j++) {
                    if (!AstNodes.areComplementary(factors1.get(i), factors2.get(j))) {
                        continue;
                    }
                    Set<AstNode> remaining = new LinkedHashSet<>();
                    for (int k = 0; k < factors1.size(); k++) {
                        if (k != i) remaining.add(factors1.get(k));
                    }
                    for (int k = 0; k < factors2.size(); k++) {
                        if (k != j) remaining.add(factors2.get(k));
                    }

                    if (AstNodes.containsComplementaryPair(remaining)) return Optional.empty();
                    if (remaining.isEmpty()) return Optional.of(Variable.TRUE);
                    return Optional.of(AstNodes.foldLeft(BinaryOperator.AND, new ArrayList<>(remaining)));
                }
            }
        }

        if (AstNodes.areComplementary(first, second)) {
            return Optional.of(Variable.TRUE);
        }
        return Optional.empty();
    }

    private static List<AstNode> removeAbsorbed(List<AstNode> terms) {
        List<AstNode> kept = new ArrayList<>(terms.size());
        for (AstNode term : terms) {
            boolean absorbed = false;
            if (AstNodes.isBinary(term, BinaryOperator.AND)) {
                List<AstNode> factors = AstNodes.flatten(term, BinaryOperator.AND);
                for (AstNode other : terms) {
                    if (other != term && factors.contains(other)) {
                        absorbed = true;
                        break;
                    }
                }
            }
            if (!absorbed) {
                kept.add(term);
            }
        }
        return kept;
    }
}
