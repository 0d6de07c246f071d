package io.github.cyfko.logicopt.core.rewrite.rules;

import io.github.cyfko.logicopt.core.api.AstNode;
import io.github.cyfko.logicopt.core.api.Binary;
import io.github.cyfko.logicopt.core.api.BinaryOperator;
import io.github.cyfko.logicopt.core.api.Not;
import io.github.cyfko.logicopt.core.api.Variable;
import io.github.cyfko.logicopt.core.model.OptimizationMetrics;
import io.github.cyfko.logicopt.core.rewrite.AbstractRewriteRule;
import io.github.cyfko.logicopt.core.utils.AstNodes;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders the terms of every AND/OR chain, simplest first, so that related terms end up next to
 * each other for {@link FactorizationRule}.
 * <p>
 * Terms are sorted by complexity score ({@code Variable = 1}, {@code Not = 2},
 * {@code Binary = 3 + score(left) + score(right)}) then by {@link #canonicalKey(AstNode)}.
 * The sort is stable, so applying the rule twice yields the same tree.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class CommutativityRule extends AbstractRewriteRule {

    public static final String NAME = "Commutativity";

    private static final Comparator<Ranked> ORDER =
            Comparator.comparingInt(Ranked::score).thenComparing(Ranked::key);

    public CommutativityRule() {
        super(NAME, false);
    }

    @Override
    protected AstNode rewrite(AstNode node, OptimizationMetrics metrics) {
        return sort(node);
    }

    private AstNode sort(AstNode node) {
        if (!(node instanceof Binary b) || !(b.is(BinaryOperator.AND) || b.is(BinaryOperator.OR))) {
            return AstNodes.mapChildren(node, this::sort);
        }

        List<Ranked> ranked = new ArrayList<>();
        for (AstNode term : AstNodes.flatten(b, b.op())) {
            AstNode sorted = sort(term);
            ranked.add(new Ranked(sorted, complexityScore(sorted), canonicalKey(sorted)));
        }
        ranked.sort(ORDER);

        List<AstNode> terms = new ArrayList<>(ranked.size());
        for (Ranked r : ranked) {
            terms.add(r.node());
        }
        AstNode chain = AstNodes.foldLeft(b.op(), terms);
        return b.forceParens() ? AstNodes.withForcedParens(chain) : chain;
    }

    /**
     * @param node a tree
     * @return the ordering score of {@code node}
     */
    static int complexityScore(AstNode node) {
        if (node instanceof Variable) return 1;
        if (node instanceof Not) return 2;
        Binary b = (Binary) node;
        return 3 + complexityScore(b.left()) + complexityScore(b.right());
    }

    /**
     * Builds a textual key identifying {@code node} up to the order of the operands of its
     * commutative operators: {@code a & (c | b)} and {@code (b | c) & a} share the key
     * {@code &(a,|(b,c))}.
     *
     * @param node a tree
     * @return the canonical key
     */
    static String canonicalKey(AstNode node) {
        if (node instanceof Variable v) {
            return v.name();
        }
        if (node instanceof Not not) {
            return "!" + canonicalKey(not.operand());
        }

        Binary b = (Binary) node;
        List<String> keys = new ArrayList<>();
        if (b.is(BinaryOperator.AND) || b.is(BinaryOperator.OR)) {
            for (AstNode term : AstNodes.flatten(b, b.op())) {
                keys.add(canonicalKey(term));
            }
        } else {
            keys.add(canonicalKey(b.left()));
            keys.add(canonicalKey(b.right()));
        }
        if (b.op().isCommutative()) {
            keys.sort(Comparator.naturalOrder());
        }
        return b.op().symbol() + "(" + String.join(",", keys) + ")";
    }

    private record Ranked(AstNode node, int score, String key) {}
}
