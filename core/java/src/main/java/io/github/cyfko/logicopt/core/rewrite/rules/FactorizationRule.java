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

/**
 * Factorization in both directions.
 * <ul>
 *   <li>forward: {@code a & b | a & c → a & (b | c)}. Every left prefix of an OR chain is tried,
 *       shortest first, so {@code a & b | a & c | d} becomes {@code a & (b | c) | d}. A term equal
 *       to the common factor leaves the literal {@code 1} behind:
 *       {@code a & b | a → a & (b | 1)}.</li>
 *   <li>reverse: {@code (a | b) & (a | c) → a | (b & c)} for any of the four operand pairings;
 *       the remaining AND is rendered inside parentheses.</li>
 * </ul>
 * The engine rolls this rule back whenever it grows the tree.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FactorizationRule extends AbstractRewriteRule {

    public static final String NAME = "Factorization";

    public FactorizationRule() {
        super(NAME, true);
    }

    @Override
    protected AstNode rewrite(AstNode node, OptimizationMetrics metrics) {
        return factorize(node);
    }

    private AstNode factorize(AstNode node) {
        if (node instanceof Binary b && b.is(BinaryOperator.OR)) {
            return factorizeOr(b);
        }
        if (node instanceof Binary b && b.is(BinaryOperator.AND)) {
            return factorizeAnd(b);
        }
        return AstNodes.mapChildren(node, this::factorize);
    }

    private AstNode factorizeOr(Binary or) {
        List<AstNode> terms = AstNodes.flatten(or, BinaryOperator.OR);
        List<AstNode> factorizedTerms = new ArrayList<>(terms.size());
        boolean changed = false;
        for (AstNode term : terms) {
            AstNode factorized = factorize(term);
            changed |= factorized != term;
            factorizedTerms.add(factorized);
        }

        AstNode acc = factorizedTerms.get(0);
        for (int k = 1; k < factorizedTerms.size(); k++) {
            AstNode next = factorizedTerms.get(k);
            List<AstNode> prefix = AstNodes.flatten(acc, BinaryOperator.OR);
            prefix.add(next);

            AstNode common = extractCommonFactor(prefix);
            if (common != null) {
                acc = factorize(common);
                changed = true;
            } else {
                acc = Binary.or(acc, next);
            }
        }

        if (!changed) {
            return or;
        }
        return or.forceParens() ? AstNodes.withForcedParens(acc) : acc;
    }

    private AstNode factorizeAnd(Binary and) {
        AstNode left = factorize(and.left());
        AstNode right = factorize(and.right());

        if (left instanceof Binary lo && lo.is(BinaryOperator.OR)
                && right instanceof Binary ro && ro.is(BinaryOperator.OR)) {
            AstNode[][] pairings = {
                    {lo.left(), ro.left(), lo.right(), ro.right()},
                    {lo.left(), ro.right(), lo.right(), ro.left()},
                    {lo.right(), ro.left(), lo.left(), ro.right()},
                    {lo.right(), ro.right(), lo.left(), ro.left()}
            };
            for (AstNode[] p : pairings) {
                if (p[0].equals(p[1])) {
                    AstNode rest = factorize(new Binary(BinaryOperator.AND, p[2], p[3], true));
                    return Binary.or(p[0], rest);
                }
            }
        }
        return rebuild(and, left, right);
    }

    /**
     * Factors out a factor shared by every term, or returns null when there is none.
     */
    private static AstNode extractCommonFactor(List<AstNode> terms) {
        if (terms.size() < 2) {
            return null;
        }

        for (AstNode term : terms) {
            if (!AstNodes.isBinary(term, BinaryOperator.AND)) {
                continue;
            }
            for (AstNode factor : new LinkedHashSet<>(AstNodes.flatten(term, BinaryOperator.AND))) {
                if (terms.stream().allMatch(t -> containsFactor(t, factor))) {
                    List<AstNode> remainders = new ArrayList<>(terms.size());
                    for (AstNode t : terms) {
                        remainders.add(removeFactor(t, factor));
                    }
                    return Binary.and(factor, AstNodes.foldLeft(BinaryOperator.OR, remainders));
                }
            }
        }
        return null;
    }

    private static boolean containsFactor(AstNode term, AstNode factor) {
        return term.equals(factor)
                || (AstNodes.isBinary(term, BinaryOperator.AND) && AstNodes.flatten(term, BinaryOperator.AND).contains(factor));
    }

    private static AstNode removeFactor(AstNode term, AstNode factor) {
        if (term.equals(factor)) {
            return Variable.TRUE;
        }
        List<AstNode> rest = new ArrayList<>(AstNodes.flatten(term, BinaryOperator.AND));
        rest.removeIf(factor::equals);
        return rest.isEmpty() ? Variable.TRUE : AstNodes.foldLeft(BinaryOperator.AND, rest);
    }
}
