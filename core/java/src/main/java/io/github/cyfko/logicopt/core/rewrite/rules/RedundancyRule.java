package io.github.cyfko.logicopt.core.rewrite.rules;

import io.github.cyfko.logicopt.core.api.AstNode;
import io.github.cyfko.logicopt.core.api.Binary;
import io.github.cyfko.logicopt.core.api.BinaryOperator;
import io.github.cyfko.logicopt.core.model.OptimizationMetrics;
import io.github.cyfko.logicopt.core.rewrite.AbstractRewriteRule;
import io.github.cyfko.logicopt.core.utils.AstNodes;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Removes redundant terms in three passes.
 * <ol>
 *   <li>Absorbed terms: in an OR chain a term is dropped when another term is one of its
 *       AND-factors ({@code a | a & b → a}); in an AND chain when another term is one of its
 *       OR-terms ({@code a & (a | b) → a}).</li>
 *   <li>Consensus terms: an AND-term of an OR chain that is the consensus of two other remaining
 *       terms is dropped ({@code a & b | !a & c | b & c → a & b | !a & c}). Each drop counts as one
 *       application of {@value #CONSENSUS_SIMPLIFICATION}.</li>
 *   <li>Sibling merge: {@code (A & B) & (A & C) → A & (B & C)} and
 *       {@code (A | B) | (A | C) → A | (B | C)}.</li>
 * </ol>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class RedundancyRule extends AbstractRewriteRule {

    public static final String NAME = "Redundancy";
    public static final String CONSENSUS_SIMPLIFICATION = "ConsensusSimplification";

    public RedundancyRule() {
        super(NAME, false);
    }

    @Override
    protected AstNode rewrite(AstNode node, OptimizationMetrics metrics) {
        AstNode result = dropAbsorbed(node);
        result = dropConsensusTerms(result, metrics);
        return mergeSiblings(result);
    }

    // --- absorbed terms ---

    private AstNode dropAbsorbed(AstNode node) {
        if (!(node instanceof Binary b) || !(b.is(BinaryOperator.AND) || b.is(BinaryOperator.OR))) {
            return AstNodes.mapChildren(node, this::dropAbsorbed);
        }

        List<AstNode> terms = AstNodes.flatten(b, b.op());
        List<AstNode> kept = new ArrayList<>(terms.size());
        boolean changed = false;

        for (AstNode term : terms) {
            AstNode candidate = dropAbsorbed(term);
            changed |= candidate != term;

            boolean absorbed = false;
            for (AstNode survivor : kept) {
                if (absorbs(b.op(), survivor, candidate)) {
                    absorbed = true;
                    break;
                }
            }
            if (absorbed) {
                changed = true;
                continue;
            }
            changed |= kept.removeIf(survivor -> absorbs(b.op(), candidate, survivor));
            kept.add(candidate);
        }

        if (!changed) {
            return node;
        }
        if (kept.size() == 1) {
            return kept.get(0);
        }
        AstNode chain = AstNodes.foldLeft(b.op(), kept);
        return b.forceParens() ? AstNodes.withForcedParens(chain) : chain;
    }

    /**
     * Tells whether {@code absorber} makes {@code absorbed} redundant in a chain of {@code op}.
     */
    private static boolean absorbs(BinaryOperator op, AstNode absorber, AstNode absorbed) {
        if (absorber.equals(absorbed)) {
            return true;
        }
        BinaryOperator dual = op == BinaryOperator.AND ? BinaryOperator.OR : BinaryOperator.AND;
        return AstNodes.isBinary(absorbed, dual) && AstNodes.flatten(absorbed, dual).contains(absorber);
    }

    // --- consensus terms ---

    private AstNode dropConsensusTerms(AstNode node, OptimizationMetrics metrics) {
        if (!(node instanceof Binary b) || !b.is(BinaryOperator.OR)) {
            return AstNodes.mapChildren(node, child -> dropConsensusTerms(child, metrics));
        }

        AstNode mapped = AstNodes.mapChainTerms(b, BinaryOperator.OR, term -> dropConsensusTerms(term, metrics));
        List<AstNode> terms = AstNodes.flatten(mapped, BinaryOperator.OR);
        List<AstNode> kept = new ArrayList<>(terms);
        int dropped = 0;

        for (AstNode term : terms) {
            if (AstNodes.isBinary(term, BinaryOperator.AND) && isConsensusOfOthers(term, kept)) {
                kept.remove(term);
                dropped++;
            }
        }

        if (dropped == 0) {
            return mapped;
        }
        metrics.recordRule(CONSENSUS_SIMPLIFICATION, dropped);

        if (kept.size() == 1) {
            return kept.get(0);
        }
        AstNode chain = AstNodes.foldLeft(BinaryOperator.OR, kept);
        return b.forceParens() ? AstNodes.withForcedParens(chain) : chain;
    }

    private static boolean isConsensusOfOthers(AstNode term, List<AstNode> terms) {
        for (int i = 0; i < terms.size(); i++) {
            if (terms.get(i).equals(term)) continue;
            for (int j = i + 1; j < terms.size(); j++) {
                if (terms.get(j).equals(term)) continue;
                Optional<AstNode> consensus = ConsensusRule.consensusOf(terms.get(i), terms.get(j));
                if (consensus.isPresent() && consensus.get().equals(term)) {
                    return true;
                }
            }
        }
        return false;
    }

    // --- sibling merge ---

    private AstNode mergeSiblings(AstNode node) {
        if (!(node instanceof Binary b) || !(b.is(BinaryOperator.AND) || b.is(BinaryOperator.OR))) {
            return AstNodes.mapChildren(node, this::mergeSiblings);
        }

        AstNode left = mergeSiblings(b.left());
        AstNode right = mergeSiblings(b.right());

        if (left instanceof Binary lb && lb.op() == b.op()
                && right instanceof Binary rb && rb.op() == b.op()
                && lb.left().equals(rb.left())) {
            AstNode rest = mergeSiblings(new Binary(b.op(), lb.right(), rb.right(), false));
            return new Binary(b.op(), lb.left(), rest, b.forceParens());
        }
        return rebuild(b, left, right);
    }
}
