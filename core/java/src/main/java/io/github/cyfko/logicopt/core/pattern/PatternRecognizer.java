package io.github.cyfko.logicopt.core.pattern;

import io.github.cyfko.logicopt.core.api.AstNode;
import io.github.cyfko.logicopt.core.api.Binary;
import io.github.cyfko.logicopt.core.api.BinaryOperator;
import io.github.cyfko.logicopt.core.api.Not;
import io.github.cyfko.logicopt.core.api.Variable;
import io.github.cyfko.logicopt.core.utils.AstNodes;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Folds primitive encodings back into derived operators, for display.
 * <ul>
 *   <li>XOR: {@code a & !b | !a & b → a ^ b}</li>
 *   <li>implication: {@code !a | b → a → b}</li>
 * </ul>
 * <p>
 * Every OR chain is flattened and its terms folded recursively; then XOR pairs, and after them
 * implication pairs, are replaced one at a time until none remains. The folded node takes the
 * place of the first term of its pair, and the remaining terms are joined left to right again.
 * Constants are never folded. The result is equivalent to the input but is meant for rendering
 * only: the rewrite engine and the normal-form converter do not rely on derived operators.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class PatternRecognizer {

    private static final Logger log = Logger.getLogger(PatternRecognizer.class.getName());

    /**
     * Folds XOR and implication patterns of {@code ast}.
     *
     * @param ast the tree to fold
     * @return the folded tree, or {@code ast} itself when folding fails
     */
    public AstNode foldPatterns(AstNode ast) {
        Objects.requireNonNull(ast, "ast is required");
        try {
            return fold(ast);
        } catch (RuntimeException e) {
            log.log(Level.FINE, "Pattern folding failed, keeping the input tree", e);
            return ast;
        }
    }

    private AstNode fold(AstNode node) {
        if (!AstNodes.isBinary(node, BinaryOperator.OR)) {
            return AstNodes.mapChildren(node, this::fold);
        }

        List<AstNode> terms = new ArrayList<>();
        for (AstNode term : AstNodes.flatten(node, BinaryOperator.OR)) {
            terms.add(fold(term));
        }

        boolean folded = false;
        while (foldXorPair(terms) || foldImplicationPair(terms)) {
            folded = true;
        }

        if (!folded && terms.equals(AstNodes.flatten(node, BinaryOperator.OR))) {
            return node;
        }
        return AstNodes.foldLeft(BinaryOperator.OR, terms);
    }

    private static boolean foldXorPair(List<AstNode> terms) {
        for (int i = 0; i < terms.size(); i++) {
            Literal[] first = twoLiterals(terms.get(i));
            if (first == null) continue;

            for (int j = i + 1; j < terms.size(); j++) {
                Literal[] second = twoLiterals(terms.get(j));
                if (second != null && isXorPair(first, second)) {
                    terms.set(i, new Binary(BinaryOperator.XOR, first[0].variable(), first[1].variable(), false));
                    terms.remove(j);
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean isXorPair(Literal[] first, Literal[] second) {
        if (first[0].variable().equals(first[1].variable()) || first[0].negated() == first[1].negated()) {
            return false;
        }
        for (Literal expected : first) {
            Literal flipped = new Literal(expected.variable(), !expected.negated());
            if (!flipped.equals(second[0]) && !flipped.equals(second[1])) {
                return false;
            }
        }
        return true;
    }

    private static boolean foldImplicationPair(List<AstNode> terms) {
        int negated = -1;
        int positive = -1;
        for (int i = 0; i < terms.size(); i++) {
            Literal literal = literalOf(terms.get(i));
            if (literal == null) continue;
            if (literal.negated() && negated < 0) negated = i;
            if (!literal.negated() && positive < 0) positive = i;
        }
        if (negated < 0 || positive < 0) {
            return false;
        }

        Variable premise = literalOf(terms.get(negated)).variable();
        Variable conclusion = (Variable) terms.get(positive);
        int first = Math.min(negated, positive);
        int second = Math.max(negated, positive);
        terms.set(first, new Binary(BinaryOperator.IMP, premise, conclusion, false));
        terms.remove(second);
        return true;
    }

    /**
     * Returns the two literals of an AND of exactly two literals, or null.
     */
    private static Literal[] twoLiterals(AstNode term) {
        if (!(term instanceof Binary b) || !b.is(BinaryOperator.AND)) {
            return null;
        }
        Literal left = literalOf(b.left());
        Literal right = literalOf(b.right());
        return left == null || right == null ? null : new Literal[]{left, right};
    }

    /**
     * Returns the literal form of a non-constant variable or its negation, or null.
     */
    private static Literal literalOf(AstNode node) {
        if (node instanceof Variable v && !v.isConstant()) {
            return new Literal(v, false);
        }
        if (node instanceof Not not && not.operand() instanceof Variable v && !v.isConstant()) {
            return new Literal(v, true);
        }
        return null;
    }

    private record Literal(Variable variable, boolean negated) {}
}
