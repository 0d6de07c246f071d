package io.github.cyfko.logicopt.core.utils;

import io.github.cyfko.logicopt.core.api.AstNode;
import io.github.cyfko.logicopt.core.api.Binary;
import io.github.cyfko.logicopt.core.api.BinaryOperator;
import io.github.cyfko.logicopt.core.api.Not;
import io.github.cyfko.logicopt.core.api.Variable;
import io.github.cyfko.logicopt.core.config.ReservedSymbol;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.UnaryOperator;

/**
 * Helpers shared by the rewrite rules, the normal-form converter and the pattern recognizer.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class AstNodes {

    private AstNodes() {}

    /**
     * @param node a tree
     * @return whether {@code node} is the constant {@code 1}
     */
    public static boolean isTrue(AstNode node) {
        return node instanceof Variable v && ReservedSymbol.TRUE.equals(v.name());
    }

    /**
     * @param node a tree
     * @return whether {@code node} is the constant {@code 0}
     */
    public static boolean isFalse(AstNode node) {
        return node instanceof Variable v && ReservedSymbol.FALSE.equals(v.name());
    }

    /**
     * @param node a tree
     * @param op   an operator
     * @return whether {@code node} is a binary node using {@code op}
     */
    public static boolean isBinary(AstNode node, BinaryOperator op) {
        return node instanceof Binary b && b.op() == op;
    }

    /**
     * Tells whether {@code a} and {@code b} are a complementary pair, i.e. one is the negation of the other.
     *
     * @param a first node
     * @param b second node
     * @return true when {@code a == !b} or {@code b == !a}
     */
    public static boolean areComplementary(AstNode a, AstNode b) {
        return (a instanceof Not na && na.operand().equals(b))
                || (b instanceof Not nb && nb.operand().equals(a));
    }

    /**
     * Tells whether {@code terms} contains some node together with its negation.
     *
     * @param terms the terms to inspect
     * @return true if two of the terms are complementary
     */
    public static boolean containsComplementaryPair(Collection<? extends AstNode> terms) {
        Set<AstNode> seen = new HashSet<>(terms);
        for (AstNode term : terms) {
            if (term instanceof Not not && seen.contains(not.operand())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Flattens a same-operator chain into its operand list, left to right.
     * <p>
     * {@code flatten(a & (b & c) & d, AND)} yields {@code [a, b, c, d]}. A node that does not use
     * {@code op} yields a singleton list.
     * </p>
     *
     * @param node the chain root
     * @param op   the chain operator
     * @return the operands, in order
     */
    public static List<AstNode> flatten(AstNode node, BinaryOperator op) {
        List<AstNode> terms = new ArrayList<>();
        collect(node, op, terms);
        return terms;
    }

    private static void collect(AstNode node, BinaryOperator op, List<AstNode> terms) {
        if (node instanceof Binary b && b.op() == op) {
            collect(b.left(), op, terms);
            collect(b.right(), op, terms);
        } else {
            terms.add(node);
        }
    }

    /**
     * Rebuilds a chain as a left-associated tree, the shape the parser produces.
     *
     * @param op    the chain operator
     * @param terms at least one operand
     * @return {@code ((t0 op t1) op t2) ...}, or {@code t0} alone
     * @throws IllegalArgumentException if {@code terms} is empty
     */
    public static AstNode foldLeft(BinaryOperator op, List<? extends AstNode> terms) {
        if (terms.isEmpty()) {
            throw new IllegalArgumentException("Cannot fold an empty term list");
        }
        AstNode result = terms.get(0);
        for (int i = 1; i < terms.size(); i++) {
            result = new Binary(op, result, terms.get(i), false);
        }
        return result;
    }

    /**
     * Collects the free variables of {@code node}, excluding the constants.
     *
     * @param node a tree
     * @return the variable names in natural order
     */
    public static SortedSet<String> variablesOf(AstNode node) {
        Objects.requireNonNull(node, "node is required");
        SortedSet<String> names = new TreeSet<>();
        collectVariables(node, names);
        return names;
    }

    private static void collectVariables(AstNode node, SortedSet<String> names) {
        if (node instanceof Variable v) {
            if (!v.isConstant()) {
                names.add(v.name());
            }
        } else if (node instanceof Not not) {
            collectVariables(not.operand(), names);
        } else if (node instanceof Binary b) {
            collectVariables(b.left(), names);
            collectVariables(b.right(), names);
        }
    }

    /**
     * Applies {@code fn} to the direct children of {@code node} and rebuilds it with the same
     * operator and {@code forceParens}. Returns {@code node} itself when {@code fn} returned every
     * child instance unchanged.
     *
     * @param node a tree
     * @param fn   transformation of each child
     * @return the rebuilt node
     */
    public static AstNode mapChildren(AstNode node, UnaryOperator<AstNode> fn) {
        if (node instanceof Not not) {
            AstNode operand = fn.apply(not.operand());
            return operand == not.operand() ? node : new Not(operand);
        }
        if (node instanceof Binary b) {
            AstNode left = fn.apply(b.left());
            AstNode right = fn.apply(b.right());
            if (left == b.left() && right == b.right()) {
                return node;
            }
            return b.withOperands(left, right);
        }
        return node;
    }
    /**
     * Applies {@code fn} to the operands of the {@code op} chain rooted at {@code node}, keeping the
     * shape of the chain and the {@code forceParens} flag of each of its nodes.
     *
     * @param node the chain root
     * @param op   the chain operator
     * @param fn   transformation of each operand
     * @return the rebuilt chain, or {@code node} itself when no operand instance changed
     */
    public static AstNode mapChainTerms(AstNode node, BinaryOperator op, UnaryOperator<AstNode> fn) {
        if (node instanceof Binary b && b.op() == op) {
            AstNode left = mapChainTerms(b.left(), op, fn);
            AstNode right = mapChainTerms(b.right(), op, fn);
            return left == b.left() && right == b.right() ? b : b.withOperands(left, right);
        }
        return fn.apply(node);
    }

    /**
     * Returns a copy of {@code node} that is always rendered inside parentheses.
     *
     * @param node a tree
     * @return {@code node} with {@code forceParens} set, or {@code node} itself if it is not binary
     */
    public static AstNode withForcedParens(AstNode node) {
        if (node instanceof Binary b && !b.forceParens()) {
            return new Binary(b.op(), b.left(), b.right(), true);
        }
        return node;
    }

    /**
     * Rewrites every XOR, NAND, NOR and implication node in terms of AND, OR and NOT.
     * <ul>
     *   <li>{@code A ^ B → A & !B | !A & B}</li>
     *   <li>{@code A ~& B → !(A & B)}</li>
     *   <li>{@code A ~| B → !(A | B)}</li>
     *   <li>{@code A → B → !A | B}</li>
     * </ul>
     *
     * @param node a tree
     * @return an equivalent tree using only AND, OR and NOT, or {@code node} itself when it has no derived operator
     */
    public static AstNode toBasicOperators(AstNode node) {
        AstNode lowered = mapChildren(node, AstNodes::toBasicOperators);
        if (!(lowered instanceof Binary b)) {
            return lowered;
        }
        AstNode l = b.left();
        AstNode r = b.right();
        return switch (b.op()) {
            case AND, OR -> lowered;
            case XOR -> Binary.or(Binary.and(l, new Not(r)), Binary.and(new Not(l), r));
            case NAND -> new Not(Binary.and(l, r));
            case NOR -> new Not(Binary.or(l, r));
            case IMP -> Binary.or(new Not(l), r);
        };
    }
}
