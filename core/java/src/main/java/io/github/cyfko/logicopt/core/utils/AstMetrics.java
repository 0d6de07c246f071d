package io.github.cyfko.logicopt.core.utils;

import io.github.cyfko.logicopt.core.api.AstNode;
import io.github.cyfko.logicopt.core.api.Binary;
import io.github.cyfko.logicopt.core.api.Not;
import io.github.cyfko.logicopt.core.api.Variable;

/**
 * Structural measures of a tree.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class AstMetrics {

    private AstMetrics() {}

    /**
     * @param node a tree
     * @return the number of nodes
     */
    public static int countNodes(AstNode node) {
        return node.nodeCount();
    }

    /**
     * Returns the height of the tree; a single variable has depth 1.
     *
     * @param node a tree
     * @return the depth
     */
    public static int depth(AstNode node) {
        if (node instanceof Not not) {
            return 1 + depth(not.operand());
        }
        if (node instanceof Binary binary) {
            return 1 + Math.max(depth(binary.left()), depth(binary.right()));
        }
        return 1;
    }

    /**
     * Counts negation and binary nodes.
     *
     * @param node a tree
     * @return the operator count
     */
    public static int countOperators(AstNode node) {
        if (node instanceof Not not) {
            return 1 + countOperators(not.operand());
        }
        if (node instanceof Binary binary) {
            return 1 + countOperators(binary.left()) + countOperators(binary.right());
        }
        return 0;
    }

    /**
     * Counts variable occurrences, constants included.
     *
     * @param node a tree
     * @return the literal count
     */
    public static int countLiterals(AstNode node) {
        if (node instanceof Variable) {
            return 1;
        }
        if (node instanceof Not not) {
            return countLiterals(not.operand());
        }
        Binary binary = (Binary) node;
        return countLiterals(binary.left()) + countLiterals(binary.right());
    }
}
