package io.github.cyfko.logicopt.core.rewrite;

import io.github.cyfko.logicopt.core.api.AstNode;
import io.github.cyfko.logicopt.core.model.OptimizationMetrics;

/**
 * One simplification step of the {@link RewriteEngine} pipeline.
 * <p>
 * A rule maps a tree to an equivalent tree and never mutates its input. It recurses through
 * every node kind by itself; the engine only calls it on the root.
 * </p>
 *
 * <h2>Implementing a Rule</h2>
 * <pre>{@code
 * public class IdentityRule implements RewriteRule {
 *     public String name() { return "Identity"; }
 *
 *     public AstNode apply(AstNode node, OptimizationMetrics metrics) {
 *         return node;
 *     }
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see AbstractRewriteRule
 */
public interface RewriteRule {

    /**
     * Returns the rule name, used as key in {@link OptimizationMetrics#getRuleApplicationCount()}.
     *
     * @return the rule name
     */
    String name();

    /**
     * Rewrites {@code node} into an equivalent tree.
     *
     * @param node    the tree to rewrite
     * @param metrics receives the applications of this rule
     * @return the rewritten tree, possibly {@code node} itself
     */
    AstNode apply(AstNode node, OptimizationMetrics metrics);

    /**
     * Tells whether the engine must discard the result of this rule when it grows the tree.
     *
     * @return true for rules that may increase the node count
     */
    default boolean rollbackProtected() {
        return false;
    }
}
