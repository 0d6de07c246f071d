package io.github.cyfko.logicopt.core.rewrite;

import io.github.cyfko.logicopt.core.api.AstNode;
import io.github.cyfko.logicopt.core.api.Binary;
import io.github.cyfko.logicopt.core.model.OptimizationMetrics;

import java.util.Objects;

/**
 * Base class of the built-in rules.
 * <p>
 * Records one application under {@link #name()} each time {@link #rewrite} returns a tree that is
 * not structurally equal to its input. Rules that count their applications in finer detail
 * override {@link #recordsPassApplications()}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class AbstractRewriteRule implements RewriteRule {

    private final String name;
    private final boolean rollbackProtected;

    protected AbstractRewriteRule(String name, boolean rollbackProtected) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.rollbackProtected = rollbackProtected;
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final boolean rollbackProtected() {
        return rollbackProtected;
    }

    @Override
    public final AstNode apply(AstNode node, OptimizationMetrics metrics) {
        Objects.requireNonNull(node, "node is required");
        Objects.requireNonNull(metrics, "metrics are required");

        AstNode result = rewrite(node, metrics);
        if (recordsPassApplications() && !result.equals(node)) {
            metrics.recordRule(name);
        }
        return result;
    }

    /**
     * Rewrites the whole tree rooted at {@code node}.
     *
     * @param node    the tree to rewrite
     * @param metrics the metrics of the current optimize call
     * @return the rewritten tree
     */
    protected abstract AstNode rewrite(AstNode node, OptimizationMetrics metrics);

    /**
     * @return whether {@link #apply} records one application per changing pass
     */
    protected boolean recordsPassApplications() {
        return true;
    }

    /**
     * Rebuilds {@code original} with new operands, or returns it when both operands are the same instances.
     */
    protected static AstNode rebuild(Binary original, AstNode left, AstNode right) {
        return left == original.left() && right == original.right() ? original : original.withOperands(left, right);
    }
}
