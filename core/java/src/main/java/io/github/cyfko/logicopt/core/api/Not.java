package io.github.cyfko.logicopt.core.api;

import io.github.cyfko.logicopt.core.utils.AstRenderer;

import java.util.Objects;

/**
 * Logical negation of a single operand.
 *
 * @param operand the negated subtree
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Not(AstNode operand) implements AstNode {

    public Not {
        Objects.requireNonNull(operand, "operand is required");
    }

    @Override
    public int nodeCount() {
        return 1 + operand.nodeCount();
    }

    @Override
    public String toString() {
        return AstRenderer.render(this);
    }
}
