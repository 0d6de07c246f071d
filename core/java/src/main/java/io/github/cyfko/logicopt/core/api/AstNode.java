package io.github.cyfko.logicopt.core.api;

import io.github.cyfko.logicopt.core.utils.AstRenderer;

/**
 * Immutable node of a propositional-logic abstract syntax tree.
 * <p>
 * A tree is built from three kinds of nodes:
 * </p>
 * <ul>
 *   <li>{@link Variable} - a named variable, or one of the constants {@code 0}/{@code 1}</li>
 *   <li>{@link Not} - logical negation of one operand</li>
 *   <li>{@link Binary} - a binary operation identified by a {@link BinaryOperator}</li>
 * </ul>
 *
 * <p>
 * Nodes are values: equality and hashing are structural and recursive, and every
 * transformation builds a new tree instead of mutating an existing one. Subtrees may therefore
 * be shared freely between trees.
 * </p>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * AstNode ast = Binary.or(
 *     Binary.and(new Variable("a"), new Not(new Variable("b"))),
 *     new Variable("c"));
 *
 * ast.toString();   // "a & !b | c"
 * ast.nodeCount();  // 6
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface AstNode {

    /**
     * Returns the number of nodes of this tree (every variable, negation and binary node counts one).
     *
     * @return the node count, at least 1
     */
    int nodeCount();

    /**
     * Renders this tree with the precedence-aware infix syntax.
     *
     * @return the rendered expression
     * @see AstRenderer#render(AstNode)
     */
    default String render() {
        return AstRenderer.render(this);
    }
}
