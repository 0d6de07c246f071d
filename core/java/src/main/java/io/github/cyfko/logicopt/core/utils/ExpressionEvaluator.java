package io.github.cyfko.logicopt.core.utils;

import io.github.cyfko.logicopt.core.api.AstNode;
import io.github.cyfko.logicopt.core.api.Binary;
import io.github.cyfko.logicopt.core.api.Not;
import io.github.cyfko.logicopt.core.api.Variable;
import io.github.cyfko.logicopt.core.config.ReservedSymbol;

import java.util.Map;
import java.util.Objects;

/**
 * Recursive tree-walking evaluator.
 * <p>
 * The constants {@code 0} and {@code 1} evaluate to themselves; every other variable must be
 * assigned in the supplied map.
 * </p>
 *
 * <pre>{@code
 * AstNode ast = LogicOptimizer.parse("a & !b");
 * ExpressionEvaluator.evaluate(ast, Map.of("a", true, "b", false)); // true
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ExpressionEvaluator {

    private ExpressionEvaluator() {}

    /**
     * Evaluates {@code node} under the given assignment.
     *
     * @param node       the tree to evaluate
     * @param assignment truth value of each free variable
     * @return the truth value of the expression
     * @throws IllegalArgumentException if a free variable of {@code node} is not assigned
     */
    public static boolean evaluate(AstNode node, Map<String, Boolean> assignment) {
        Objects.requireNonNull(node, "node is required");
        Objects.requireNonNull(assignment, "assignment is required");
        return eval(node, assignment);
    }

    private static boolean eval(AstNode node, Map<String, Boolean> assignment) {
        if (node instanceof Variable variable) {
            String name = variable.name();
            if (ReservedSymbol.TRUE.equals(name)) return true;
            if (ReservedSymbol.FALSE.equals(name)) return false;

            Boolean value = assignment.get(name);
            if (value == null) {
                throw new IllegalArgumentException("Variable '" + name + "' has no assigned value");
            }
            return value;
        }
        if (node instanceof Not not) {
            return !eval(not.operand(), assignment);
        }
        if (node instanceof Binary binary) {
            return binary.op().apply(eval(binary.left(), assignment), eval(binary.right(), assignment));
        }
        throw new IllegalArgumentException("Unsupported node type: " + node.getClass().getName());
    }
}
