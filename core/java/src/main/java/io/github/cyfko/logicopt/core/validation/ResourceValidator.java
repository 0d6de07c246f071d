package io.github.cyfko.logicopt.core.validation;

import io.github.cyfko.logicopt.core.api.AstNode;
import io.github.cyfko.logicopt.core.config.OptimizerPolicy;
import io.github.cyfko.logicopt.core.exception.ExpressionSyntaxException;
import io.github.cyfko.logicopt.core.exception.IterationLimitExceededException;
import io.github.cyfko.logicopt.core.exception.ResourceLimitException;
import io.github.cyfko.logicopt.core.exception.TimeLimitExceededException;
import io.github.cyfko.logicopt.core.utils.AstNodes;

import java.time.Duration;
import java.util.Objects;

/**
 * Enforces the limits of an {@link OptimizerPolicy}.
 * <p>
 * Input checks run before any lexing ({@link #validateExpression}) or right after parsing
 * ({@link #validateVariableCount}); processing checks are polled by the rewrite engine before
 * every fixed-point iteration ({@link #checkIterations}, {@link #checkElapsed}).
 * </p>
 *
 * <h2>Limits</h2>
 * <table>
 *   <caption>Checks and their defaults</caption>
 *   <tr><th>Check</th><th>Default</th><th>Error</th></tr>
 *   <tr><td>expression length</td><td>10,000 chars</td><td>{@link ResourceLimitException}</td></tr>
 *   <tr><td>parenthesis depth</td><td>50</td><td>{@link ResourceLimitException}</td></tr>
 *   <tr><td>balanced parentheses</td><td>-</td><td>{@link ExpressionSyntaxException}</td></tr>
 *   <tr><td>distinct variables</td><td>100</td><td>{@link ResourceLimitException}</td></tr>
 *   <tr><td>iterations</td><td>50</td><td>{@link IterationLimitExceededException}</td></tr>
 *   <tr><td>processing time</td><td>30 s</td><td>{@link TimeLimitExceededException}</td></tr>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ResourceValidator {

    private ResourceValidator() {}

    /**
     * Validates raw expression text before it is tokenized.
     *
     * @param expression the expression text
     * @param policy     the limits to apply
     * @throws ExpressionSyntaxException if the text is null, blank or has unbalanced parentheses
     * @throws ResourceLimitException    if the text is too long or nests parentheses too deeply
     */
    public static void validateExpression(String expression, OptimizerPolicy policy) {
        Objects.requireNonNull(policy, "Optimizer policy is required");
        if (expression == null || expression.isBlank()) {
            throw new ExpressionSyntaxException("Expression cannot be null or empty");
        }

        if (expression.length() > policy.maxExpressionLength()) {
            throw new ResourceLimitException(String.format(
                    "Expression too long. Maximum %d characters, got %d. Policy applied: %s",
                    policy.maxExpressionLength(), expression.length(), policy.policyName()),
                    "maxExpressionLength", policy.maxExpressionLength(), expression.length());
        }

        int depth = 0;
        int maxDepth = 0;
        int firstUnclosed = -1;
        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (c == '(') {
                if (depth == 0) firstUnclosed = i;
                depth++;
                maxDepth = Math.max(maxDepth, depth);
            } else if (c == ')') {
                if (depth == 0) {
                    throw new ExpressionSyntaxException(
                            "Unbalanced parentheses in expression: unmatched ')' at position " + i, i);
                }
                depth--;
            }
        }

        if (maxDepth > policy.maxParenthesesDepth()) {
            throw new ResourceLimitException(String.format(
                    "Too deep nesting of parentheses. Maximum %d levels, found %d",
                    policy.maxParenthesesDepth(), maxDepth),
                    "maxParenthesesDepth", policy.maxParenthesesDepth(), maxDepth);
        }

        if (depth != 0) {
            throw new ExpressionSyntaxException(
                    "Unbalanced parentheses in expression: unmatched '(' at position " + firstUnclosed,
                    firstUnclosed);
        }
    }

    /**
     * Validates the number of distinct free variables of a parsed tree.
     *
     * @param ast    the parsed tree
     * @param policy the limits to apply
     * @throws ResourceLimitException if the tree has more variables than allowed
     */
    public static void validateVariableCount(AstNode ast, OptimizerPolicy policy) {
        int count = AstNodes.variablesOf(ast).size();
        if (count > policy.maxVariables()) {
            throw new ResourceLimitException(String.format(
                    "Too many variables. Maximum %d, found %d", policy.maxVariables(), count),
                    "maxVariables", policy.maxVariables(), count);
        }
    }

    /**
     * Checks whether one more fixed-point iteration may start.
     *
     * @param completedIterations iterations already run
     * @param policy              the limits to apply
     * @throws IterationLimitExceededException if {@code completedIterations} reached the limit
     */
    public static void checkIterations(int completedIterations, OptimizerPolicy policy) {
        if (completedIterations >= policy.maxIterations()) {
            throw new IterationLimitExceededException(policy.maxIterations());
        }
    }

    /**
     * Checks the wall-clock time spent since {@code startNanos}.
     *
     * @param startNanos value of {@link System#nanoTime()} when processing started
     * @param policy     the limits to apply
     * @throws TimeLimitExceededException if the elapsed time exceeds the limit
     */
    public static void checkElapsed(long startNanos, OptimizerPolicy policy) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        if (elapsed.compareTo(policy.maxProcessingTime()) > 0) {
            throw new TimeLimitExceededException(policy.maxProcessingTime(), elapsed);
        }
    }
}
