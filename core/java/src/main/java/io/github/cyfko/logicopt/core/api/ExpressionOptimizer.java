package io.github.cyfko.logicopt.core.api;

import io.github.cyfko.logicopt.core.exception.ExpressionSyntaxException;
import io.github.cyfko.logicopt.core.exception.OptimizationAbortedException;
import io.github.cyfko.logicopt.core.exception.ResourceLimitException;
import io.github.cyfko.logicopt.core.model.OptimizationResult;

/**
 * Runs the whole optimization pipeline on a textual propositional expression.
 * <p>
 * The pipeline validates the raw text against the resource policy, tokenizes and parses it,
 * rewrites the tree to a fixed point, derives its CNF and DNF, and folds XOR and implication
 * patterns into a display form.
 * </p>
 *
 * <h2>Expression Syntax</h2>
 * <table border="1">
 * <caption>Operator Reference</caption>
 * <thead>
 * <tr><th>Operator</th><th>Symbol</th><th>Precedence</th><th>Example</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>Parentheses</td><td>( )</td><td>Highest</td><td>(a | b) &amp; c</td></tr>
 * <tr><td>NOT</td><td>!</td><td>3</td><td>!a</td></tr>
 * <tr><td>AND</td><td>&amp;</td><td>2</td><td>a &amp; b</td></tr>
 * <tr><td>OR</td><td>|</td><td>1</td><td>a | b</td></tr>
 * </tbody>
 * </table>
 * <p>
 * Identifiers match {@code [A-Za-z_][A-Za-z0-9_]*}; {@code 0} and {@code 1} are the constants.
 * </p>
 *
 * <pre>{@code
 * ExpressionOptimizer optimizer = new BasicExpressionOptimizer();
 * OptimizationResult result = optimizer.optimizeExpression("(a | b) & (a | c)", true);
 * result.optimizedText();  // a | (b & c)
 * result.metrics();        // rules applied, iterations, timing
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface ExpressionOptimizer {

    /**
     * Optimizes {@code text}.
     *
     * @param text the expression to optimize
     * @param includeMetrics whether the result carries the {@code OptimizationMetrics} of the run
     * @return the optimized, normal-form and display trees of the expression
     * @throws ExpressionSyntaxException if the text is empty, malformed or contains an invalid token
     * @throws ResourceLimitException if the text or its variables exceed the policy
     * @throws OptimizationAbortedException if rewriting exceeds the iteration or time budget
     */
    OptimizationResult optimizeExpression(String text, boolean includeMetrics);
}
