package io.github.cyfko.logicopt.core;

import io.github.cyfko.logicopt.core.api.AstNode;
import io.github.cyfko.logicopt.core.config.OptimizerPolicy;
import io.github.cyfko.logicopt.core.exception.ExpressionSyntaxException;
import io.github.cyfko.logicopt.core.exception.NormalFormTooComplexException;
import io.github.cyfko.logicopt.core.exception.ResourceLimitException;
import io.github.cyfko.logicopt.core.model.OptimizationMetrics;
import io.github.cyfko.logicopt.core.normalform.NormalFormConverter;
import io.github.cyfko.logicopt.core.parsing.Lexer;
import io.github.cyfko.logicopt.core.parsing.RecursiveDescentParser;
import io.github.cyfko.logicopt.core.pattern.PatternRecognizer;
import io.github.cyfko.logicopt.core.rewrite.RewriteEngine;
import io.github.cyfko.logicopt.core.utils.AstRenderer;
import io.github.cyfko.logicopt.core.utils.AstNodes;
import io.github.cyfko.logicopt.core.utils.ExpressionEvaluator;
import io.github.cyfko.logicopt.core.validation.ResourceValidator;

import java.util.Map;
import java.util.SortedSet;

/**
 * Static entry point to the optimizer, bound to {@link OptimizerPolicy#defaults()}.
 * <p>
 * Each operation is a thin delegate to the component doing the work; components are
 * stateless so a single shared instance of each is used.
 * </p>
 *
 * <pre>{@code
 * AstNode ast = LogicOptimizer.parse("a & b | !a & c");
 * AstNode optimized = LogicOptimizer.optimize(ast);
 * String cnf = LogicOptimizer.render(LogicOptimizer.toCnf(ast));
 * boolean value = LogicOptimizer.evaluate(ast, Map.of("a", true, "b", false, "c", true));
 * }</pre>
 *
 * For a cached, policy-configurable pipeline returning every form at once, see
 * {@link io.github.cyfko.logicopt.core.impl.BasicExpressionOptimizer}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class LogicOptimizer {

    private static final OptimizerPolicy POLICY = OptimizerPolicy.defaults();
    private static final RewriteEngine ENGINE = new RewriteEngine(POLICY);
    private static final NormalFormConverter CONVERTER = new NormalFormConverter(POLICY, ENGINE);
    private static final PatternRecognizer RECOGNIZER = new PatternRecognizer();

    private LogicOptimizer() {}

    /**
     * Validates, tokenizes and parses {@code text}.
     *
     * @param text the expression
     * @return the parsed tree
     * @throws ExpressionSyntaxException if the text is empty or malformed
     * @throws ResourceLimitException if the text exceeds the default length or nesting limits
     */
    public static AstNode parse(String text) {
        ResourceValidator.validateExpression(text, POLICY);
        return RecursiveDescentParser.parse(Lexer.tokenize(text));
    }

    public static AstNode optimize(AstNode ast) {
        return ENGINE.optimize(ast);
    }

    public static AstNode optimize(AstNode ast, OptimizationMetrics metrics) {
        return ENGINE.optimize(ast, metrics);
    }

    /**
     * @throws NormalFormTooComplexException if distribution exceeds the default budget
     */
    public static AstNode toCnf(AstNode ast) {
        return CONVERTER.toCnf(ast);
    }

    /**
     * @throws NormalFormTooComplexException if distribution exceeds the default budget
     */
    public static AstNode toDnf(AstNode ast) {
        return CONVERTER.toDnf(ast);
    }

    public static AstNode foldPatterns(AstNode ast) {
        return RECOGNIZER.foldPatterns(ast);
    }

    public static String render(AstNode ast) {
        return AstRenderer.render(ast);
    }

    public static SortedSet<String> variablesOf(AstNode ast) {
        return AstNodes.variablesOf(ast);
    }

    public static boolean evaluate(AstNode ast, Map<String, Boolean> assignment) {
        return ExpressionEvaluator.evaluate(ast, assignment);
    }
}
