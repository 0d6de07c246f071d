package io.github.cyfko.logicopt.core.impl;

import io.github.cyfko.logicopt.core.api.AstNode;
import io.github.cyfko.logicopt.core.api.ExpressionOptimizer;
import io.github.cyfko.logicopt.core.cache.BoundedLRUCache;
import io.github.cyfko.logicopt.core.config.CachePolicy;
import io.github.cyfko.logicopt.core.config.OptimizerPolicy;
import io.github.cyfko.logicopt.core.model.OptimizationMetrics;
import io.github.cyfko.logicopt.core.model.OptimizationResult;
import io.github.cyfko.logicopt.core.normalform.NormalForm;
import io.github.cyfko.logicopt.core.normalform.NormalFormConverter;
import io.github.cyfko.logicopt.core.parsing.Lexer;
import io.github.cyfko.logicopt.core.parsing.RecursiveDescentParser;
import io.github.cyfko.logicopt.core.pattern.PatternRecognizer;
import io.github.cyfko.logicopt.core.rewrite.RewriteEngine;
import io.github.cyfko.logicopt.core.utils.AstNodes;
import io.github.cyfko.logicopt.core.validation.ResourceValidator;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Default {@link ExpressionOptimizer}: a policy-bound pipeline with an optional result cache.
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li>{@link ResourceValidator#validateExpression}: emptiness, length, parenthesis balance and depth</li>
 *   <li>{@link Lexer} and {@link RecursiveDescentParser}</li>
 *   <li>{@link RewriteEngine}: fixed-point rewriting, variable count, iteration and time limits</li>
 *   <li>{@link NormalFormConverter}: CNF and DNF of the optimized tree; a conversion that exceeds its
 *       distribution budget is flagged on the result instead of failing the call</li>
 *   <li>{@link PatternRecognizer}: display form with XOR and implication folded</li>
 * </ol>
 *
 * <h2>Caching</h2>
 * <p>
 * With caching enabled, results are kept per {@code (text, includeMetrics)} pair in a
 * {@link BoundedLRUCache} sized by the {@link CachePolicy}. A cached result, metrics included, is
 * returned as is on a repeated call, so its metrics describe the run that produced it. Failed
 * calls are never cached.
 * </p>
 *
 * <pre>{@code
 * BasicExpressionOptimizer optimizer = new BasicExpressionOptimizer(OptimizerPolicy.strict(), CachePolicy.strict());
 * optimizer.optimizeExpression("a & b | !a & c", true).cnfText();
 * optimizer.getCacheStats();  // {enabled=true, size=1, maxSize=500}
 * }</pre>
 *
 * <p>Instances are thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicExpressionOptimizer implements ExpressionOptimizer {

    private static final Logger log = Logger.getLogger(BasicExpressionOptimizer.class.getName());

    private final OptimizerPolicy optimizerPolicy;
    private final CachePolicy cachePolicy;
    private final RewriteEngine engine;
    private final NormalFormConverter converter;
    private final PatternRecognizer recognizer;
    protected final BoundedLRUCache<CacheKey, OptimizationResult> cache;

    /**
     * Creates an optimizer with {@link OptimizerPolicy#defaults()} and {@link CachePolicy#defaults()}.
     */
    public BasicExpressionOptimizer() {
        this(OptimizerPolicy.defaults(), CachePolicy.defaults());
    }

    /**
     * Creates an optimizer with the given limits and {@link CachePolicy#defaults()}.
     *
     * @param optimizerPolicy resource limits applied to every call
     * @throws IllegalArgumentException if {@code optimizerPolicy} is null
     */
    public BasicExpressionOptimizer(OptimizerPolicy optimizerPolicy) {
        this(optimizerPolicy, CachePolicy.defaults());
    }

    /**
     * Creates an optimizer.
     *
     * @param optimizerPolicy resource limits applied to every call
     * @param cachePolicy     result cache configuration
     * @throws IllegalArgumentException if either policy is null
     */
    public BasicExpressionOptimizer(OptimizerPolicy optimizerPolicy, CachePolicy cachePolicy) {
        if (optimizerPolicy == null) {
            throw new IllegalArgumentException("Optimizer policy is required");
        }

        if (cachePolicy == null) {
            throw new IllegalArgumentException("Cache policy is required");
        }

        this.optimizerPolicy = optimizerPolicy;
        this.cachePolicy = cachePolicy;
        this.engine = new RewriteEngine(optimizerPolicy);
        this.converter = new NormalFormConverter(optimizerPolicy, engine);
        this.recognizer = new PatternRecognizer();
        this.cache = cachePolicy.cacheEnabled()
            ? new BoundedLRUCache<>(cachePolicy.cacheSize())
            : null;
    }

    public OptimizerPolicy getOptimizerPolicy() {
        return optimizerPolicy;
    }

    /**
     * Empties the result cache. No-op when caching is disabled.
     */
    public void clearCache() {
        if (cache != null) {
            cache.clear();
        }
    }

    /**
     * Returns {@code {enabled=false}} when caching is disabled, otherwise the current
     * {@code size} and configured {@code maxSize} along with {@code enabled=true}.
     *
     * @return cache statistics
     */
    public Map<String, Object> getCacheStats() {
        if (cache == null) {
            return Map.of("enabled", false);
        }

        return Map.of(
            "enabled", true,
            "size", cache.size(),
            "maxSize", cachePolicy.cacheSize()
        );
    }

    @Override
    public OptimizationResult optimizeExpression(String text, boolean includeMetrics) {
        // Rejected input never reaches the cache
        ResourceValidator.validateExpression(text, optimizerPolicy);

        if (cache != null) {
            return cache.computeIfAbsent(new CacheKey(text, includeMetrics),
                    key -> run(key.text(), key.includeMetrics()));
        }
        return run(text, includeMetrics);
    }

    private OptimizationResult run(String text, boolean includeMetrics) {
        long start = System.nanoTime();

        AstNode original = RecursiveDescentParser.parse(Lexer.tokenize(text));
        OptimizationMetrics metrics = new OptimizationMetrics();
        AstNode optimized = engine.optimize(original, metrics);

        NormalForm cnf = converter.tryToCnf(optimized);
        NormalForm dnf = converter.tryToDnf(optimized);
        AstNode display = recognizer.foldPatterns(optimized);
        List<String> variables = List.copyOf(AstNodes.variablesOf(original));

        long durationMs = (System.nanoTime() - start) / 1_000_000;
        log.fine(() -> String.format(
                "Expression optimized in %d ms: %d -> %d nodes after %d iteration(s)%s%s",
                durationMs,
                metrics.getOriginalNodes(),
                metrics.getOptimizedNodes(),
                metrics.getIterations(),
                cnf.tooComplex() ? ", CNF too complex" : "",
                dnf.tooComplex() ? ", DNF too complex" : ""
        ));

        return new OptimizationResult(
                text,
                original,
                optimized,
                cnf.form(),
                dnf.form(),
                display,
                variables,
                includeMetrics ? metrics : null,
                cnf.tooComplex(),
                dnf.tooComplex()
        );
    }

    /**
     * Cache key: the same text optimized with and without metrics yields distinct results.
     */
    protected record CacheKey(String text, boolean includeMetrics) {
    }
}
