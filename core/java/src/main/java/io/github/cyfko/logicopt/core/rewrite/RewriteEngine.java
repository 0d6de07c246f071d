package io.github.cyfko.logicopt.core.rewrite;

import io.github.cyfko.logicopt.core.api.AstNode;
import io.github.cyfko.logicopt.core.config.OptimizerPolicy;
import io.github.cyfko.logicopt.core.exception.IterationLimitExceededException;
import io.github.cyfko.logicopt.core.exception.ResourceLimitException;
import io.github.cyfko.logicopt.core.exception.TimeLimitExceededException;
import io.github.cyfko.logicopt.core.model.OptimizationMetrics;
import io.github.cyfko.logicopt.core.rewrite.rules.AbsorptionRule;
import io.github.cyfko.logicopt.core.rewrite.rules.AssociativityRule;
import io.github.cyfko.logicopt.core.rewrite.rules.CommutativityRule;
import io.github.cyfko.logicopt.core.rewrite.rules.ComplementRule;
import io.github.cyfko.logicopt.core.rewrite.rules.ConsensusRule;
import io.github.cyfko.logicopt.core.rewrite.rules.ConstantsRule;
import io.github.cyfko.logicopt.core.rewrite.rules.DeMorganRule;
import io.github.cyfko.logicopt.core.rewrite.rules.FactorizationRule;
import io.github.cyfko.logicopt.core.rewrite.rules.RedundancyRule;
import io.github.cyfko.logicopt.core.validation.ResourceValidator;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Runs an ordered pipeline of {@link RewriteRule}s until the tree stops changing.
 * <p>
 * Each iteration applies every rule once, in order. The loop ends as soon as an iteration yields
 * a tree structurally equal to its input. The default pipeline is:
 * </p>
 * <ol>
 *   <li>{@link DeMorganRule}</li>
 *   <li>{@link ConstantsRule}</li>
 *   <li>{@link AbsorptionRule}</li>
 *   <li>{@link ComplementRule}</li>
 *   <li>{@link AssociativityRule}</li>
 *   <li>{@link ConsensusRule} (rollback-protected)</li>
 *   <li>{@link RedundancyRule}</li>
 *   <li>{@link CommutativityRule}</li>
 *   <li>{@link FactorizationRule} (rollback-protected)</li>
 * </ol>
 *
 * <h2>Rollback</h2>
 * <p>
 * The result of a rollback-protected rule is discarded when it has more nodes than the rule's
 * input; the engine then records {@code "<Rule>_Rollback"} in the metrics.
 * </p>
 *
 * <h2>Limits</h2>
 * <p>
 * The distinct variable count is checked once, before the first iteration. The elapsed time and
 * the iteration count are checked before every iteration, so the {@code (maxIterations + 1)}-th
 * attempt fails with {@link IterationLimitExceededException}. Limit violations are never retried.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * RewriteEngine engine = new RewriteEngine(OptimizerPolicy.strict());
 * OptimizationMetrics metrics = new OptimizationMetrics();
 *
 * AstNode optimized = engine.optimize(LogicOptimizer.parse("a | a & b"), metrics);  // a
 * }</pre>
 *
 * <p>Instances are immutable and may be shared between threads.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class RewriteEngine {

    private static final Logger log = Logger.getLogger(RewriteEngine.class.getName());

    private static final List<RewriteRule> DEFAULT_RULES = List.of(
            new DeMorganRule(),
            new ConstantsRule(),
            new AbsorptionRule(),
            new ComplementRule(),
            new AssociativityRule(),
            new ConsensusRule(),
            new RedundancyRule(),
            new CommutativityRule(),
            new FactorizationRule()
    );

    private final OptimizerPolicy policy;
    private final List<RewriteRule> rules;

    /**
     * Creates an engine with {@link OptimizerPolicy#defaults()} and the default pipeline.
     */
    public RewriteEngine() {
        this(OptimizerPolicy.defaults());
    }

    /**
     * Creates an engine with the default pipeline.
     *
     * @param policy the limits to enforce
     */
    public RewriteEngine(OptimizerPolicy policy) {
        this(policy, DEFAULT_RULES);
    }

    /**
     * Creates an engine with a custom pipeline.
     *
     * @param policy the limits to enforce
     * @param rules  the rules, in application order
     */
    public RewriteEngine(OptimizerPolicy policy, List<RewriteRule> rules) {
        this.policy = Objects.requireNonNull(policy, "Optimizer policy is required");
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules are required"));
    }

    /**
     * @return the default rule pipeline, in application order
     */
    public static List<RewriteRule> defaultRules() {
        return DEFAULT_RULES;
    }

    public OptimizerPolicy getPolicy() {
        return policy;
    }

    public List<RewriteRule> getRules() {
        return rules;
    }

    /**
     * Optimizes {@code ast}, discarding the metrics.
     *
     * @param ast the tree to optimize
     * @return an equivalent tree with at most as many nodes after every protected step
     * @throws ResourceLimitException          if {@code ast} has too many variables
     * @throws IterationLimitExceededException if no fixed point is reached within the iteration limit
     * @throws TimeLimitExceededException      if the processing time limit is exceeded
     */
    public AstNode optimize(AstNode ast) {
        return optimize(ast, new OptimizationMetrics());
    }

    /**
     * Optimizes {@code ast} and fills {@code metrics}.
     *
     * @param ast     the tree to optimize
     * @param metrics receives rule applications, node counts, iterations and elapsed time
     * @return an equivalent tree
     * @throws ResourceLimitException          if {@code ast} has too many variables
     * @throws IterationLimitExceededException if no fixed point is reached within the iteration limit
     * @throws TimeLimitExceededException      if the processing time limit is exceeded
     */
    public AstNode optimize(AstNode ast, OptimizationMetrics metrics) {
        Objects.requireNonNull(ast, "ast is required");
        Objects.requireNonNull(metrics, "metrics are required");

        long start = System.nanoTime();
        ResourceValidator.validateVariableCount(ast, policy);
        metrics.setOriginalNodes(ast.nodeCount());

        AstNode current = ast;
        int iterations = 0;
        while (true) {
            ResourceValidator.checkElapsed(start, policy);
            ResourceValidator.checkIterations(iterations, policy);

            AstNode next = runPipeline(current, metrics);
            iterations++;

            final int iteration = iterations;
            final int before = current.nodeCount();
            final int after = next.nodeCount();
            log.fine(() -> String.format("Iteration %d: %d -> %d nodes", iteration, before, after));
            metrics.addStep(String.format("Iteration %d: %s", iteration, next.render()));

            boolean fixedPoint = next.equals(current);
            current = next;
            if (fixedPoint) {
                break;
            }
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        metrics.setOptimizedNodes(current.nodeCount());
        metrics.setIterations(iterations);
        metrics.setElapsedTime(elapsed);

        final int total = iterations;
        log.fine(() -> String.format("Fixed point reached after %d iteration(s) in %d ms (%d -> %d nodes)",
                total, elapsed.toMillis(), metrics.getOriginalNodes(), metrics.getOptimizedNodes()));
        return current;
    }

    private AstNode runPipeline(AstNode node, OptimizationMetrics metrics) {
        AstNode current = node;
        for (RewriteRule rule : rules) {
            current = applyRule(rule, current, metrics);
        }
        return current;
    }

    /**
     * Applies one rule, restoring its input when a rollback-protected rule grew the tree.
     */
    private AstNode applyRule(RewriteRule rule, AstNode node, OptimizationMetrics metrics) {
        AstNode result = rule.apply(node, metrics);
        if (rule.rollbackProtected() && result.nodeCount() > node.nodeCount()) {
            metrics.recordRule(rule.name() + "_Rollback");
            log.finest(() -> String.format("%s rolled back (%d -> %d nodes)",
                    rule.name(), node.nodeCount(), result.nodeCount()));
            return node;
        }
        return result;
    }
}
