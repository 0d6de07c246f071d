package io.github.cyfko.logicopt.core.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Statistics collected during one optimize call.
 * <p>
 * Rules record their own applications through {@link #recordRule(String, int)}; the rewrite
 * engine records rollbacks under {@code "<Rule>_Rollback"}, the node counts, the iteration count
 * and the elapsed time. An instance belongs to a single call and is not thread-safe.
 * </p>
 *
 * <pre>{@code
 * OptimizationMetrics metrics = new OptimizationMetrics();
 * AstNode optimized = LogicOptimizer.optimize(ast, metrics);
 *
 * metrics.getRuleApplicationCount().get("Consensus");  // e.g. 1
 * metrics.compressionRatio();                          // optimized / original
 * System.out.println(metrics);                         // multi-line report
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class OptimizationMetrics {

    private int originalNodes;
    private int optimizedNodes;
    private int iterations;
    private Duration elapsedTime = Duration.ZERO;
    private final Map<String, Integer> ruleApplicationCount = new LinkedHashMap<>();
    private final List<String> optimizationSteps = new ArrayList<>();

    /**
     * Adds {@code count} applications of the rule {@code ruleName}.
     *
     * @param ruleName the rule name, e.g. {@code "Consensus"} or {@code "Factorization_Rollback"}
     * @param count    number of applications, ignored when not positive
     */
    public void recordRule(String ruleName, int count) {
        if (count > 0) {
            ruleApplicationCount.merge(ruleName, count, Integer::sum);
        }
    }

    /**
     * Adds one application of the rule {@code ruleName}.
     *
     * @param ruleName the rule name
     */
    public void recordRule(String ruleName) {
        recordRule(ruleName, 1);
    }

    /**
     * Appends a human-readable step description.
     *
     * @param step the step description
     */
    public void addStep(String step) {
        optimizationSteps.add(step);
    }

    /**
     * @return total number of recorded rule applications, rollbacks included
     */
    public int getAppliedRules() {
        return ruleApplicationCount.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * @return optimized node count divided by original node count, or 1.0 when nothing was measured
     */
    public double compressionRatio() {
        return originalNodes > 0 ? (double) optimizedNodes / originalNodes : 1.0;
    }

    /**
     * @return whether the optimized tree has fewer nodes than the original
     */
    public boolean isImproved() {
        return optimizedNodes < originalNodes;
    }

    public int getOriginalNodes() {
        return originalNodes;
    }

    public void setOriginalNodes(int originalNodes) {
        this.originalNodes = originalNodes;
    }

    public int getOptimizedNodes() {
        return optimizedNodes;
    }

    public void setOptimizedNodes(int optimizedNodes) {
        this.optimizedNodes = optimizedNodes;
    }

    public int getIterations() {
        return iterations;
    }

    public void setIterations(int iterations) {
        this.iterations = iterations;
    }

    public Duration getElapsedTime() {
        return elapsedTime;
    }

    public void setElapsedTime(Duration elapsedTime) {
        this.elapsedTime = elapsedTime;
    }

    /**
     * @return read-only view of rule name to application count, in first-recorded order
     */
    public Map<String, Integer> getRuleApplicationCount() {
        return Collections.unmodifiableMap(ruleApplicationCount);
    }

    /**
     * @return read-only view of the recorded steps
     */
    public List<String> getOptimizationSteps() {
        return Collections.unmodifiableList(optimizationSteps);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("=== Optimization Metrics ===\n");
        sb.append("Original nodes: ").append(originalNodes).append('\n');
        sb.append("Optimized nodes: ").append(optimizedNodes).append('\n');
        sb.append(String.format(Locale.ROOT, "Compression ratio: %.1f%%%n", compressionRatio() * 100));
        sb.append("Iterations: ").append(iterations).append('\n');
        sb.append("Applied rules: ").append(getAppliedRules()).append('\n');
        sb.append(String.format(Locale.ROOT, "Elapsed time: %.2fms%n", elapsedTime.toNanos() / 1_000_000.0));

        if (!ruleApplicationCount.isEmpty()) {
            sb.append("Rule applications:\n");
            ruleApplicationCount.entrySet().stream()
                    .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                    .forEach(e -> sb.append("  ").append(e.getKey()).append(": ").append(e.getValue()).append('\n'));
        }
        return sb.toString();
    }
}
