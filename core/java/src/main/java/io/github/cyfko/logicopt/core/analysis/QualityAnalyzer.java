package io.github.cyfko.logicopt.core.analysis;

import io.github.cyfko.logicopt.core.api.AstNode;
import io.github.cyfko.logicopt.core.api.Binary;
import io.github.cyfko.logicopt.core.api.BinaryOperator;
import io.github.cyfko.logicopt.core.api.Not;
import io.github.cyfko.logicopt.core.api.Variable;
import io.github.cyfko.logicopt.core.model.OptimizationResult;
import io.github.cyfko.logicopt.core.rewrite.rules.ConsensusRule;
import io.github.cyfko.logicopt.core.rewrite.rules.FactorizationRule;
import io.github.cyfko.logicopt.core.utils.AstMetrics;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Scores how well an expression was optimized.
 *
 * <h2>Score</h2>
 * <p>
 * Starting from 50, the score gains 30, 20 or 10 points for a compression ratio below 0.5, 0.7 or
 * 0.9; 5 points per level of depth removed; and 5 points per applied Factorization or Consensus
 * rule. It loses 20 points when the tree grew and 10 points when no rule was recorded. The result
 * is clamped to {@code [0, 100]}; a score of {@value #OPTIMAL_SCORE} or more is deemed optimal.
 * </p>
 * <p>
 * Rule names come from the result's metrics, so a result optimized without metrics is scored as
 * if no rule applied.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class QualityAnalyzer {

    public static final int OPTIMAL_SCORE = 85;

    private static final Set<String> ADVANCED_RULES = Set.of(FactorizationRule.NAME, ConsensusRule.NAME);

    private QualityAnalyzer() {}

    /**
     * Analyzes an optimization result.
     *
     * @param result the result to assess
     * @return the quality report
     */
    public static QualityReport analyze(OptimizationResult result) {
        Objects.requireNonNull(result, "result is required");

        AstNode original = result.original();
        AstNode optimized = result.optimized();

        int originalNodes = original.nodeCount();
        int optimizedNodes = optimized.nodeCount();
        double ratio = (double) optimizedNodes / originalNodes;

        int literals = AstMetrics.countLiterals(optimized);
        int operators = AstMetrics.countOperators(optimized);
        int depth = AstMetrics.depth(optimized);
        double complexity = operators + literals * 0.5 + depth * 0.8;

        List<String> appliedRules = result.metrics() == null
                ? List.of()
                : new ArrayList<>(result.metrics().getRuleApplicationCount().keySet());

        int score = 50;
        if (ratio < 0.5) {
            score += 30;
        } else if (ratio < 0.7) {
            score += 20;
        } else if (ratio < 0.9) {
            score += 10;
        }

        int originalDepth = AstMetrics.depth(original);
        if (depth < originalDepth) {
            score += (originalDepth - depth) * 5;
        }

        score += (int) appliedRules.stream().filter(ADVANCED_RULES::contains).count() * 5;

        if (optimizedNodes > originalNodes) {
            score -= 20;
        }
        if (appliedRules.isEmpty()) {
            score -= 10;
        }
        score = Math.max(0, Math.min(100, score));

        List<String> hints = hints(optimized, ratio, literals, depth);
        return new QualityReport(ratio, literals, operators, depth, complexity,
                appliedRules, score, score >= OPTIMAL_SCORE, hints);
    }

    /**
     * Renders {@link #analyze} as a multi-line text report.
     *
     * @param result the result to assess
     * @return the report
     */
    public static String formatReport(OptimizationResult result) {
        QualityReport report = analyze(result);
        StringBuilder sb = new StringBuilder();

        sb.append("=== Optimization Quality Report ===\n");
        sb.append("Original: ").append(result.original().render()).append('\n');
        sb.append("Optimized: ").append(result.optimizedText()).append('\n');
        sb.append(String.format(Locale.ROOT, "Compression ratio: %.1f%%%n", report.compressionRatio() * 100));
        sb.append("Literals: ").append(report.literalCount()).append('\n');
        sb.append("Operators: ").append(report.operatorCount()).append('\n');
        sb.append("Depth: ").append(report.maxDepth()).append('\n');
        sb.append(String.format(Locale.ROOT, "Complexity: %.1f%n", report.complexity()));
        sb.append("Score: ").append(report.score()).append("/100").append(report.optimal() ? " (optimal)" : "").append('\n');

        if (!report.appliedRules().isEmpty()) {
            sb.append("Applied rules:\n");
            report.appliedRules().forEach(rule -> sb.append("  - ").append(rule).append('\n'));
        }
        if (!report.hints().isEmpty()) {
            sb.append("Possible improvements:\n");
            report.hints().forEach(hint -> sb.append("  - ").append(hint).append('\n'));
        }
        if (report.compressionRatio() > 1.0) {
            sb.append("Warning: expression size increased\n");
        }
        return sb.toString();
    }

    private static List<String> hints(AstNode optimized, double ratio, int literals, int depth) {
        List<String> hints = new ArrayList<>();

        if (contains(optimized, node -> node instanceof Binary b && b.is(BinaryOperator.AND)
                && b.left() instanceof Variable && b.right() instanceof Variable)) {
            hints.add("Possible additional variable factorization");
        }
        if (contains(optimized, node -> node instanceof Not n && n.operand() instanceof Not)) {
            hints.add("Double negation detected, can be simplified");
        }
        if (depth > 6) {
            hints.add("High nesting depth, consider regrouping");
        }
        if (literals > 10) {
            hints.add("Large number of literals, further optimization may be possible");
        }
        if (ratio > 0.9) {
            hints.add("Low compression ratio, check for additional transformations");
        }
        return hints;
    }

    private static boolean contains(AstNode node, Predicate<AstNode> pattern) {
        if (pattern.test(node)) {
            return true;
        }
        if (node instanceof Not not) {
            return contains(not.operand(), pattern);
        }
        if (node instanceof Binary binary) {
            return contains(binary.left(), pattern) || contains(binary.right(), pattern);
        }
        return false;
    }
}
