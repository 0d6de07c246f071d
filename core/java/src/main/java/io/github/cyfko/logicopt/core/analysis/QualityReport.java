package io.github.cyfko.logicopt.core.analysis;

import java.util.List;

/**
 * Quality assessment of one optimization run, produced by {@link QualityAnalyzer}.
 *
 * @param compressionRatio optimized node count divided by original node count
 * @param literalCount     variable and constant occurrences in the optimized tree
 * @param operatorCount    negation and binary nodes in the optimized tree
 * @param maxDepth         height of the optimized tree, a single variable having depth 1
 * @param complexity       {@code operatorCount + 0.5 * literalCount + 0.8 * maxDepth}
 * @param appliedRules     names of the rules recorded in the run's metrics, rollbacks included
 * @param score            optimality score between 0 and 100
 * @param optimal          whether {@code score} reaches {@link QualityAnalyzer#OPTIMAL_SCORE}
 * @param hints            improvement suggestions, possibly empty
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record QualityReport(
        double compressionRatio,
        int literalCount,
        int operatorCount,
        int maxDepth,
        double complexity,
        List<String> appliedRules,
        int score,
        boolean optimal,
        List<String> hints
) {

    public QualityReport {
        appliedRules = List.copyOf(appliedRules);
        hints = List.copyOf(hints);
    }
}
