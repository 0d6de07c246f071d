package io.github.cyfko.logicopt.core.analysis;

import io.github.cyfko.logicopt.core.api.AstNode;
import io.github.cyfko.logicopt.core.impl.BasicExpressionOptimizer;
import io.github.cyfko.logicopt.core.model.OptimizationMetrics;
import io.github.cyfko.logicopt.core.model.OptimizationResult;
import io.github.cyfko.logicopt.core.rewrite.rules.AbsorptionRule;
import io.github.cyfko.logicopt.core.rewrite.rules.DeMorganRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.cyfko.logicopt.core.LogicOptimizer.parse;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Quality Analyzer Tests")
class QualityAnalyzerTest {

    private final BasicExpressionOptimizer optimizer = new BasicExpressionOptimizer();

    @Test
    @DisplayName("Should rate a strong compression as optimal")
    void shouldRateStrongCompression() {
        // Given: 'a | a & b' collapses to 'a'
        OptimizationResult result = optimizer.optimizeExpression("a | a & b", true);

        // When
        QualityReport report = QualityAnalyzer.analyze(result);

        // Then: 50 + 30 for compression 0.2 + 10 for two removed levels
        assertEquals(0.2, report.compressionRatio(), 1e-9);
        assertEquals(90, report.score());
        assertTrue(report.optimal());
        assertTrue(report.appliedRules().contains(AbsorptionRule.NAME));
        assertEquals(1, report.literalCount());
        assertEquals(0, report.operatorCount());
        assertEquals(1, report.maxDepth());
        assertEquals(0.5 + 0.8, report.complexity(), 1e-9);
        assertTrue(report.hints().isEmpty());
    }

    @Test
    @DisplayName("Should penalize a result without recorded rules")
    void shouldPenalizeMissingRules() {
        OptimizationResult result = optimizer.optimizeExpression("a & b", false);

        QualityReport report = QualityAnalyzer.analyze(result);

        assertEquals(1.0, report.compressionRatio(), 1e-9);
        assertEquals(40, report.score());
        assertFalse(report.optimal());
        assertTrue(report.appliedRules().isEmpty());
        assertEquals(List.of(
                "Possible additional variable factorization",
                "Low compression ratio, check for additional transformations"), report.hints());
    }

    @Test
    @DisplayName("Should penalize growth")
    void shouldPenalizeGrowth() {
        // Given: a hand-built result whose optimized tree is larger than the original
        AstNode original = parse("!(a & b)");
        AstNode optimized = parse("!a | !b");
        OptimizationMetrics metrics = new OptimizationMetrics();
        metrics.recordRule(DeMorganRule.NAME);
        OptimizationResult result = new OptimizationResult("!(a & b)", original, optimized, optimized, optimized,
                optimized, List.of("a", "b"), metrics, false, false);

        // When
        QualityReport report = QualityAnalyzer.analyze(result);
        String text = QualityAnalyzer.formatReport(result);

        // Then
        assertEquals(1.25, report.compressionRatio(), 1e-9);
        assertEquals(30, report.score());
        assertTrue(text.startsWith("=== Optimization Quality Report ==="));
        assertTrue(text.contains("Score: 30/100"));
        assertTrue(text.contains("  - DeMorgan"));
        assertTrue(text.contains("Warning: expression size increased"));
    }

    @Test
    @DisplayName("Should hint at double negations and deep nesting")
    void shouldHintAtShape() {
        AstNode tree = parse("!!a | (b & (c | (d & (e | (f & !!g)))))");
        OptimizationResult result = new OptimizationResult("t", tree, tree, tree, tree, tree,
                List.of(), null, false, false);

        List<String> hints = QualityAnalyzer.analyze(result).hints();

        assertTrue(hints.contains("Double negation detected, can be simplified"));
        assertTrue(hints.contains("High nesting depth, consider regrouping"));
    }

    @Test
    @DisplayName("Should keep the score within bounds")
    void shouldClampScore() {
        OptimizationResult result = optimizer.optimizeExpression(
                "a & b & c & d | a & b & c & !d | a & b & !c & d | a & b & !c & !d", true);

        QualityReport report = QualityAnalyzer.analyze(result);

        assertTrue(report.score() >= 0 && report.score() <= 100);
        assertEquals(report.score() >= QualityAnalyzer.OPTIMAL_SCORE, report.optimal());
    }
}
