package io.github.cyfko.logicopt.core.model;

import io.github.cyfko.logicopt.core.api.AstNode;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a full optimization pipeline run.
 * <p>
 * When {@code cnfTooComplex} (resp. {@code dnfTooComplex}) is set, the distribution budget was
 * exhausted and {@code cnf} (resp. {@code dnf}) holds the un-distributed optimized tree.
 * </p>
 *
 * @param originalText  the expression as submitted
 * @param original      the parsed tree
 * @param optimized     the rewritten tree
 * @param cnf           conjunctive normal form of {@code optimized}
 * @param dnf           disjunctive normal form of {@code optimized}
 * @param display       {@code optimized} with XOR/implication patterns folded back
 * @param variables     free variables in natural order
 * @param metrics       rewrite statistics, or {@code null} when not requested
 * @param cnfTooComplex whether the CNF distribution exceeded its budget
 * @param dnfTooComplex whether the DNF distribution exceeded its budget
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record OptimizationResult(
        String originalText,
        AstNode original,
        AstNode optimized,
        AstNode cnf,
        AstNode dnf,
        AstNode display,
        List<String> variables,
        OptimizationMetrics metrics,
        boolean cnfTooComplex,
        boolean dnfTooComplex
) {

    public OptimizationResult {
        Objects.requireNonNull(originalText, "originalText is required");
        Objects.requireNonNull(original, "original is required");
        Objects.requireNonNull(optimized, "optimized is required");
        Objects.requireNonNull(cnf, "cnf is required");
        Objects.requireNonNull(dnf, "dnf is required");
        Objects.requireNonNull(display, "display is required");
        variables = List.copyOf(variables);
    }

    public String optimizedText() {
        return optimized.render();
    }

    public String cnfText() {
        return cnf.render();
    }

    public String dnfText() {
        return dnf.render();
    }

    public String displayText() {
        return display.render();
    }
}
