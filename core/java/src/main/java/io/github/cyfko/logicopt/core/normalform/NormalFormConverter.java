package io.github.cyfko.logicopt.core.normalform;

import io.github.cyfko.logicopt.core.api.AstNode;
import io.github.cyfko.logicopt.core.api.Binary;
import io.github.cyfko.logicopt.core.api.BinaryOperator;
import io.github.cyfko.logicopt.core.api.Not;
import io.github.cyfko.logicopt.core.api.Variable;
import io.github.cyfko.logicopt.core.config.OptimizerPolicy;
import io.github.cyfko.logicopt.core.exception.NormalFormTooComplexException;
import io.github.cyfko.logicopt.core.rewrite.RewriteEngine;
import io.github.cyfko.logicopt.core.utils.AstNodes;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Converts trees to Conjunctive and Disjunctive Normal Form.
 *
 * <p>
 * Both conversions start by rewriting XOR, NAND, NOR and implication nodes with AND, OR and NOT
 * ({@link AstNodes#toBasicOperators}), so the result only contains the two normal-form operators.
 * </p>
 *
 * <h2>CNF</h2>
 * <p>
 * The tree is then optimized by the {@link RewriteEngine}, then OR is distributed over AND
 * bottom-up ({@code A | (B & C) → (A | B) & (A | C)}). Finally tautological clauses
 * ({@code a | !a | b}) are dropped and contradictory conjunctions collapse to {@code 0}.
 * </p>
 *
 * <h2>DNF</h2>
 * <p>
 * Negations are pushed down to the variables (De Morgan and double negation only), AND is
 * distributed over OR bottom-up, and exact duplicate terms are removed. The rewrite engine is not
 * run afterwards since it would fold the result out of normal form.
 * </p>
 *
 * <h2>Bounded distribution</h2>
 * <p>
 * Distribution is exponential in the worst case. Each conversion owns a
 * {@link DistributionBudget} sized by the policy; exhausting it raises
 * {@link NormalFormTooComplexException}. {@link #tryToCnf} and {@link #tryToDnf} catch it and
 * return the un-distributed tree instead.
 * </p>
 *
 * <pre>{@code
 * NormalFormConverter converter = new NormalFormConverter();
 * converter.toCnf(LogicOptimizer.parse("a & b | c"));   // (c | a) & (c | b)
 * converter.toDnf(LogicOptimizer.parse("a & (b | c)")); // a & b | a & c
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class NormalFormConverter {

    private static final Logger log = Logger.getLogger(NormalFormConverter.class.getName());

    public static final String CNF = "CNF";
    public static final String DNF = "DNF";

    private final OptimizerPolicy policy;
    private final RewriteEngine engine;

    public NormalFormConverter() {
        this(OptimizerPolicy.defaults());
    }

    public NormalFormConverter(OptimizerPolicy policy) {
        this(policy, new RewriteEngine(policy));
    }

    /**
     * @param policy the distribution limits
     * @param engine the engine optimizing trees before CNF distribution
     */
    public NormalFormConverter(OptimizerPolicy policy, RewriteEngine engine) {
        this.policy = Objects.requireNonNull(policy, "Optimizer policy is required");
        this.engine = Objects.requireNonNull(engine, "Rewrite engine is required");
    }

    /**
     * Converts {@code ast} to CNF.
     *
     * @param ast the tree to convert
     * @return a conjunction of clauses equivalent to {@code ast}
     * @throws NormalFormTooComplexException if the distribution budget is exhausted
     */
    public AstNode toCnf(AstNode ast) {
        Objects.requireNonNull(ast, "ast is required");
        return distributeCnf(engine.optimize(AstNodes.toBasicOperators(ast)));
    }

    /**
     * Converts {@code ast} to DNF.
     *
     * @param ast the tree to convert
     * @return a disjunction of conjunctions equivalent to {@code ast}
     * @throws NormalFormTooComplexException if the distribution budget is exhausted
     */
    public AstNode toDnf(AstNode ast) {
        Objects.requireNonNull(ast, "ast is required");
        DistributionBudget budget = DistributionBudget.of(DNF, policy);
        AstNode basic = AstNodes.toBasicOperators(ast);
        AstNode distributed = distribute(pushNegations(basic), BinaryOperator.AND, BinaryOperator.OR, budget);
        return removeDuplicateTerms(distributed);
    }

    /**
     * Converts {@code ast} to CNF, falling back to the optimized tree when too complex.
     *
     * @param ast the tree to convert
     * @return the CNF, or the optimized un-distributed tree flagged as too complex
     */
    public NormalForm tryToCnf(AstNode ast) {
        Objects.requireNonNull(ast, "ast is required");
        AstNode optimized = engine.optimize(AstNodes.toBasicOperators(ast));
        try {
            return new NormalForm(distributeCnf(optimized), false);
        } catch (NormalFormTooComplexException e) {
            log.fine(() -> "Keeping un-distributed form: " + e.getMessage());
            return new NormalForm(optimized, true);
        }
    }

    /**
     * Converts {@code ast} to DNF, falling back to {@code ast} itself when too complex.
     *
     * @param ast the tree to convert
     * @return the DNF, or {@code ast} flagged as too complex
     */
    public NormalForm tryToDnf(AstNode ast) {
        try {
            return new NormalForm(toDnf(ast), false);
        } catch (NormalFormTooComplexException e) {
            log.fine(() -> "Keeping un-distributed form: " + e.getMessage());
            return new NormalForm(ast, true);
        }
    }

    private AstNode distributeCnf(AstNode optimized) {
        DistributionBudget budget = DistributionBudget.of(CNF, policy);
        AstNode distributed = distribute(optimized, BinaryOperator.OR, BinaryOperator.AND, budget);
        return simplifyClauses(distributed);
    }

    // --- distribution ---

    /**
     * Distributes {@code inner} over {@code outer} everywhere below {@code node}.
     */
    private static AstNode distribute(AstNode node, BinaryOperator inner, BinaryOperator outer,
                                      DistributionBudget budget) {
        budget.countCall();
        if (node instanceof Binary b && b.op() == outer) {
            return new Binary(outer,
                    distribute(b.left(), inner, outer, budget),
                    distribute(b.right(), inner, outer, budget), false);
        }
        if (node instanceof Binary b && b.op() == inner) {
            return merge(
                    distribute(b.left(), inner, outer, budget),
                    distribute(b.right(), inner, outer, budget), inner, outer, budget);
        }
        return node;
    }

    /**
     * Combines two distributed operands with {@code inner}, pushing it below every {@code outer} node.
     */
    private static AstNode merge(AstNode left, AstNode right, BinaryOperator inner, BinaryOperator outer,
                                 DistributionBudget budget) {
        budget.countCall();
        if (left instanceof Binary lb && lb.op() == outer) {
            budget.enter();
            try {
                return new Binary(outer,
                        merge(lb.left(), right, inner, outer, budget),
                        merge(lb.right(), right, inner, outer, budget), false);
            } finally {
                budget.exit();
            }
        }
        if (right instanceof Binary rb && rb.op() == outer) {
            budget.enter();
            try {
                return new Binary(outer,
                        merge(left, rb.left(), inner, outer, budget),
                        merge(left, rb.right(), inner, outer, budget), false);
            } finally {
                budget.exit();
            }
        }
        return new Binary(inner, left, right, false);
    }

    // --- CNF cleanup ---

    private static AstNode simplifyClauses(AstNode node) {
        if (node instanceof Binary b && b.is(BinaryOperator.AND)) {
            AstNode left = simplifyClauses(b.left());
            AstNode right = simplifyClauses(b.right());

            if (AstNodes.isTrue(left) || isTautology(left)) return right;
            if (AstNodes.isTrue(right) || isTautology(right)) return left;
            if (AstNodes.isFalse(left) || AstNodes.isFalse(right)) return Variable.FALSE;

            AstNode result = new Binary(BinaryOperator.AND, left, right, false);
            return isContradiction(result) ? Variable.FALSE : result;
        }

        if (node instanceof Binary b && b.is(BinaryOperator.OR)) {
            AstNode left = simplifyClauses(b.left());
            AstNode right = simplifyClauses(b.right());

            if (AstNodes.isTrue(left) || AstNodes.isTrue(right)) return Variable.TRUE;
            if (AstNodes.isFalse(left) || isContradiction(left)) return right;
            if (AstNodes.isFalse(right) || isContradiction(right)) return left;

            AstNode result = new Binary(BinaryOperator.OR, left, right, false);
            return isTautology(result) ? Variable.TRUE : result;
        }

        return node;
    }

    private static boolean isTautology(AstNode node) {
        return AstNodes.isBinary(node, BinaryOperator.OR)
                && AstNodes.containsComplementaryPair(AstNodes.flatten(node, BinaryOperator.OR));
    }

    private static boolean isContradiction(AstNode node) {
        return AstNodes.isBinary(node, BinaryOperator.AND)
                && AstNodes.containsComplementaryPair(AstNodes.flatten(node, BinaryOperator.AND));
    }

    // --- DNF helpers ---

    /**
     * Pushes negations down to the variables using De Morgan's laws and double negation only.
     */
    private static AstNode pushNegations(AstNode node) {
        if (node instanceof Not not) {
            AstNode operand = not.operand();
            if (operand instanceof Not inner) {
                return pushNegations(inner.operand());
            }
            if (operand instanceof Binary b && (b.is(BinaryOperator.AND) || b.is(BinaryOperator.OR))) {
                BinaryOperator dual = b.is(BinaryOperator.AND) ? BinaryOperator.OR : BinaryOperator.AND;
                return new Binary(dual, pushNegations(new Not(b.left())), pushNegations(new Not(b.right())), false);
            }
        }
        return AstNodes.mapChildren(node, NormalFormConverter::pushNegations);
    }

    private static AstNode removeDuplicateTerms(AstNode node) {
        if (!AstNodes.isBinary(node, BinaryOperator.OR)) {
            return node;
        }
        return AstNodes.foldLeft(BinaryOperator.OR,
                new ArrayList<>(new LinkedHashSet<>(AstNodes.flatten(node, BinaryOperator.OR))));
    }
}
