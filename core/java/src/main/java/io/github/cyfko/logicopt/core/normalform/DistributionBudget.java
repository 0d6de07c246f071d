package io.github.cyfko.logicopt.core.normalform;

import io.github.cyfko.logicopt.core.config.OptimizerPolicy;
import io.github.cyfko.logicopt.core.exception.NormalFormTooComplexException;

/**
 * Per-conversion counters bounding the work of a CNF/DNF distribution.
 * <p>
 * Every distribution call is counted, and the depth counter tracks how many synthesized nodes
 * the distributor is currently recursing through. One budget is created per conversion and
 * never shared, so concurrent conversions do not interfere.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class DistributionBudget {

    private final String form;
    private final int maxCalls;
    private final int maxDepth;
    private int calls;
    private int depth;

    /**
     * @param form     the normal form being produced, reported in errors
     * @param maxCalls maximum number of distribution calls
     * @param maxDepth maximum nesting of recursions into synthesized nodes
     */
    public DistributionBudget(String form, int maxCalls, int maxDepth) {
        this.form = form;
        this.maxCalls = maxCalls;
        this.maxDepth = maxDepth;
    }

    /**
     * Creates a budget with the distribution limits of {@code policy}.
     *
     * @param form   the normal form being produced
     * @param policy the limits to apply
     * @return a fresh budget
     */
    public static DistributionBudget of(String form, OptimizerPolicy policy) {
        return new DistributionBudget(form, policy.maxDistributionCalls(), policy.maxDistributionDepth());
    }

    /**
     * Counts one distribution call.
     *
     * @throws NormalFormTooComplexException if the call budget is exhausted
     */
    public void countCall() {
        if (++calls > maxCalls) {
            throw new NormalFormTooComplexException(form, String.format(
                    "%s conversion too complex: more than %d distribution calls", form, maxCalls));
        }
    }

    /**
     * Enters a synthesized node.
     *
     * @throws NormalFormTooComplexException if the depth budget is exhausted
     */
    public void enter() {
        if (++depth > maxDepth) {
            throw new NormalFormTooComplexException(form, String.format(
                    "%s conversion too complex: distribution depth exceeds %d", form, maxDepth));
        }
    }

    /**
     * Leaves a synthesized node entered with {@link #enter()}.
     */
    public void exit() {
        depth--;
    }

    public int getCalls() {
        return calls;
    }

    public int getDepth() {
        return depth;
    }
}
