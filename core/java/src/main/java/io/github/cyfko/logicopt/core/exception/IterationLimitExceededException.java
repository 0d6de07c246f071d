package io.github.cyfko.logicopt.core.exception;

/**
 * Raised when the rewrite pipeline has not reached a fixed point after the maximum number of
 * iterations allowed by the policy.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class IterationLimitExceededException extends OptimizationAbortedException {

    private final int maxIterations;

    /**
     * @param maxIterations the iteration limit that was exceeded
     */
    public IterationLimitExceededException(int maxIterations) {
        super(String.format(
                "Maximum number of optimization iterations exceeded (%d). Possible infinite loop.",
                maxIterations));
        this.maxIterations = maxIterations;
    }

    public int getMaxIterations() {
        return maxIterations;
    }
}
