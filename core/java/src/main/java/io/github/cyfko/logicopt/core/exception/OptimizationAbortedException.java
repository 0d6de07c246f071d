package io.github.cyfko.logicopt.core.exception;

/**
 * Fatal error raised by the rewrite engine when its fixed-point loop does not terminate within
 * the configured bounds.
 * <p>
 * The in-progress optimize call is aborted and no partial result is returned. The engine never
 * retries; a caller may retry with a smaller input or a more relaxed policy.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see IterationLimitExceededException
 * @see TimeLimitExceededException
 */
public abstract class OptimizationAbortedException extends LogicOptimizerException {

    protected OptimizationAbortedException(String message) {
        super(message);
    }
}
