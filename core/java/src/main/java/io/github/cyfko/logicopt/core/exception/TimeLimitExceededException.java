package io.github.cyfko.logicopt.core.exception;

import java.time.Duration;

/**
 * Raised when an optimize call runs longer than the processing time allowed by the policy.
 * <p>
 * The clock is polled between iterations only: a single rule application is never preempted.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class TimeLimitExceededException extends OptimizationAbortedException {

    private final Duration limit;
    private final Duration elapsed;

    /**
     * @param limit   the configured maximum processing time
     * @param elapsed the time spent when the violation was detected
     */
    public TimeLimitExceededException(Duration limit, Duration elapsed) {
        super(String.format(
                "Maximum processing time exceeded (%d ms, elapsed %d ms). Processing aborted.",
                limit.toMillis(), elapsed.toMillis()));
        this.limit = limit;
        this.elapsed = elapsed;
    }

    public Duration getLimit() {
        return limit;
    }

    public Duration getElapsed() {
        return elapsed;
    }
}
