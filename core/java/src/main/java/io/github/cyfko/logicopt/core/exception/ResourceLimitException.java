package io.github.cyfko.logicopt.core.exception;

/**
 * Exception thrown when an input exceeds a size limit of the active
 * {@link io.github.cyfko.logicopt.core.config.OptimizerPolicy}.
 * <p>
 * Covers expression length, parenthesis nesting depth and distinct variable count. These checks
 * run before any rewriting, so the input can be reported back to the caller unchanged.
 * </p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * try {
 *     AstNode ast = LogicOptimizer.parse(userInput);
 * } catch (ResourceLimitException e) {
 *     logger.warn("Rejected expression: limit " + e.getLimitName() + " is " + e.getLimit()
 *             + ", got " + e.getActual());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ResourceLimitException extends LogicOptimizerException {

    private final String limitName;
    private final long limit;
    private final long actual;

    /**
     * @param message   the message describing the violation
     * @param limitName name of the violated limit (e.g. {@code maxExpressionLength})
     * @param limit     the configured limit
     * @param actual    the measured value
     */
    public ResourceLimitException(String message, String limitName, long limit, long actual) {
        super(message);
        this.limitName = limitName;
        this.limit = limit;
        this.actual = actual;
    }

    public String getLimitName() {
        return limitName;
    }

    public long getLimit() {
        return limit;
    }

    public long getActual() {
        return actual;
    }
}
