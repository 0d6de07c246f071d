package io.github.cyfko.logicopt.core.exception;

/**
 * Base type of every error raised by the LogicOpt core.
 * <p>
 * All core errors are unchecked. Parsing, lexing and validation errors are raised before any
 * rewriting begins; rewrite-time and normal-form errors are raised while an expression is being
 * processed. Callers that do not care about the exact kind can catch this type.
 * </p>
 *
 * <p><strong>Hierarchy:</strong></p>
 * <ul>
 *   <li>{@link ExpressionSyntaxException} - grammar violations (and {@link LexicalException} for bad tokens)</li>
 *   <li>{@link ResourceLimitException} - input size limits exceeded</li>
 *   <li>{@link OptimizationAbortedException} - fatal rewrite non-termination guards</li>
 *   <li>{@link NormalFormTooComplexException} - recoverable normal-form budget overrun</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class LogicOptimizerException extends RuntimeException {

    /**
     * @param message the message describing the failure
     */
    public LogicOptimizerException(String message) {
        super(message);
    }

    /**
     * @param message the message describing the failure
     * @param cause   the underlying cause
     */
    public LogicOptimizerException(String message, Throwable cause) {
        super(message, cause);
    }
}
