package io.github.cyfko.logicopt.core.exception;

/**
 * Signals that CNF/DNF distribution exceeded its call or depth budget.
 * <p>
 * Unlike {@link OptimizationAbortedException} this is a recoverable condition: distribution is
 * worst-case exponential, so the converter stops instead of hanging. Callers usually fall back
 * to the un-distributed optimized form, as
 * {@link io.github.cyfko.logicopt.core.normalform.NormalFormConverter#tryToCnf} does.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class NormalFormTooComplexException extends LogicOptimizerException {

    private final String form;

    /**
     * @param form    the normal form being produced ({@code "CNF"} or {@code "DNF"})
     * @param message the message describing which budget was exceeded
     */
    public NormalFormTooComplexException(String form, String message) {
        super(message);
        this.form = form;
    }

    /**
     * @return {@code "CNF"} or {@code "DNF"}
     */
    public String getForm() {
        return form;
    }
}
