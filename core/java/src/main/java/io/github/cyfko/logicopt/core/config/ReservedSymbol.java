package io.github.cyfko.logicopt.core.config;

/**
 * Reserved variable names standing for the boolean constants.
 * <p>
 * The lexer accepts the single digits {@code 0} and {@code 1} as literals and the parser turns
 * them into {@link io.github.cyfko.logicopt.core.api.Variable} nodes carrying these names.
 * Constants never count as free variables.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ReservedSymbol {
    private ReservedSymbol() {}

    /**
     * Name of the boolean constant TRUE.
     */
    public static final String TRUE = "1";

    /**
     * Name of the boolean constant FALSE.
     */
    public static final String FALSE = "0";

    /**
     * @param name a variable name
     * @return whether {@code name} denotes one of the two constants
     */
    public static boolean isConstant(String name) {
        return TRUE.equals(name) || FALSE.equals(name);
    }
}
