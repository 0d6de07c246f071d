package io.github.cyfko.logicopt.core.config;

import java.util.regex.Pattern;

/**
 * Pre-compiled patterns describing legal variable names.
 * <p>
 * Variables start with a letter or underscore, followed by letters, digits or underscores.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class PatternConfig {
    private PatternConfig() {}

    private static final String IDENTIFIER_FORM = "[a-zA-Z_][a-zA-Z0-9_]*";

    /**
     * Pattern for variable identifiers without the reserved constants.
     * Example valid: "a", "user_flag", "_tmp1"; invalid: "2a", "a-b".
     */
    public static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^" + IDENTIFIER_FORM + "$");

    /**
     * Pattern for identifiers including the reserved constants {@code 0} and {@code 1}.
     */
    public static final Pattern IDENTIFIER_OR_CONSTANT_PATTERN = Pattern.compile(
            "^(" + IDENTIFIER_FORM + "|" + ReservedSymbol.FALSE + "|" + ReservedSymbol.TRUE + ")$");
}
