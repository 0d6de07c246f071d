package io.github.cyfko.logicopt.core.api;

import io.github.cyfko.logicopt.core.config.PatternConfig;
import io.github.cyfko.logicopt.core.config.ReservedSymbol;

/**
 * Leaf node: a named variable or one of the boolean constants.
 * <p>
 * The reserved names {@link ReservedSymbol#FALSE} ({@code "0"}) and {@link ReservedSymbol#TRUE}
 * ({@code "1"}) denote the constants and carry no free variable.
 * </p>
 *
 * @param name the variable name
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Variable(String name) implements AstNode {

    public static final Variable TRUE = new Variable(ReservedSymbol.TRUE);
    public static final Variable FALSE = new Variable(ReservedSymbol.FALSE);

    /**
     * @throws IllegalArgumentException if {@code name} is neither an identifier nor a constant
     */
    public Variable {
        if (name == null || !PatternConfig.IDENTIFIER_OR_CONSTANT_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid variable name: " + name);
        }
    }

    /**
     * @return whether this node is one of the constants {@code 0}/{@code 1}
     */
    public boolean isConstant() {
        return ReservedSymbol.isConstant(name);
    }

    @Override
    public int nodeCount() {
        return 1;
    }

    @Override
    public String toString() {
        return name;
    }
}
