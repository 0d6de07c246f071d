package io.github.cyfko.logicopt.core.normalform;

import io.github.cyfko.logicopt.core.api.AstNode;

/**
 * Result of a best-effort normal-form conversion.
 *
 * @param form       the normal form, or the un-distributed input when {@code tooComplex} is set
 * @param tooComplex whether the distribution budget was exhausted
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record NormalForm(AstNode form, boolean tooComplex) {
}
