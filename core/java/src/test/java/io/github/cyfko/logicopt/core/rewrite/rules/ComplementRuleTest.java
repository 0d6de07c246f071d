package io.github.cyfko.logicopt.core.rewrite.rules;

import io.github.cyfko.logicopt.core.api.AstNode;
import io.github.cyfko.logicopt.core.model.OptimizationMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static io.github.cyfko.logicopt.core.LogicOptimizer.parse;
import static io.github.cyfko.logicopt.core.TruthTableAssert.assertEquivalent;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Complement Rule Tests")
class ComplementRuleTest {

    private final ComplementRule rule = new ComplementRule();

    @ParameterizedTest
    @CsvSource({
            "'a & b & !a',             '0'",
            "'a | b | !a',             '1'",
            "'!(x | y) & c & (x | y)', '0'",
            "'c & (a | b | !a)',       'c & 1'",
            "'a & b',                  'a & b'"
    })
    @DisplayName("Should collapse chains holding a term and its negation")
    void shouldCollapseComplementaryChains(String input, String expected) {
        AstNode node = parse(input);

        AstNode result = rule.apply(node, new OptimizationMetrics());

        assertEquals(expected, result.render());
        assertEquivalent(node, result);
    }

    @Test
    @DisplayName("Should find complementary pairs far apart in a long chain")
    void shouldHandleLongChains() {
        StringBuilder text = new StringBuilder("!v0");
        for (int i = 1; i < 500; i++) {
            text.append(" & v").append(i);
        }
        text.append(" & v0");

        assertEquals("0", rule.apply(parse(text.toString()), new OptimizationMetrics()).render());
    }
}
