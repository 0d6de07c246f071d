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

@DisplayName("Commutativity Rule Tests")
class CommutativityRuleTest {

    private final CommutativityRule rule = new CommutativityRule();

    @ParameterizedTest
    @CsvSource({
            "'b & a',               'a & b'",
            "'b | a',               'a | b'",
            "'!b & !a',             '!a & !b'",
            "'!a & c',              'c & !a'",
            "'c | a & b | !a',      'c | !a | a & b'",
            "'(d | c) & (b | a)',   '(a | b) & (c | d)'"
    })
    @DisplayName("Should order chain operands by complexity then canonical key")
    void shouldSortOperands(String input, String expected) {
        AstNode node = parse(input);

        AstNode result = rule.apply(node, new OptimizationMetrics());

        assertEquals(expected, result.render());
        assertEquivalent(node, result);
    }

    @Test
    @DisplayName("Should give commuted chains the same result")
    void shouldCanonicalize() {
        OptimizationMetrics metrics = new OptimizationMetrics();

        assertEquals(rule.apply(parse("x & (z | y) & w"), metrics), rule.apply(parse("(y | z) & w & x"), metrics));
    }

    @Test
    @DisplayName("Should score variables, negations and binary nodes")
    void shouldScoreComplexity() {
        assertEquals(1, CommutativityRule.complexityScore(parse("a")));
        assertEquals(2, CommutativityRule.complexityScore(parse("!(a & b)")));
        assertEquals(6, CommutativityRule.complexityScore(parse("a & !b")));
    }

    @Test
    @DisplayName("Should build order-independent canonical keys")
    void shouldBuildCanonicalKeys() {
        assertEquals("&(c,|(a,b))", CommutativityRule.canonicalKey(parse("c & (b | a)")));
        assertEquals(CommutativityRule.canonicalKey(parse("a | b | c")), CommutativityRule.canonicalKey(parse("c | (b | a)")));
    }
}
