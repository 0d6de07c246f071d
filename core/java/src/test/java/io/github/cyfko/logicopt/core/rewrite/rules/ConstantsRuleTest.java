package io.github.cyfko.logicopt.core.rewrite.rules;

import io.github.cyfko.logicopt.core.api.AstNode;
import io.github.cyfko.logicopt.core.api.Binary;
import io.github.cyfko.logicopt.core.api.BinaryOperator;
import io.github.cyfko.logicopt.core.api.Not;
import io.github.cyfko.logicopt.core.api.Variable;
import io.github.cyfko.logicopt.core.model.OptimizationMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static io.github.cyfko.logicopt.core.LogicOptimizer.parse;
import static io.github.cyfko.logicopt.core.TruthTableAssert.assertEquivalent;
import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.params.provider.Arguments.arguments;

@DisplayName("Constants Rule Tests")
class ConstantsRuleTest {

    private final ConstantsRule rule = new ConstantsRule();

    @ParameterizedTest
    @CsvSource({
            "'a & 1',          'a'",
            "'1 & a',          'a'",
            "'a & 0',          '0'",
            "'a | 1',          '1'",
            "'0 | a',          'a'",
            "'!1',             '0'",
            "'!0 & b',         'b'",
            "'a | 0 & b',      'a'",
            "'!!a',            'a'",
            "'!!!a',           '!a'",
            "'a & !a',         '0'",
            "'!b | b',         '1'",
            "'c & (a | !a)',   'c'"
    })
    @DisplayName("Should fold constants, double negations and complementary operands")
    void shouldFold(String input, String expected) {
        AstNode node = parse(input);

        AstNode result = rule.apply(node, new OptimizationMetrics());

        assertEquals(expected, result.render());
        assertEquivalent(node, result);
    }

    private static final Variable A = new Variable("a");
    private static final Variable B = new Variable("b");
    private static final Variable T = Variable.TRUE;
    private static final Variable F = Variable.FALSE;

    private static Binary node(BinaryOperator op, AstNode left, AstNode right) {
        return new Binary(op, left, right, false);
    }

    static Stream<Arguments> derivedOperatorIdentities() {
        return Stream.of(
                arguments(node(BinaryOperator.XOR, A, A), F),
                arguments(node(BinaryOperator.XOR, A, F), A),
                arguments(node(BinaryOperator.XOR, T, A), new Not(A)),
                arguments(node(BinaryOperator.XOR, T, new Not(A)), A),
                arguments(node(BinaryOperator.XOR, A, new Not(A)), T),
                arguments(node(BinaryOperator.NAND, A, A), new Not(A)),
                arguments(node(BinaryOperator.NAND, A, F), T),
                arguments(node(BinaryOperator.NAND, T, A), new Not(A)),
                arguments(node(BinaryOperator.NOR, A, A), new Not(A)),
                arguments(node(BinaryOperator.NOR, A, T), F),
                arguments(node(BinaryOperator.NOR, F, A), new Not(A)),
                arguments(node(BinaryOperator.IMP, A, A), T),
                arguments(node(BinaryOperator.IMP, F, A), T),
                arguments(node(BinaryOperator.IMP, A, T), T),
                arguments(node(BinaryOperator.IMP, T, A), A),
                arguments(Binary.and(B, node(BinaryOperator.XOR, A, F)), Binary.and(B, A))
        );
    }

    @ParameterizedTest
    @MethodSource("derivedOperatorIdentities")
    @DisplayName("Should fold XOR, NAND, NOR and implication identities")
    void shouldFoldDerivedOperators(AstNode node, AstNode expected) {
        AstNode result = rule.apply(node, new OptimizationMetrics());

        assertEquals(expected, result);
        assertEquivalent(node, result);
    }

    @Test
    @DisplayName("Should keep derived operators without identity")
    void shouldKeepPlainDerivedOperators() {
        AstNode xor = node(BinaryOperator.XOR, A, B);

        assertSame(xor, rule.apply(xor, new OptimizationMetrics()));
    }
}
