package io.github.cyfko.logicopt.core.normalform;

import io.github.cyfko.logicopt.core.api.AstNode;
import io.github.cyfko.logicopt.core.api.Binary;
import io.github.cyfko.logicopt.core.api.BinaryOperator;
import io.github.cyfko.logicopt.core.api.Not;
import io.github.cyfko.logicopt.core.api.Variable;
import io.github.cyfko.logicopt.core.config.OptimizerPolicy;
import io.github.cyfko.logicopt.core.exception.NormalFormTooComplexException;
import io.github.cyfko.logicopt.core.rewrite.RewriteEngine;
import io.github.cyfko.logicopt.core.utils.AstNodes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static io.github.cyfko.logicopt.core.LogicOptimizer.parse;
import static io.github.cyfko.logicopt.core.TruthTableAssert.assertEquivalent;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Normal Form Converter Tests")
class NormalFormConverterTest {

    private static final Variable A = new Variable("a");
    private static final Variable B = new Variable("b");
    private static final Variable C = new Variable("c");

    private final NormalFormConverter converter = new NormalFormConverter();

    private static boolean isLiteral(AstNode node) {
        return node instanceof Variable || (node instanceof Not not && not.operand() instanceof Variable);
    }

    /**
     * True when {@code node} is an {@code outer} chain of {@code inner} chains of literals.
     */
    private static boolean hasShape(AstNode node, BinaryOperator outer, BinaryOperator inner) {
        return AstNodes.flatten(node, outer).stream()
                .allMatch(term -> AstNodes.flatten(term, inner).stream().allMatch(NormalFormConverterTest::isLiteral));
    }

    private static Binary node(BinaryOperator op, AstNode left, AstNode right) {
        return new Binary(op, left, right, false);
    }

    static Stream<AstNode> derivedTrees() {
        return Stream.of(
                node(BinaryOperator.XOR, A, B),
                Binary.or(node(BinaryOperator.XOR, A, B), Binary.and(C, A)),
                new Not(node(BinaryOperator.IMP, A, B)),
                node(BinaryOperator.NAND, A, Binary.or(B, C)),
                node(BinaryOperator.NOR, A, node(BinaryOperator.XOR, B, C)),
                node(BinaryOperator.IMP, Binary.and(A, B), new Not(C)),
                new Not(node(BinaryOperator.XOR, new Not(A), B))
        );
    }

    @Nested
    @DisplayName("CNF")
    class Cnf {

        @Test
        @DisplayName("Should distribute OR over AND")
        void shouldDistribute() {
            assertEquals("(c | a) & (c | b)", converter.toCnf(parse("a & b | c")).render());
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "a & b | !a & c",
                "a & b | c",
                "!(a | b & c) | d",
                "(a | b) & (c | d) | e",
                "a & (b | c & !d)",
                "!(a & b) & (c | !d)"
        })
        @DisplayName("Should produce an equivalent conjunction of clauses")
        void shouldProduceCnf(String input) {
            AstNode node = parse(input);

            AstNode cnf = converter.toCnf(node);

            assertTrue(hasShape(cnf, BinaryOperator.AND, BinaryOperator.OR), () -> "not in CNF: " + cnf.render());
            assertEquivalent(node, cnf);
        }

        @Test
        @DisplayName("Should collapse contradictions to 0")
        void shouldCollapseContradiction() {
            assertEquals(Variable.FALSE, converter.toCnf(parse("a & !a")));
        }
    }

    @Nested
    @DisplayName("DNF")
    class Dnf {

        @ParameterizedTest
        @CsvSource({
                "'a & (b | c)',          'a & b | a & c'",
                "'!(a | b) | c',         '!a & !b | c'",
                "'(a | b) & (c | d)',    'a & c | a & d | b & c | b & d'",
                "'a & (b | b)',          'a & b'",
                "'!!a & b',              'a & b'"
        })
        @DisplayName("Should distribute AND over OR without further rewriting")
        void shouldDistribute(String input, String expected) {
            assertEquals(expected, converter.toDnf(parse(input)).render());
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "a & b | !a & c",
                "a & b | c",
                "!(a | b & c) | d",
                "(a | b) & (c | d) | e",
                "a & (b | c & !d)",
                "!(a & b) & (c | !d)"
        })
        @DisplayName("Should produce an equivalent disjunction of terms")
        void shouldProduceDnf(String input) {
            AstNode node = parse(input);

            AstNode dnf = converter.toDnf(node);

            assertTrue(hasShape(dnf, BinaryOperator.OR, BinaryOperator.AND), () -> "not in DNF: " + dnf.render());
            assertEquivalent(node, dnf);
        }
    }

    @Nested
    @DisplayName("Derived operators")
    class DerivedOperators {

        @ParameterizedTest
        @MethodSource("io.github.cyfko.logicopt.core.normalform.NormalFormConverterTest#derivedTrees")
        @DisplayName("CNF should only contain AND, OR and literals")
        void cnfShouldLowerDerivedOperators(AstNode node) {
            NormalForm cnf = converter.tryToCnf(node);

            assertFalse(cnf.tooComplex());
            assertTrue(hasShape(cnf.form(), BinaryOperator.AND, BinaryOperator.OR), () -> "not in CNF: " + cnf.form().render());
            assertEquivalent(node, cnf.form());
        }

        @ParameterizedTest
        @MethodSource("io.github.cyfko.logicopt.core.normalform.NormalFormConverterTest#derivedTrees")
        @DisplayName("DNF should only contain OR, AND and literals")
        void dnfShouldLowerDerivedOperators(AstNode node) {
            AstNode dnf = converter.toDnf(node);

            assertTrue(hasShape(dnf, BinaryOperator.OR, BinaryOperator.AND), () -> "not in DNF: " + dnf.render());
            assertEquivalent(node, dnf);
        }

        @Test
        @DisplayName("A negated implication should become a single term")
        void negatedImplication() {
            assertEquals("a & !b", converter.toDnf(new Not(node(BinaryOperator.IMP, A, B))).render());
        }
    }

    @Nested
    @DisplayName("Distribution budget")
    class Budget {

        @Test
        @DisplayName("Should fail when distribution is nested too deeply")
        void shouldEnforceDepth() {
            NormalFormConverter strict = new NormalFormConverter(OptimizerPolicy.builder().maxDistributionDepth(2).build());

            NormalFormTooComplexException exception = assertThrows(NormalFormTooComplexException.class,
                    () -> strict.toDnf(parse("(a | b) & (c | d) & (e | f)")));

            assertEquals(NormalFormConverter.DNF, exception.getForm());
            assertEquals("DNF conversion too complex: distribution depth exceeds 2", exception.getMessage());
        }

        @Test
        @DisplayName("Should fail when distribution makes too many calls")
        void shouldEnforceCalls() {
            NormalFormConverter strict = new NormalFormConverter(OptimizerPolicy.builder().maxDistributionCalls(3).build());

            NormalFormTooComplexException exception = assertThrows(NormalFormTooComplexException.class,
                    () -> strict.toDnf(parse("a & (b | c)")));

            assertEquals("DNF conversion too complex: more than 3 distribution calls", exception.getMessage());
        }

        @Test
        @DisplayName("tryToDnf should fall back to its input")
        void tryToDnfFallsBack() {
            NormalFormConverter strict = new NormalFormConverter(OptimizerPolicy.builder().maxDistributionDepth(2).build());
            AstNode node = parse("(a | b) & (c | d) & (e | f)");

            NormalForm result = strict.tryToDnf(node);

            assertTrue(result.tooComplex());
            assertSame(node, result.form());
        }

        @Test
        @DisplayName("tryToCnf should fall back to the optimized tree")
        void tryToCnfFallsBack() {
            OptimizerPolicy policy = OptimizerPolicy.builder().maxDistributionDepth(1).build();
            NormalFormConverter strict = new NormalFormConverter(policy);
            AstNode node = parse("a & b | c & d | e & f");

            NormalForm result = strict.tryToCnf(node);

            assertTrue(result.tooComplex());
            assertEquals(new RewriteEngine(policy).optimize(node), result.form());
        }

        @Test
        @DisplayName("Should flag an exponential CNF under the default budget")
        void shouldFlagExponentialCnf() {
            String text = IntStream.range(0, 20).mapToObj(i -> "x" + i + " & y" + i).collect(Collectors.joining(" | "));
            AstNode node = parse(text);

            NormalForm cnf = converter.tryToCnf(node);
            NormalForm dnf = converter.tryToDnf(node);

            assertTrue(cnf.tooComplex());
            assertFalse(dnf.tooComplex());
            assertEquivalentSample(node, dnf.form());
        }

        private void assertEquivalentSample(AstNode node, AstNode dnf) {
            // 40 variables are too many for a full truth table
            assertEquals(AstNodes.variablesOf(node), AstNodes.variablesOf(dnf));
            assertEquals(20, AstNodes.flatten(dnf, BinaryOperator.OR).size());
        }
    }

    @Test
    @DisplayName("Should reject null trees")
    void shouldRejectNull() {
        assertThrows(NullPointerException.class, () -> converter.toCnf(null));
        assertThrows(NullPointerException.class, () -> converter.toDnf(null));
    }
}
