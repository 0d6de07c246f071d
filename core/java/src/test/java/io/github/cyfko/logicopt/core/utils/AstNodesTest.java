package io.github.cyfko.logicopt.core.utils;

import io.github.cyfko.logicopt.core.LogicOptimizer;
import io.github.cyfko.logicopt.core.api.AstNode;
import io.github.cyfko.logicopt.core.api.Binary;
import io.github.cyfko.logicopt.core.api.BinaryOperator;
import io.github.cyfko.logicopt.core.api.Not;
import io.github.cyfko.logicopt.core.api.Variable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AST Node Helpers Tests")
class AstNodesTest {

    private static final Variable A = new Variable("a");
    private static final Variable B = new Variable("b");
    private static final Variable C = new Variable("c");
    private static final Variable D = new Variable("d");

    @Nested
    @DisplayName("Chains")
    class Chains {

        @Test
        @DisplayName("flatten should collect operands left to right across nesting")
        void flattenCollectsOperands() {
            AstNode chain = Binary.and(Binary.and(A, Binary.and(B, C)), D);

            assertEquals(List.of(A, B, C, D), AstNodes.flatten(chain, BinaryOperator.AND));
        }

        @Test
        @DisplayName("flatten should stop at other operators")
        void flattenStopsAtOtherOperators() {
            AstNode chain = LogicOptimizer.parse("a & (b | c) & d");

            assertEquals(List.of(A, Binary.or(B, C), D), AstNodes.flatten(chain, BinaryOperator.AND));
            assertEquals(List.of(chain), AstNodes.flatten(chain, BinaryOperator.OR));
        }

        @Test
        @DisplayName("foldLeft should build the parser's left-associated shape")
        void foldLeftBuildsLeftAssociatedTree() {
            assertEquals(LogicOptimizer.parse("a | b | c"), AstNodes.foldLeft(BinaryOperator.OR, List.of(A, B, C)));
            assertEquals(A, AstNodes.foldLeft(BinaryOperator.OR, List.of(A)));
            assertThrows(IllegalArgumentException.class, () -> AstNodes.foldLeft(BinaryOperator.OR, List.of()));
        }

        @Test
        @DisplayName("mapChainTerms should return the same instance when nothing changes")
        void mapChainTermsKeepsIdentity() {
            AstNode chain = LogicOptimizer.parse("a | b & c | d");

            assertSame(chain, AstNodes.mapChainTerms(chain, BinaryOperator.OR, UnaryOperator.identity()));
        }

        @Test
        @DisplayName("mapChainTerms should rewrite every operand")
        void mapChainTermsRewritesOperands() {
            AstNode chain = LogicOptimizer.parse("a | b | c");

            AstNode mapped = AstNodes.mapChainTerms(chain, BinaryOperator.OR, Not::new);

            assertEquals(LogicOptimizer.parse("!a | !b | !c"), mapped);
        }
    }

    @Nested
    @DisplayName("Predicates")
    class Predicates {

        @Test
        @DisplayName("Should recognize complementary pairs in either order")
        void shouldRecognizeComplementaryPairs() {
            assertTrue(AstNodes.areComplementary(A, new Not(A)));
            assertTrue(AstNodes.areComplementary(new Not(Binary.and(A, B)), Binary.and(A, B)));
            assertFalse(AstNodes.areComplementary(A, new Not(B)));
            assertFalse(AstNodes.areComplementary(new Not(A), new Not(A)));
        }

        @Test
        @DisplayName("Should find a complementary pair among terms")
        void shouldFindComplementaryPairAmongTerms() {
            assertTrue(AstNodes.containsComplementaryPair(List.of(A, B, new Not(C), C)));
            assertFalse(AstNodes.containsComplementaryPair(List.of(A, new Not(B), C)));
        }

        @Test
        @DisplayName("Should recognize constants and operators")
        void shouldRecognizeConstants() {
            assertTrue(AstNodes.isTrue(Variable.TRUE));
            assertTrue(AstNodes.isFalse(new Variable("0")));
            assertFalse(AstNodes.isTrue(A));
            assertTrue(AstNodes.isBinary(Binary.or(A, B), BinaryOperator.OR));
            assertFalse(AstNodes.isBinary(Binary.or(A, B), BinaryOperator.AND));
        }
    }

    @Test
    @DisplayName("variablesOf should return sorted names without constants")
    void variablesOfExcludesConstants() {
        AstNode node = LogicOptimizer.parse("z & (b | 1) & !a | 0 | b");

        assertEquals(List.of("a", "b", "z"), List.copyOf(AstNodes.variablesOf(node)));
    }

    @Test
    @DisplayName("withForcedParens should only mark binary nodes")
    void withForcedParensMarksBinaryNodes() {
        AstNode forced = AstNodes.withForcedParens(Binary.and(A, B));

        assertTrue(((Binary) forced).forceParens());
        assertEquals(Binary.and(A, B), forced);
        assertSame(A, AstNodes.withForcedParens(A));
    }

    @Test
    @DisplayName("toBasicOperators should rewrite derived operators with AND, OR and NOT")
    void toBasicOperatorsLowersDerivedOperators() {
        // Given
        AstNode xor = new Binary(BinaryOperator.XOR, A, B, false);
        AstNode nand = new Binary(BinaryOperator.NAND, A, B, false);
        AstNode nor = new Binary(BinaryOperator.NOR, A, B, false);
        AstNode imp = new Binary(BinaryOperator.IMP, A, xor, false);

        // Then
        assertEquals(LogicOptimizer.parse("a & !b | !a & b"), AstNodes.toBasicOperators(xor));
        assertEquals(LogicOptimizer.parse("!(a & b)"), AstNodes.toBasicOperators(nand));
        assertEquals(LogicOptimizer.parse("!(a | b)"), AstNodes.toBasicOperators(nor));
        assertEquals(LogicOptimizer.parse("!a | (a & !b | !a & b)"), AstNodes.toBasicOperators(imp));
    }

    @Test
    @DisplayName("toBasicOperators should return trees without derived operators unchanged")
    void toBasicOperatorsKeepsBasicTrees() {
        AstNode node = LogicOptimizer.parse("!(a & b) | c & !d");

        assertSame(node, AstNodes.toBasicOperators(node));
    }

    @Test
    @DisplayName("AstMetrics should measure size, height, operators and literals")
    void metricsMeasureTree() {
        AstNode node = LogicOptimizer.parse("!(a & b) | 1");

        assertEquals(6, AstMetrics.countNodes(node));
        assertEquals(4, AstMetrics.depth(node));
        assertEquals(3, AstMetrics.countOperators(node));
        assertEquals(3, AstMetrics.countLiterals(node));
        assertEquals(1, AstMetrics.depth(A));
    }
}
