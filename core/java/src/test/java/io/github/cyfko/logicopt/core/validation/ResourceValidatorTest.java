package io.github.cyfko.logicopt.core.validation;

import io.github.cyfko.logicopt.core.LogicOptimizer;
import io.github.cyfko.logicopt.core.config.OptimizerPolicy;
import io.github.cyfko.logicopt.core.exception.ExpressionSyntaxException;
import io.github.cyfko.logicopt.core.exception.IterationLimitExceededException;
import io.github.cyfko.logicopt.core.exception.ResourceLimitException;
import io.github.cyfko.logicopt.core.exception.TimeLimitExceededException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Resource Validator Tests")
class ResourceValidatorTest {

    @Nested
    @DisplayName("Expression text")
    class ExpressionText {

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   ", "\t\n"})
        @DisplayName("Should reject null, empty and blank text")
        void shouldRejectBlankText(String text) {
            ExpressionSyntaxException exception = assertThrows(ExpressionSyntaxException.class,
                    () -> ResourceValidator.validateExpression(text, OptimizerPolicy.defaults()));

            assertEquals("Expression cannot be null or empty", exception.getMessage());
            assertEquals(-1, exception.getPosition());
        }

        @Test
        @DisplayName("Should reject text longer than the policy allows")
        void shouldRejectLongText() {
            // Given: strict policy with 1000 characters
            String text = "a".repeat(1100);

            // When
            ResourceLimitException exception = assertThrows(ResourceLimitException.class,
                    () -> ResourceValidator.validateExpression(text, OptimizerPolicy.strict()));

            // Then
            assertEquals("Expression too long. Maximum 1000 characters, got 1100. Policy applied: STRICT_POLICY",
                    exception.getMessage());
            assertEquals("maxExpressionLength", exception.getLimitName());
            assertEquals(1000, exception.getLimit());
            assertEquals(1100, exception.getActual());
        }

        @Test
        @DisplayName("Should accept text at exactly the maximum length")
        void shouldAcceptTextAtLimit() {
            OptimizerPolicy policy = OptimizerPolicy.builder().maxExpressionLength(5).build();

            assertDoesNotThrow(() -> ResourceValidator.validateExpression("a & b", policy));
        }

        @Test
        @DisplayName("Should reject nesting deeper than the policy allows")
        void shouldRejectDeepNesting() {
            OptimizerPolicy policy = OptimizerPolicy.builder().maxParenthesesDepth(3).build();

            ResourceLimitException exception = assertThrows(ResourceLimitException.class,
                    () -> ResourceValidator.validateExpression("((((a))))", policy));

            assertEquals("Too deep nesting of parentheses. Maximum 3 levels, found 4", exception.getMessage());
            assertEquals("maxParenthesesDepth", exception.getLimitName());
        }

        @Test
        @DisplayName("Should accept nesting at exactly the maximum depth")
        void shouldAcceptNestingAtLimit() {
            OptimizerPolicy policy = OptimizerPolicy.builder().maxParenthesesDepth(3).build();

            assertDoesNotThrow(() -> ResourceValidator.validateExpression("(a & (b | (c)))", policy));
        }

        @Test
        @DisplayName("Should report an unmatched closing parenthesis")
        void shouldReportUnmatchedClosingParenthesis() {
            ExpressionSyntaxException exception = assertThrows(ExpressionSyntaxException.class,
                    () -> ResourceValidator.validateExpression("a) & (b", OptimizerPolicy.defaults()));

            assertEquals(1, exception.getPosition());
        }

        @Test
        @DisplayName("Should report the first unclosed opening parenthesis")
        void shouldReportUnclosedOpeningParenthesis() {
            ExpressionSyntaxException exception = assertThrows(ExpressionSyntaxException.class,
                    () -> ResourceValidator.validateExpression("(a & b) | (c & (d", OptimizerPolicy.defaults()));

            assertEquals(10, exception.getPosition());
        }
    }

    @Nested
    @DisplayName("Processing limits")
    class ProcessingLimits {

        @Test
        @DisplayName("Should reject more variables than the policy allows")
        void shouldRejectTooManyVariables() {
            // Given: 27 distinct variables against the strict limit of 26
            String text = IntStream.range(0, 27).mapToObj(i -> "v" + i).collect(Collectors.joining(" | "));

            ResourceLimitException exception = assertThrows(ResourceLimitException.class,
                    () -> ResourceValidator.validateVariableCount(LogicOptimizer.parse(text), OptimizerPolicy.strict()));

            assertEquals("Too many variables. Maximum 26, found 27", exception.getMessage());
            assertEquals("maxVariables", exception.getLimitName());
        }

        @Test
        @DisplayName("Constants and repeated variables should not count")
        void constantsAndRepeatsDoNotCount() {
            OptimizerPolicy policy = OptimizerPolicy.builder().maxVariables(2).build();

            assertDoesNotThrow(() -> ResourceValidator.validateVariableCount(
                    LogicOptimizer.parse("a & b | !a & 1 | b & 0"), policy));
        }

        @Test
        @DisplayName("Should allow exactly maxIterations iterations")
        void shouldCheckIterations() {
            OptimizerPolicy policy = OptimizerPolicy.builder().maxIterations(3).build();

            assertDoesNotThrow(() -> ResourceValidator.checkIterations(2, policy));
            IterationLimitExceededException exception = assertThrows(IterationLimitExceededException.class,
                    () -> ResourceValidator.checkIterations(3, policy));
            assertEquals(3, exception.getMaxIterations());
        }

        @Test
        @DisplayName("Should reject processing past the time limit")
        void shouldCheckElapsedTime() {
            OptimizerPolicy policy = OptimizerPolicy.builder().maxProcessingTime(Duration.ofMillis(10)).build();
            long longAgo = System.nanoTime() - Duration.ofSeconds(1).toNanos();

            TimeLimitExceededException exception = assertThrows(TimeLimitExceededException.class,
                    () -> ResourceValidator.checkElapsed(longAgo, policy));

            assertEquals(Duration.ofMillis(10), exception.getLimit());
            assertDoesNotThrow(() -> ResourceValidator.checkElapsed(System.nanoTime(), OptimizerPolicy.defaults()));
        }
    }
}
