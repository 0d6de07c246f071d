package io.github.cyfko.logicopt.core.normalform;

import io.github.cyfko.logicopt.core.config.OptimizerPolicy;
import io.github.cyfko.logicopt.core.exception.NormalFormTooComplexException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Distribution Budget Tests")
class DistributionBudgetTest {

    @Test
    @DisplayName("Should count calls up to the limit")
    void shouldCountCalls() {
        // Given
        DistributionBudget budget = new DistributionBudget(NormalFormConverter.CNF, 2, 5);

        // When
        budget.countCall();
        budget.countCall();

        // Then
        assertEquals(2, budget.getCalls());
        NormalFormTooComplexException exception = assertThrows(NormalFormTooComplexException.class, budget::countCall);
        assertEquals("CNF", exception.getForm());
        assertEquals("CNF conversion too complex: more than 2 distribution calls", exception.getMessage());
    }

    @Test
    @DisplayName("Should track the depth of synthesized nodes")
    void shouldTrackDepth() {
        DistributionBudget budget = new DistributionBudget(NormalFormConverter.DNF, 100, 2);

        budget.enter();
        budget.enter();
        assertEquals(2, budget.getDepth());

        budget.exit();
        assertEquals(1, budget.getDepth());

        budget.enter();
        assertThrows(NormalFormTooComplexException.class, budget::enter);
    }

    @Test
    @DisplayName("Should take its limits from the policy")
    void shouldUsePolicyLimits() {
        OptimizerPolicy policy = OptimizerPolicy.builder().maxDistributionCalls(1).maxDistributionDepth(1).build();
        DistributionBudget budget = DistributionBudget.of(NormalFormConverter.DNF, policy);

        budget.countCall();
        budget.enter();

        assertEquals(1, budget.getCalls());
        assertEquals(1, budget.getDepth());
        assertThrows(NormalFormTooComplexException.class, budget::countCall);
    }
}
