package com.arbiter.core.pricing;

import com.arbiter.core.model.BudgetStatus;
import com.arbiter.core.model.Cost;
import com.arbiter.core.model.RiskLevel;
import com.arbiter.core.model.SpecVariant;
import com.arbiter.core.model.Specification;
import com.arbiter.core.model.SpecificationBudget;
import com.arbiter.core.policy.Policy;
import com.arbiter.core.policy.PolicyBudgets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PricingKernelTest {

    private static final Policy POLICY = Policy.withBudgets(new PolicyBudgets(1000, 8, 30, 20));

    private static PricingKernel kernel(PricingProperties properties) {
        return new PricingKernel(new LinearCostModel(properties), new BudgetEnforcer(properties),
                new AlternativeGenerator(), properties);
    }

    private static Specification spec(int loc, int dependencies, int abstractions, RiskLevel risk) {
        return new Specification("add a payment gateway", SpecVariant.BASE, List.of("Payments settle"),
                new SpecificationBudget(loc, 4, dependencies, abstractions, 10), risk,
                Set.of(), List.of(), List.of(), List.of());
    }

    @Test
    @DisplayName("an oversized critical spec is rejected with six alternatives")
    void oversizedCriticalSpec() {
        Cost cost = kernel(new PricingProperties()).price(spec(1200, 2, 5, RiskLevel.CRITICAL), POLICY);

        assertTrue(cost.total() > 1000);
        assertEquals(2800.0, cost.total(), 1e-9);
        assertEquals(1400.0, cost.security(), 1e-9);
        assertEquals(BudgetStatus.REJECTED, cost.budgetStatus());
        assertFalse(cost.withinBudget());
        assertEquals(6, cost.alternatives().size());
        // exceeded by 200 LOC
        assertEquals(80, cost.alternatives().get(0).estimatedSavings());
    }

    @Test
    @DisplayName("a spec within budget carries no alternatives")
    void withinBudget() {
        Cost cost = kernel(new PricingProperties()).price(spec(150, 0, 3, RiskLevel.LOW), POLICY);

        assertEquals(BudgetStatus.APPROVED, cost.budgetStatus());
        assertTrue(cost.withinBudget());
        assertEquals(15.0, cost.usagePercentage(), 1e-9);
        assertEquals(150, cost.loc());
        assertEquals(3, cost.abstractions());
        assertTrue(cost.alternatives().isEmpty());
    }

    @Test
    @DisplayName("the LOC metric ignores the risk surcharge")
    void locMetricIgnoresRisk() {
        Cost cost = kernel(new PricingProperties()).price(spec(400, 1, 5, RiskLevel.CRITICAL), POLICY);

        assertEquals(1100.0, cost.total(), 1e-9);
        assertEquals(BudgetStatus.APPROVED, cost.budgetStatus());
    }

    @Test
    @DisplayName("the total-cost metric checks the full cost against max_loc")
    void totalCostMetric() {
        var properties = new PricingProperties();
        properties.setBudgetMetric(PricingProperties.BudgetMetric.TOTAL_COST);

        Cost cost = kernel(properties).price(spec(400, 1, 5, RiskLevel.CRITICAL), POLICY);

        assertEquals(BudgetStatus.REJECTED, cost.budgetStatus());
        assertEquals(110.0, cost.usagePercentage(), 1e-9);
        // exceeded by 100
        assertEquals(List.of(40, 30, 50, 25, 60, 20),
                cost.alternatives().stream().map(a -> a.estimatedSavings()).toList());
    }
}
