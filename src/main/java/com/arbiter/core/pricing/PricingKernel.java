package com.arbiter.core.pricing;

import com.arbiter.core.model.Alternative;
import com.arbiter.core.model.BudgetCheck;
import com.arbiter.core.model.BudgetStatus;
import com.arbiter.core.model.Cost;
import com.arbiter.core.model.Specification;
import com.arbiter.core.policy.Policy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Prices a specification against a policy.
 * <p>
 * Estimates are read from the specification's own budgets. The figure checked
 * against {@code policy.budgets.maxLoc} is the LOC estimate by default, or the
 * total complexity cost when {@code arbiter.pricing.budget-metric=TOTAL_COST}.
 * Rejected candidates carry the six fallback alternatives.
 */
@Service
public class PricingKernel {

    private static final Logger log = LoggerFactory.getLogger(PricingKernel.class);

    private final LinearCostModel costModel;
    private final BudgetEnforcer budgetEnforcer;
    private final AlternativeGenerator alternativeGenerator;
    private final PricingProperties.BudgetMetric budgetMetric;

    public PricingKernel(LinearCostModel costModel, BudgetEnforcer budgetEnforcer,
                         AlternativeGenerator alternativeGenerator, PricingProperties properties) {
        this.costModel = costModel;
        this.budgetEnforcer = budgetEnforcer;
        this.alternativeGenerator = alternativeGenerator;
        this.budgetMetric = properties.getBudgetMetric();
    }

    public Cost price(Specification spec, Policy policy) {
        int loc = spec.budgets().maxLocDelta();
        int dependencies = spec.budgets().maxNewDependencies();
        int abstractions = spec.budgets().maxNewAbstractions();

        CostBreakdown breakdown = costModel.calculateTotalCost(loc, dependencies, abstractions, spec.riskLevel());

        double measured = budgetMetric == PricingProperties.BudgetMetric.TOTAL_COST ? breakdown.total() : loc;
        int limit = policy.budgets().maxLoc();
        BudgetCheck check = budgetEnforcer.checkBudget(measured, limit);

        List<Alternative> alternatives = List.of();
        if (check.status() == BudgetStatus.REJECTED) {
            int exceededBy = (int) Math.ceil(measured - limit);
            alternatives = alternativeGenerator.generateAlternatives(spec, exceededBy);
            log.info("{} spec rejected: {} (exceeded by {})", spec.variant(), check.message(), exceededBy);
        } else {
            log.debug("{} spec priced: {}", spec.variant(), check.message());
        }

        return new Cost(
                loc,
                dependencies,
                abstractions,
                breakdown.total(),
                breakdown.securityCost(),
                check.canProceed(),
                check.status(),
                check.usagePercentage(),
                check.message(),
                alternatives);
    }
}
