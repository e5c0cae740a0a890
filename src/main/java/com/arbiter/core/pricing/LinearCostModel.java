package com.arbiter.core.pricing;

import com.arbiter.core.model.RiskLevel;
import org.springframework.stereotype.Service;

/**
 * Linear complexity-cost model.
 * <p>
 * {@code base = loc * w_loc + dependencies * w_dep + abstractions * w_abs}, with
 * default weights 1.0 / 50.0 / 20.0 so that costs read as LOC-equivalents.
 * The security surcharge is {@code base * (riskMultiplier - 1)}.
 */
@Service
public class LinearCostModel {

    private final PricingProperties.Weights weights;

    public LinearCostModel(PricingProperties properties) {
        this.weights = properties.getWeights();
    }

    public double calculateBaseCost(int loc, int dependencies, int abstractions) {
        if (loc < 0 || dependencies < 0 || abstractions < 0) {
            throw new IllegalArgumentException(String.format(
                    "Cost estimates must not be negative (loc=%d, dependencies=%d, abstractions=%d)",
                    loc, dependencies, abstractions));
        }
        return loc * weights.getLoc()
                + dependencies * weights.getDependency()
                + abstractions * weights.getAbstraction();
    }

    /**
     * Computes the base cost and the risk surcharge for the given estimates.
     *
     * @param loc          estimated lines of code
     * @param dependencies estimated new dependencies
     * @param abstractions estimated new abstractions
     * @param risk         risk level supplying the multiplier
     * @return the two cost components; {@link CostBreakdown#total()} is their sum
     */
    public CostBreakdown calculateTotalCost(int loc, int dependencies, int abstractions, RiskLevel risk) {
        double base = calculateBaseCost(loc, dependencies, abstractions);
        double security = base * (risk.multiplier() - 1.0);
        return new CostBreakdown(base, security);
    }
}
