package com.arbiter.core.pricing;

import com.arbiter.core.model.BudgetCheck;
import com.arbiter.core.model.BudgetStatus;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Classifies an estimated cost against a budget limit.
 * <p>
 * Boundaries are strict: a ratio exactly at a threshold stays in the lower
 * band, so 100% usage is a warning and only usage above 100% is rejected.
 */
@Service
public class BudgetEnforcer {

    private final PricingProperties.Thresholds thresholds;

    public BudgetEnforcer(PricingProperties properties) {
        this.thresholds = properties.getThresholds();
    }

    /**
     * @param estimatedCost the cost to classify
     * @param budgetLimit   the limit; zero rejects immediately
     * @throws IllegalArgumentException if the limit is negative
     */
    public BudgetCheck checkBudget(double estimatedCost, double budgetLimit) {
        if (budgetLimit < 0) {
            throw new IllegalArgumentException("Budget limit must not be negative, got " + budgetLimit);
        }
        if (budgetLimit == 0) {
            return new BudgetCheck(BudgetStatus.REJECTED, 100.0, "Budget limit is zero");
        }

        double ratio = estimatedCost / budgetLimit;
        double percentage = ratio * 100.0;

        if (ratio > thresholds.getRejection()) {
            return new BudgetCheck(BudgetStatus.REJECTED, percentage,
                    format("Budget exceeded: %.1f%% of limit. Operation rejected.", percentage));
        }
        if (ratio > thresholds.getWarning()) {
            return new BudgetCheck(BudgetStatus.WARNING, percentage,
                    format("Warning: %.1f%% of budget. Justification recommended.", percentage));
        }
        if (ratio > thresholds.getAdvisory()) {
            return new BudgetCheck(BudgetStatus.ADVISORY, percentage,
                    format("Advisory: %.1f%% of budget. Consider alternatives.", percentage));
        }
        return new BudgetCheck(BudgetStatus.APPROVED, percentage,
                format("Within budget: %.1f%% used.", percentage));
    }

    private static String format(String template, double percentage) {
        return String.format(Locale.ROOT, template, percentage);
    }
}
