package com.arbiter.core.pricing;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "arbiter.pricing")
public class PricingProperties {

    /** Which estimate is compared against the policy's max_loc. */
    public enum BudgetMetric {
        /** Estimated lines of code only. */
        LOC,
        /** Total complexity cost, including dependency, abstraction and risk surcharges. */
        TOTAL_COST
    }

    private Weights weights = new Weights();
    private Thresholds thresholds = new Thresholds();
    private BudgetMetric budgetMetric = BudgetMetric.LOC;

    public Weights getWeights() {
        return weights;
    }

    public void setWeights(Weights weights) {
        this.weights = weights;
    }

    public Thresholds getThresholds() {
        return thresholds;
    }

    public void setThresholds(Thresholds thresholds) {
        this.thresholds = thresholds;
    }

    public BudgetMetric getBudgetMetric() {
        return budgetMetric;
    }

    public void setBudgetMetric(BudgetMetric budgetMetric) {
        this.budgetMetric = budgetMetric;
    }

    public static class Weights {
        private double loc = 1.0;
        private double dependency = 50.0;
        private double abstraction = 20.0;

        public double getLoc() {
            return loc;
        }

        public void setLoc(double loc) {
            this.loc = loc;
        }

        public double getDependency() {
            return dependency;
        }

        public void setDependency(double dependency) {
            this.dependency = dependency;
        }

        public double getAbstraction() {
            return abstraction;
        }

        public void setAbstraction(double abstraction) {
            this.abstraction = abstraction;
        }
    }

    /** Usage ratios above which a cost is classified advisory, warning and rejected. */
    public static class Thresholds {
        private double advisory = 0.70;
        private double warning = 0.85;
        private double rejection = 1.00;

        public double getAdvisory() {
            return advisory;
        }

        public void setAdvisory(double advisory) {
            this.advisory = advisory;
        }

        public double getWarning() {
            return warning;
        }

        public void setWarning(double warning) {
            this.warning = warning;
        }

        public double getRejection() {
            return rejection;
        }

        public void setRejection(double rejection) {
            this.rejection = rejection;
        }
    }
}
