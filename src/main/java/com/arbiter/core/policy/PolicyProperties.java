package com.arbiter.core.policy;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "arbiter.policy")
public class PolicyProperties {

    private String name = "default";
    private Budgets budgets = new Budgets();
    private List<Pattern> forbiddenPatterns = new ArrayList<>();
    private Map<String, String> permissions = new LinkedHashMap<>();
    private Thresholds costThresholds = new Thresholds();

    /**
     * Converts the bound properties into a validated {@link Policy}.
     *
     * @throws IllegalStateException if any budget is not positive
     */
    public Policy toPolicy() {
        PolicyBudgets policyBudgets;
        try {
            policyBudgets = new PolicyBudgets(
                    budgets.getMaxLoc(), budgets.getMaxModules(),
                    budgets.getMaxFiles(), budgets.getMaxDependencies());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid arbiter.policy configuration: " + e.getMessage(), e);
        }
        var patterns = forbiddenPatterns.stream()
                .map(p -> new ForbiddenPattern(p.getName(), p.getDescription(), p.getRule(), p.getSeverity()))
                .toList();
        return new Policy(name, policyBudgets, patterns, Permissions.fromConfig(permissions),
                new CostThresholds(costThresholds.getWarning(), costThresholds.getRejection(),
                        costThresholds.getSessionLimit()));
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Budgets getBudgets() {
        return budgets;
    }

    public void setBudgets(Budgets budgets) {
        this.budgets = budgets;
    }

    public List<Pattern> getForbiddenPatterns() {
        return forbiddenPatterns;
    }

    public void setForbiddenPatterns(List<Pattern> forbiddenPatterns) {
        this.forbiddenPatterns = forbiddenPatterns;
    }

    public Map<String, String> getPermissions() {
        return permissions;
    }

    public void setPermissions(Map<String, String> permissions) {
        this.permissions = permissions;
    }

    public Thresholds getCostThresholds() {
        return costThresholds;
    }

    public void setCostThresholds(Thresholds costThresholds) {
        this.costThresholds = costThresholds;
    }

    public static class Budgets {
        private int maxLoc = 1000;
        private int maxModules = 8;
        private int maxFiles = 30;
        private int maxDependencies = 20;

        public int getMaxLoc() {
            return maxLoc;
        }

        public void setMaxLoc(int maxLoc) {
            this.maxLoc = maxLoc;
        }

        public int getMaxModules() {
            return maxModules;
        }

        public void setMaxModules(int maxModules) {
            this.maxModules = maxModules;
        }

        public int getMaxFiles() {
            return maxFiles;
        }

        public void setMaxFiles(int maxFiles) {
            this.maxFiles = maxFiles;
        }

        public int getMaxDependencies() {
            return maxDependencies;
        }

        public void setMaxDependencies(int maxDependencies) {
            this.maxDependencies = maxDependencies;
        }
    }

    public static class Pattern {
        private String name;
        private String description = "";
        private String rule = "";
        private String severity = "error";

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public String getRule() {
            return rule;
        }

        public void setRule(String rule) {
            this.rule = rule;
        }

        public String getSeverity() {
            return severity;
        }

        public void setSeverity(String severity) {
            this.severity = severity;
        }
    }

    public static class Thresholds {
        private double warning = 100.0;
        private double rejection = 500.0;
        private double sessionLimit = 2000.0;

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

        public double getSessionLimit() {
            return sessionLimit;
        }

        public void setSessionLimit(double sessionLimit) {
            this.sessionLimit = sessionLimit;
        }
    }
}
