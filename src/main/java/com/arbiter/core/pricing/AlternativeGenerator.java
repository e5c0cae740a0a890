package com.arbiter.core.pricing;

import com.arbiter.core.model.Alternative;
import com.arbiter.core.model.Specification;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Produces the six fallback strategies offered when a candidate is over budget.
 * <p>
 * Order is fixed and savings are independent estimates (not cumulative, not
 * re-ranked). Each strategy's implementation hint is derived from the
 * specification it applies to.
 */
@Service
public class AlternativeGenerator {

    static final double REDUCE_SCOPE_SAVINGS = 0.40;
    static final double SIMPLIFY_ARCHITECTURE_SAVINGS = 0.30;
    static final double REUSE_EXISTING_SAVINGS = 0.50;
    static final double DEFER_DEPENDENCIES_SAVINGS = 0.25;
    static final double SPLIT_PHASES_SAVINGS = 0.60;
    static final double OPTIMIZE_IMPLEMENTATION_SAVINGS = 0.20;

    /**
     * @param spec       the over-budget specification
     * @param exceededBy how far over budget it is; negative values are treated as zero
     * @return exactly six alternatives, each saving between 0 and {@code exceededBy}
     */
    public List<Alternative> generateAlternatives(Specification spec, int exceededBy) {
        int over = Math.max(0, exceededBy);
        var budgets = spec.budgets();
        int criteria = spec.successCriteria().size();
        int loc = budgets.maxLocDelta();

        return List.of(
                new Alternative("reduce_scope",
                        "Remove non-essential features from specification",
                        savings(over, REDUCE_SCOPE_SAVINGS),
                        String.format("Review the %d success criteri%s and drop the optional ones",
                                criteria, criteria == 1 ? "on" : "a")),
                new Alternative("simplify_architecture",
                        "Use simpler patterns with fewer abstractions",
                        savings(over, SIMPLIFY_ARCHITECTURE_SAVINGS),
                        budgets.maxNewAbstractions() > 1
                                ? String.format("Cut the %d planned abstractions down to %d",
                                        budgets.maxNewAbstractions(), budgets.maxNewAbstractions() / 2)
                                : "Keep the single abstraction and inline everything else"),
                new Alternative("reuse_existing",
                        "Leverage existing modules instead of creating new ones",
                        savings(over, REUSE_EXISTING_SAVINGS),
                        String.format("Search the codebase for components to extend before writing %d new lines", loc)),
                new Alternative("defer_dependencies",
                        "Implement core functionality without external libraries",
                        savings(over, DEFER_DEPENDENCIES_SAVINGS),
                        budgets.maxNewDependencies() > 0
                                ? String.format("Build the core without the %d planned dependencies, standard library first",
                                        budgets.maxNewDependencies())
                                : "No new dependencies are planned; keep it that way"),
                new Alternative("split_phases",
                        "Deliver functionality incrementally across multiple phases",
                        savings(over, SPLIT_PHASES_SAVINGS),
                        String.format("Ship about %d LOC covering \"%s\" in phase 1, defer the remaining criteria",
                                Math.max(1, loc / 2), spec.successCriteria().get(0))),
                new Alternative("optimize_implementation",
                        "Use more efficient algorithms and data structures",
                        savings(over, OPTIMIZE_IMPLEMENTATION_SAVINGS),
                        String.format("Profile the critical paths of this %s-risk change and trim redundant code",
                                spec.riskLevel().wireValue()))
        );
    }

    private static int savings(int exceededBy, double fraction) {
        int estimate = (int) Math.floor(exceededBy * fraction);
        return Math.max(0, Math.min(exceededBy, estimate));
    }
}
