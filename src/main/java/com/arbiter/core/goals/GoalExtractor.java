package com.arbiter.core.goals;

import com.arbiter.core.model.GoalType;
import com.arbiter.core.model.IntentGoals;
import com.arbiter.core.model.OptimizationTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Extracts goal tags, goal-weight changes, an optimization target and hard
 * constraints from a free-text build intent.
 * <p>
 * Matching is case-insensitive substring matching against fixed keyword sets,
 * applied in a fixed priority order:
 * <ol>
 *   <li>quality: raises code quality and testability and always sets
 *       {@link OptimizationTarget#MAXIMIZE_QUALITY}</li>
 *   <li>simplicity: raises simplicity, lowers code quality, and sets
 *       {@link OptimizationTarget#MAXIMIZE_SPEED} only if the target is still
 *       {@link OptimizationTarget#BALANCE}</li>
 *   <li>maintainability, performance and testability: independent tags and
 *       weights that never touch the target</li>
 *   <li>negative phrases: constraint tags, regardless of other matches</li>
 * </ol>
 */
@Service
public class GoalExtractor {

    private static final Logger log = LoggerFactory.getLogger(GoalExtractor.class);

    static final List<String> QUALITY_KEYWORDS =
            List.of("production", "robust", "reliable", "enterprise", "quality");
    static final List<String> SIMPLICITY_KEYWORDS =
            List.of("simple", "minimal", "basic", "straightforward", "quick");
    static final List<String> MAINTAINABILITY_KEYWORDS =
            List.of("maintainable", "clean", "readable", "documented");
    static final List<String> PERFORMANCE_KEYWORDS =
            List.of("fast", "efficient", "optimized", "high-performance");
    static final List<String> TESTABILITY_KEYWORDS =
            List.of("tested", "test coverage", "tdd", "testable");

    static final List<String> NO_DEPENDENCY_PHRASES = List.of("no dependencies", "zero dependencies");
    static final List<String> NO_CLASS_PHRASES = List.of("no classes", "functional");

    /**
     * Extracts goals from the given intent.
     *
     * @param intent free-text build request; blank input yields {@link IntentGoals#neutral()}
     * @return the extracted goals; {@code impliedGoals} holds only the weights that changed
     */
    public IntentGoals extract(String intent) {
        if (intent == null || intent.isBlank()) {
            return IntentGoals.neutral();
        }

        String text = intent.toLowerCase();
        var tags = new LinkedHashSet<String>();
        var weights = new EnumMap<GoalType, Double>(GoalType.class);
        var target = OptimizationTarget.BALANCE;
        var constraints = new ArrayList<String>();

        if (containsAny(text, QUALITY_KEYWORDS)) {
            tags.add(IntentGoals.HIGH_QUALITY);
            weights.put(GoalType.CODE_QUALITY, 0.35);
            weights.put(GoalType.TESTABILITY, 0.15);
            target = OptimizationTarget.MAXIMIZE_QUALITY;
        }

        if (containsAny(text, SIMPLICITY_KEYWORDS)) {
            tags.add(IntentGoals.SIMPLICITY);
            weights.put(GoalType.SIMPLICITY, 0.30);
            weights.put(GoalType.CODE_QUALITY, 0.20);
            if (target == OptimizationTarget.BALANCE) {
                target = OptimizationTarget.MAXIMIZE_SPEED;
            }
        }

        if (containsAny(text, MAINTAINABILITY_KEYWORDS)) {
            tags.add(IntentGoals.MAINTAINABILITY);
            weights.put(GoalType.MAINTAINABILITY, 0.30);
        }

        if (containsAny(text, PERFORMANCE_KEYWORDS)) {
            tags.add(IntentGoals.PERFORMANCE);
            constraints.add(IntentGoals.OPTIMIZE_FOR_PERFORMANCE);
        }

        if (containsAny(text, TESTABILITY_KEYWORDS)) {
            tags.add(IntentGoals.TESTABILITY);
            weights.put(GoalType.TESTABILITY, 0.15);
        }

        if (containsAny(text, NO_DEPENDENCY_PHRASES)) {
            constraints.add(IntentGoals.NO_EXTERNAL_DEPENDENCIES);
        }
        if (containsAny(text, NO_CLASS_PHRASES)) {
            constraints.add(IntentGoals.NO_CLASSES);
        }

        var goals = new IntentGoals(tags, weights, target, constraints);
        log.debug("Extracted goals {} (target={}, constraints={}) from intent", tags, target, constraints);
        return goals;
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
