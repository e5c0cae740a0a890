package com.arbiter.core.goals;

import com.arbiter.core.model.GoalType;
import com.arbiter.core.model.IntentGoals;
import com.arbiter.core.model.OptimizationTarget;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GoalExtractorTest {

    private final GoalExtractor extractor = new GoalExtractor();

    @Nested
    @DisplayName("Goal tags and weights")
    class Goals {

        @Test
        @DisplayName("simple intent favours simplicity and speed")
        void simpleIntent() {
            IntentGoals goals = extractor.extract("create a simple calculator class");

            assertTrue(goals.hasGoal(IntentGoals.SIMPLICITY));
            assertEquals(OptimizationTarget.MAXIMIZE_SPEED, goals.optimizationTarget());
            assertEquals(0.30, goals.impliedGoals().get(GoalType.SIMPLICITY));
            assertEquals(0.20, goals.impliedGoals().get(GoalType.CODE_QUALITY));
        }

        @Test
        @DisplayName("production intent favours quality")
        void productionIntent() {
            IntentGoals goals = extractor.extract("build a production-ready API with robust error handling");

            assertTrue(goals.hasGoal(IntentGoals.HIGH_QUALITY));
            assertEquals(OptimizationTarget.MAXIMIZE_QUALITY, goals.optimizationTarget());
            assertEquals(0.35, goals.impliedGoals().get(GoalType.CODE_QUALITY));
            assertEquals(0.15, goals.impliedGoals().get(GoalType.TESTABILITY));
        }

        @Test
        @DisplayName("quality wins the target when both quality and simplicity match")
        void qualityKeepsTargetOverSimplicity() {
            IntentGoals goals = extractor.extract("a simple but robust parser");

            assertTrue(goals.hasGoal(IntentGoals.HIGH_QUALITY));
            assertTrue(goals.hasGoal(IntentGoals.SIMPLICITY));
            assertEquals(OptimizationTarget.MAXIMIZE_QUALITY, goals.optimizationTarget());
            // simplicity is applied second and overrides the code quality weight
            assertEquals(0.20, goals.impliedGoals().get(GoalType.CODE_QUALITY));
        }

        @Test
        @DisplayName("maintainability and testability leave the target balanced")
        void independentGoals() {
            IntentGoals goals = extractor.extract("clean, well tested date utilities");

            assertEquals(List.of(IntentGoals.MAINTAINABILITY, IntentGoals.TESTABILITY),
                    List.copyOf(goals.explicitGoals()));
            assertEquals(0.30, goals.impliedGoals().get(GoalType.MAINTAINABILITY));
            assertEquals(0.15, goals.impliedGoals().get(GoalType.TESTABILITY));
            assertEquals(OptimizationTarget.BALANCE, goals.optimizationTarget());
        }

        @Test
        @DisplayName("performance adds a tag and a constraint but no weight")
        void performanceIntent() {
            IntentGoals goals = extractor.extract("an efficient cache");

            assertTrue(goals.hasGoal(IntentGoals.PERFORMANCE));
            assertTrue(goals.hasConstraint(IntentGoals.OPTIMIZE_FOR_PERFORMANCE));
            assertTrue(goals.impliedGoals().isEmpty());
        }

        @Test
        @DisplayName("matching is case-insensitive")
        void caseInsensitive() {
            assertTrue(extractor.extract("A MINIMAL Logger").hasGoal(IntentGoals.SIMPLICITY));
        }
    }

    @Nested
    @DisplayName("Constraints")
    class Constraints {

        @Test
        @DisplayName("negative phrases become constraints")
        void negativePhrases() {
            IntentGoals goals = extractor.extract("a csv reader with no dependencies in functional style");

            assertEquals(List.of(IntentGoals.NO_EXTERNAL_DEPENDENCIES, IntentGoals.NO_CLASSES), goals.constraints());
        }

        @Test
        @DisplayName("zero dependencies is recognized")
        void zeroDependencies() {
            assertTrue(extractor.extract("zero dependencies json printer")
                    .hasConstraint(IntentGoals.NO_EXTERNAL_DEPENDENCIES));
        }
    }

    @Nested
    @DisplayName("Neutral input")
    class Neutral {

        @Test
        @DisplayName("blank intent yields neutral goals")
        void blankIntent() {
            IntentGoals goals = extractor.extract("   ");

            assertTrue(goals.explicitGoals().isEmpty());
            assertTrue(goals.impliedGoals().isEmpty());
            assertTrue(goals.constraints().isEmpty());
            assertEquals(OptimizationTarget.BALANCE, goals.optimizationTarget());
        }

        @Test
        @DisplayName("unmatched intent yields neutral goals")
        void unmatchedIntent() {
            assertEquals(IntentGoals.neutral(), extractor.extract("add a user endpoint"));
        }
    }
}
