package com.arbiter.core.pricing;

import com.arbiter.core.model.Alternative;
import com.arbiter.core.model.RiskLevel;
import com.arbiter.core.model.SpecVariant;
import com.arbiter.core.model.Specification;
import com.arbiter.core.model.SpecificationBudget;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class AlternativeGeneratorTest {

    private final AlternativeGenerator generator = new AlternativeGenerator();

    private static Specification spec() {
        return new Specification("add a reporting module", SpecVariant.BASE,
                List.of("Reports render", "Reports export to CSV"),
                new SpecificationBudget(1200, 6, 2, 5, 10), RiskLevel.HIGH,
                Set.of(), List.of(), List.of(), List.of());
    }

    @Test
    @DisplayName("returns the six strategies in a fixed order")
    void sixDistinctStrategies() {
        List<Alternative> alternatives = generator.generateAlternatives(spec(), 200);

        assertEquals(List.of("reduce_scope", "simplify_architecture", "reuse_existing",
                        "defer_dependencies", "split_phases", "optimize_implementation"),
                alternatives.stream().map(Alternative::strategy).toList());
        assertEquals(6, alternatives.stream().map(Alternative::strategy).collect(Collectors.toSet()).size());
    }

    @Test
    @DisplayName("savings are fractions of the overage")
    void savingsFractions() {
        List<Alternative> alternatives = generator.generateAlternatives(spec(), 200);

        assertEquals(List.of(80, 60, 100, 50, 120, 40),
                alternatives.stream().map(Alternative::estimatedSavings).toList());
    }

    @Test
    @DisplayName("savings never exceed the overage")
    void savingsBounded() {
        for (int over : new int[] {0, 1, 3, 17, 999}) {
            for (Alternative alternative : generator.generateAlternatives(spec(), over)) {
                assertTrue(alternative.estimatedSavings() >= 0, alternative.strategy());
                assertTrue(alternative.estimatedSavings() <= over, alternative.strategy());
            }
        }
    }

    @Test
    @DisplayName("a negative overage saves nothing")
    void negativeOverage() {
        assertTrue(generator.generateAlternatives(spec(), -50).stream()
                .allMatch(a -> a.estimatedSavings() == 0));
    }

    @Test
    @DisplayName("implementation hints refer to the specification")
    void hintsDerivedFromSpec() {
        List<Alternative> alternatives = generator.generateAlternatives(spec(), 200);

        assertTrue(alternatives.get(0).implementation().contains("2 success criteria"));
        assertTrue(alternatives.get(1).implementation().contains("5 planned abstractions down to 2"));
        assertTrue(alternatives.get(4).implementation().contains("Reports render"));
        assertTrue(alternatives.get(5).implementation().contains("high-risk"));
    }
}
