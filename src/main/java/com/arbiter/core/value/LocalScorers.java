package com.arbiter.core.value;

import com.arbiter.core.model.AgentAction;
import com.arbiter.core.model.GoalType;
import com.arbiter.core.model.WorkspaceState;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Agent-role heuristics for the local half of an alignment check.
 * <p>
 * Each role optimizes its own notion of success: a generator cares about
 * completeness, a test writer about coverage, a refactorer about simplicity.
 * Roles without a heuristic score a fixed {@value #DEFAULT_LOCAL_SCORE}.
 */
public final class LocalScorers {

    public static final String GENERATOR = "generator";
    public static final String TEST_WRITER = "test_writer";
    public static final String REFACTOR = "refactor";

    static final double DEFAULT_LOCAL_SCORE = 0.8;

    /** Markers of work left unfinished in generated content. */
    private static final Pattern UNFINISHED_MARKER = Pattern.compile(
            "\\bTODO\\b|\\bFIXME\\b|NotImplemented|UnsupportedOperationException|^\\s*pass\\s*$|^\\s*\\.\\.\\.\\s*$",
            Pattern.MULTILINE);

    private static final Pattern TEST_CASE = Pattern.compile(
            "\\bdef\\s+test_\\w+|@Test\\b|\\bit\\s*\\(|\\btest\\s*\\(");

    private static final Map<String, GoalScorer> REGISTRY = Map.of(
            GENERATOR, (state, action) -> completeness(action),
            TEST_WRITER, (state, action) -> coverage(action),
            REFACTOR, (state, action) -> GoalScorers.score(GoalType.SIMPLICITY, state, action));

    private LocalScorers() {} // utility class

    public static GoalScorer forRole(String role) {
        if (role == null) {
            return (state, action) -> DEFAULT_LOCAL_SCORE;
        }
        return REGISTRY.getOrDefault(role.toLowerCase(), (state, action) -> DEFAULT_LOCAL_SCORE);
    }

    public static double score(String role, WorkspaceState state, AgentAction action) {
        return GoalScorers.clamp(forRole(role).score(state, action));
    }

    /**
     * 0.0 without content; otherwise 1.0 less 0.25 per unfinished marker.
     */
    static double completeness(AgentAction action) {
        if (action.code().isBlank()) return 0.0;
        var matcher = UNFINISHED_MARKER.matcher(action.code());
        int markers = 0;
        while (matcher.find()) markers++;
        return GoalScorers.clamp(1.0 - 0.25 * markers);
    }

    /**
     * Uses a reported {@code test_coverage} when the action carries one,
     * otherwise estimates from the number of test cases written.
     */
    static double coverage(AgentAction action) {
        Object reported = action.metadata().get("test_coverage");
        if (reported instanceof Number n) {
            return GoalScorers.clamp(n.doubleValue());
        }
        var matcher = TEST_CASE.matcher(action.code());
        int tests = 0;
        while (matcher.find()) tests++;
        if (tests == 0) return 0.0;
        return Math.min(1.0, 0.4 + 0.2 * tests);
    }
}
