package com.arbiter.core.value;

import com.arbiter.core.model.AgentAction;
import com.arbiter.core.model.CodePatterns;
import com.arbiter.core.model.GoalType;
import com.arbiter.core.model.WorkspaceState;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Closed registry mapping each {@link GoalType} to exactly one pure scorer.
 * <p>
 * Goal types without a dedicated heuristic score a neutral 0.5. Adding a
 * heuristic means registering one more scorer here; callers never branch on
 * goal type themselves.
 */
public final class GoalScorers {

    public static final double NEUTRAL_SCORE = 0.5;

    static final int MAX_FILE_LINES = 300;
    static final int MAX_FUNCTION_LINES = 50;
    static final int MAX_CLASSES = 3;
    /** Four nesting levels at four columns each. */
    static final int MAX_INDENT_COLUMNS = 16;

    /** Function or method header on a single line. */
    private static final Pattern FUNCTION_HEADER = Pattern.compile(
            "^\\s*(async\\s+)?(def|function|fn)\\s+\\w+"
                    + "|^\\s*(public|private|protected)\\s+(static\\s+)?(final\\s+)?[\\w<>\\[\\], ?]+\\s+\\w+\\s*\\([^;]*$");

    private static final GoalScorer NEUTRAL = (state, action) -> NEUTRAL_SCORE;

    private static final Map<GoalType, GoalScorer> REGISTRY;

    static {
        var registry = new EnumMap<GoalType, GoalScorer>(GoalType.class);
        registry.put(GoalType.CODE_QUALITY, (state, action) -> codeQuality(action.code()));
        registry.put(GoalType.MAINTAINABILITY, (state, action) -> maintainability(action.code()));
        registry.put(GoalType.SIMPLICITY, (state, action) -> simplicity(action.code()));
        registry.put(GoalType.CONSISTENCY, GoalScorers::consistency);
        registry.put(GoalType.PERFORMANCE, NEUTRAL);
        registry.put(GoalType.SECURITY, NEUTRAL);
        registry.put(GoalType.TESTABILITY, NEUTRAL);
        REGISTRY = Collections.unmodifiableMap(registry);
    }

    private GoalScorers() {} // utility class

    public static GoalScorer forGoal(GoalType type) {
        return REGISTRY.getOrDefault(type, NEUTRAL);
    }

    /**
     * Scores one goal type, clamped to [0, 1].
     */
    public static double score(GoalType type, WorkspaceState state, AgentAction action) {
        return clamp(forGoal(type).score(state, action));
    }

    /**
     * Starts at 1.0 and deducts for missing type annotations (0.2), missing
     * doc comments (0.2) and missing error handling (0.1).
     */
    static double codeQuality(String code) {
        double score = 1.0;
        if (!CodePatterns.hasTypeAnnotations(code)) score -= 0.2;
        if (!CodePatterns.hasDocComments(code)) score -= 0.2;
        if (!CodePatterns.hasErrorHandling(code)) score -= 0.1;
        return clamp(score);
    }

    /**
     * Deducts 0.3 for files over 300 lines and 0.2 when any function spans
     * more than 50 lines. A function runs until the next header or end of text.
     */
    static double maintainability(String code) {
        if (code == null || code.isEmpty()) return 1.0;
        String[] lines = code.split("\n", -1);
        double score = 1.0;
        if (lines.length > MAX_FILE_LINES) score -= 0.3;
        if (longestFunction(lines) > MAX_FUNCTION_LINES) score -= 0.2;
        return clamp(score);
    }

    /**
     * Deducts 0.2 for more than three class definitions and 0.2 for
     * indentation deeper than four levels.
     */
    static double simplicity(String code) {
        if (code == null || code.isEmpty()) return 1.0;
        double score = 1.0;
        if (CodePatterns.countClasses(code) > MAX_CLASSES) score -= 0.2;
        if (maxIndent(code.split("\n", -1)) > MAX_INDENT_COLUMNS) score -= 0.2;
        return clamp(score);
    }

    /**
     * Jaccard overlap of the action's patterns with the workspace's. A
     * workspace with no established patterns is trivially consistent.
     */
    static double consistency(WorkspaceState state, AgentAction action) {
        if (state.patterns().isEmpty()) return 1.0;
        var existing = new HashSet<>(state.patterns());
        var proposed = new HashSet<>(action.patterns());

        var union = new HashSet<>(existing);
        union.addAll(proposed);
        if (union.isEmpty()) return NEUTRAL_SCORE;

        var intersection = new HashSet<>(existing);
        intersection.retainAll(proposed);
        return (double) intersection.size() / union.size();
    }

    static int longestFunction(String[] lines) {
        int longest = 0;
        int start = -1;
        for (int i = 0; i < lines.length; i++) {
            if (FUNCTION_HEADER.matcher(lines[i]).find()) {
                if (start >= 0) longest = Math.max(longest, i - start);
                start = i;
            }
        }
        if (start >= 0) longest = Math.max(longest, lines.length - start);
        return longest;
    }

    static int maxIndent(String[] lines) {
        int max = 0;
        for (String line : lines) {
            if (line.isBlank()) continue;
            int columns = 0;
            for (int i = 0; i < line.length(); i++) {
                char c = line.charAt(i);
                if (c == ' ') columns++;
                else if (c == '\t') columns += 4;
                else break;
            }
            max = Math.max(max, columns);
        }
        return max;
    }

    static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
