package com.arbiter.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * The workspace an action is evaluated against: known files and the code
 * patterns already established there.
 */
public record WorkspaceState(
    List<String> files,
    List<String> patterns,
    Map<String, Object> metadata
) implements Serializable {

    public WorkspaceState {
        files = files != null ? List.copyOf(files) : List.of();
        patterns = patterns != null ? List.copyOf(patterns) : List.of();
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static WorkspaceState empty() {
        return new WorkspaceState(List.of(), List.of(), Map.of());
    }

    public static WorkspaceState from(ContextBundle context) {
        return new WorkspaceState(
                context.relevantFiles().stream().map(ContextBundle.FileSnippet::path).toList(),
                context.patterns(),
                Map.of("intent", context.intent()));
    }
}
