package com.arbiter.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Workspace context gathered for an intent before execution.
 */
public record ContextBundle(
    String intent,
    List<FileSnippet> relevantFiles,
    List<String> patterns
) implements Serializable {

    /**
     * A workspace file judged relevant to the intent, with a short preview.
     */
    public record FileSnippet(
        String path,
        String preview
    ) implements Serializable {}

    public ContextBundle {
        intent = intent != null ? intent : "";
        relevantFiles = relevantFiles != null ? List.copyOf(relevantFiles) : List.of();
        patterns = patterns != null ? List.copyOf(patterns) : List.of();
    }

    public static ContextBundle empty(String intent) {
        return new ContextBundle(intent, List.of(), List.of());
    }
}
