package com.arbiter.core.nodes;

import com.arbiter.core.context.ContextGatherer;
import com.arbiter.core.model.ContextBundle;
import com.arbiter.core.model.CoordinationPhase;
import com.arbiter.core.state.CoordinationState;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Collects workspace context for the selected specification.
 */
@Component
public class GatherContextNode {

    private final ContextGatherer contextGatherer;

    public GatherContextNode(ContextGatherer contextGatherer) {
        this.contextGatherer = contextGatherer;
    }

    public Map<String, Object> apply(CoordinationState state) {
        var spec = state.selectedSpec().orElseThrow(() ->
                new IllegalStateException("No selected spec for coordination " + state.coordinationId()));
        ContextBundle context = contextGatherer.gather(state.intent(), spec);
        return Map.of(
                "context", context,
                "phase", CoordinationPhase.EXECUTE.name(),
                "coordinationLog", List.of("Gathered context: " + context.relevantFiles().size()
                        + " relevant files, patterns " + context.patterns())
        );
    }
}
