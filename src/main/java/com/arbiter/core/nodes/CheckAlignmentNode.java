package com.arbiter.core.nodes;

import com.arbiter.core.events.ArbiterEvent;
import com.arbiter.core.events.EventBus;
import com.arbiter.core.metrics.ArbiterMetrics;
import com.arbiter.core.model.ContextBundle;
import com.arbiter.core.model.CoordinationPhase;
import com.arbiter.core.model.WorkspaceState;
import com.arbiter.core.state.CoordinationState;
import com.arbiter.core.value.ActionValidation;
import com.arbiter.core.value.GlobalValueMemory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Validates the executed action against the global value function, using the
 * gathered context as the workspace state. Any warning, or a failed
 * alignment, sends the coordination to refinement.
 */
@Component
public class CheckAlignmentNode {

    private final GlobalValueMemory valueMemory;
    private final EventBus eventBus;
    private final ArbiterMetrics metrics;

    public CheckAlignmentNode(GlobalValueMemory valueMemory, EventBus eventBus, ArbiterMetrics metrics) {
        this.valueMemory = valueMemory;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(CoordinationState state) {
        var execution = state.execution().orElseThrow(() ->
                new IllegalStateException("No execution result for coordination " + state.coordinationId()));
        WorkspaceState workspace = WorkspaceState.from(
                state.context().orElseGet(() -> ContextBundle.empty(state.intent())));

        ActionValidation validation = valueMemory.validateAgentAction(state.agentId(), execution.action(), workspace);
        metrics.recordAlignment(state.agentId(), validation.alignmentScore(), validation.driftDetected());
        if (validation.driftDetected()) {
            eventBus.publish(ArbiterEvent.of(ArbiterEvent.Type.ALIGNMENT_DRIFT,
                    state.coordinationId(), state.agentId(),
                    Map.of("alignmentScore", validation.alignmentScore(),
                            "actionType", execution.action().type())));
        }

        boolean needsRefinement = !validation.approved() || !validation.warnings().isEmpty();
        return Map.of(
                "validation", validation,
                "phase", needsRefinement ? CoordinationPhase.REFINE.name() : CoordinationPhase.DONE.name(),
                "coordinationLog", List.of(String.format(Locale.ROOT,
                        "Alignment check: aligned=%s, score=%.2f, %d warning(s)",
                        validation.approved(), validation.alignmentScore(), validation.warnings().size()))
        );
    }
}
