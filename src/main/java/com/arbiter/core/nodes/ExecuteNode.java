package com.arbiter.core.nodes;

import com.arbiter.core.execution.ExecutionAgent;
import com.arbiter.core.logging.MdcContext;
import com.arbiter.core.model.ContextBundle;
import com.arbiter.core.model.CoordinationPhase;
import com.arbiter.core.model.ExecutionResult;
import com.arbiter.core.model.ExecutionTask;
import com.arbiter.core.model.IntentGoals;
import com.arbiter.core.policy.Policy;
import com.arbiter.core.state.CoordinationState;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Hands the selected specification to the {@link ExecutionAgent} together with
 * the gathered context, the intent's constraints and the policy permissions.
 */
@Component
public class ExecuteNode {

    private final ExecutionAgent executionAgent;
    private final Policy policy;

    public ExecuteNode(ExecutionAgent executionAgent, Policy policy) {
        this.executionAgent = executionAgent;
        this.policy = policy;
    }

    public Map<String, Object> apply(CoordinationState state) {
        var spec = state.selectedSpec().orElseThrow(() ->
                new IllegalStateException("No selected spec for coordination " + state.coordinationId()));
        IntentGoals goals = state.goals().orElseGet(IntentGoals::neutral);
        ContextBundle context = state.context().orElseGet(() -> ContextBundle.empty(state.intent()));

        var task = new ExecutionTask(state.agentId(), spec, goals, goals.constraints(), policy.permissions());
        ExecutionResult result;
        MdcContext.setAgent(state.coordinationId(), state.agentId());
        try {
            result = executionAgent.execute(task, context);
        } finally {
            MdcContext.clearAgent();
        }

        return Map.of(
                "execution", result,
                "phase", CoordinationPhase.CHECK_ALIGNMENT.name(),
                "coordinationLog", List.of("Executed " + result.action().type() + ": " + result.summary())
        );
    }
}
