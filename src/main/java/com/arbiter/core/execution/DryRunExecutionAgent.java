package com.arbiter.core.execution;

import com.arbiter.core.model.AgentAction;
import com.arbiter.core.model.ContextBundle;
import com.arbiter.core.model.ExecutionResult;
import com.arbiter.core.model.ExecutionTask;
import com.arbiter.core.model.Specification;
import com.arbiter.core.policy.Permission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Execution agent that generates nothing. It reports a {@code code_generation}
 * action without code, describing what would have been built, so the full
 * coordination flow can run without a generation backend.
 * <p>
 * The task's {@code file_write} grant is still checked: without it the
 * summary states that generated changes would not be applied.
 */
public class DryRunExecutionAgent implements ExecutionAgent {

    private static final Logger log = LoggerFactory.getLogger(DryRunExecutionAgent.class);

    public static final String ACTION_TYPE = "code_generation";

    @Override
    public ExecutionResult execute(ExecutionTask task, ContextBundle context) {
        Specification spec = task.specification();
        log.info("Dry run for agent {}: {} ({} LOC budget, {} context files)",
                task.agentId(), spec.intent(), spec.budgets().maxLocDelta(), context.relevantFiles().size());

        boolean canWrite = task.permissions().isAllowed(Permission.FILE_WRITE);
        if (!canWrite) {
            log.info("Agent {} may not write files ({}: {})", task.agentId(), Permission.FILE_WRITE.key(),
                    task.permissions().modeFor(Permission.FILE_WRITE));
        }

        var action = new AgentAction(ACTION_TYPE, "", List.of(), Map.of(
                "dry_run", true,
                "variant", spec.variant().name(),
                "estimated_loc", spec.budgets().maxLocDelta(),
                "context_files", context.relevantFiles().size(),
                "write_allowed", canWrite));
        String summary = String.format("Dry run: no code generated for '%s' (budget %d LOC)",
                spec.intent(), spec.budgets().maxLocDelta());
        if (!canWrite) {
            summary += String.format("; %s is %s, changes would not be applied", Permission.FILE_WRITE.key(),
                    task.permissions().modeFor(Permission.FILE_WRITE).name().toLowerCase());
        }
        return new ExecutionResult(action, summary);
    }
}
