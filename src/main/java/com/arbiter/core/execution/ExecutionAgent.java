package com.arbiter.core.execution;

import com.arbiter.core.model.ContextBundle;
import com.arbiter.core.model.ExecutionResult;
import com.arbiter.core.model.ExecutionTask;

/**
 * Performs the content generation for a selected specification. Timeouts,
 * retries and sandboxing are the implementation's concern.
 */
public interface ExecutionAgent {

    ExecutionResult execute(ExecutionTask task, ContextBundle context);
}
