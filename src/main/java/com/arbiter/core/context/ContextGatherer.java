package com.arbiter.core.context;

import com.arbiter.core.model.ContextBundle;
import com.arbiter.core.model.Specification;

/**
 * Collects workspace context for an intent before the selected specification
 * is executed.
 */
public interface ContextGatherer {

    ContextBundle gather(String intent, Specification specification);
}
