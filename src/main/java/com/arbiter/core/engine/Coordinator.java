package com.arbiter.core.engine;

import com.arbiter.core.events.ArbiterEvent;
import com.arbiter.core.events.EventBus;
import com.arbiter.core.graph.CoordinationGraph;
import com.arbiter.core.logging.MdcContext;
import com.arbiter.core.metrics.ArbiterMetrics;
import com.arbiter.core.model.CoordinationPhase;
import com.arbiter.core.model.CoordinationResult;
import com.arbiter.core.model.SpecificationValidationException;
import com.arbiter.core.state.CoordinationState;
import com.arbiter.core.value.ActionValidation;
import com.arbiter.core.value.GlobalValueMemory;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one end-to-end coordination: goals, candidate specifications, pricing
 * and selection, context, execution and the alignment check.
 * <p>
 * Registers its own agent with the {@link GlobalValueMemory} so that executed
 * actions are validated and recorded, then invokes the compiled
 * {@link CoordinationGraph} and converts the final state into a
 * {@link CoordinationResult}. Budget exhaustion is reported as an
 * {@link CoordinationPhase#ERROR} result, not thrown.
 */
@Service
public class Coordinator {

    private static final Logger log = LoggerFactory.getLogger(Coordinator.class);
    private static final AtomicInteger COORDINATION_COUNTER = new AtomicInteger(0);

    public static final String AGENT_ID = "arbiter_coordinator";
    public static final String AGENT_ROLE = "coordination";

    private final CoordinationGraph coordinationGraph;
    private final GlobalValueMemory valueMemory;
    private final EventBus eventBus;
    private final ArbiterMetrics metrics;

    public Coordinator(CoordinationGraph coordinationGraph, GlobalValueMemory valueMemory,
                       EventBus eventBus, ArbiterMetrics metrics) {
        this.coordinationGraph = coordinationGraph;
        this.valueMemory = valueMemory;
        this.eventBus = eventBus;
        this.metrics = metrics;
        valueMemory.registerAgent(AGENT_ID, AGENT_ROLE, List.of("coordination", "alignment"));
    }

    /**
     * Coordinates an intent under a newly generated coordination ID.
     */
    public CoordinationResult coordinate(String intent) {
        return coordinate(generateCoordinationId(), intent);
    }

    /**
     * Coordinates an intent.
     *
     * @param coordinationId the ID used for logging, events and the graph thread
     * @param intent         the free-text build intent
     * @return the outcome, with the full coordination log
     * @throws SpecificationValidationException if the intent is blank
     * @throws RuntimeException if the graph execution returns empty state
     */
    public CoordinationResult coordinate(String coordinationId, String intent) {
        if (intent == null || intent.isBlank()) {
            throw new SpecificationValidationException("Intent must not be empty");
        }
        MdcContext.setCoordination(coordinationId);
        long started = System.currentTimeMillis();
        try {
            log.info("Starting coordination {}: {}", coordinationId, intent);
            eventBus.publish(ArbiterEvent.of(
                    ArbiterEvent.Type.COORDINATION_STARTED, coordinationId, AGENT_ID,
                    Map.of("intent", intent)));

            var stateMap = new HashMap<String, Object>();
            stateMap.put("coordinationId", coordinationId);
            stateMap.put("intent", intent);
            stateMap.put("agentId", AGENT_ID);
            stateMap.put("phase", CoordinationPhase.EXTRACT_GOALS.name());
            stateMap.put("coordinationLog", List.of("Coordination " + coordinationId + " started: " + intent));
            Map<String, Object> initialState = Map.copyOf(stateMap);

            var config = RunnableConfig.builder()
                    .threadId(coordinationId)
                    .build();

            var state = coordinationGraph.getCompiledGraph()
                    .invoke(initialState, config)
                    .orElseThrow(() -> new RuntimeException(
                            "Graph execution returned empty state for coordination " + coordinationId));

            CoordinationResult result = toResult(state);
            publishOutcome(result);
            metrics.recordCoordinationResult(result.phase().name());
            if (result.shouldRefine()) {
                metrics.recordRefinement();
            }
            log.info("Coordination {} finished in phase {}", coordinationId, result.phase());
            return result;
        } finally {
            metrics.recordCoordinationDuration(System.currentTimeMillis() - started);
            MdcContext.clear();
        }
    }

    /**
     * Generates a unique coordination ID in the format ARB-YYYY-NNNN.
     */
    public String generateCoordinationId() {
        int count = COORDINATION_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("ARB-%d-%04d", year, count);
    }

    CoordinationResult toResult(CoordinationState state) {
        var validation = state.validation();
        return new CoordinationResult(
                state.coordinationId(),
                state.intent(),
                state.phase(),
                state.goals().orElse(null),
                state.pricedCandidates(),
                state.selectedSpec().orElse(null),
                state.selectedCost().orElse(null),
                state.selectionScore(),
                state.context().orElse(null),
                state.execution().orElse(null),
                validation.map(ActionValidation::approved).orElse(false),
                validation.map(ActionValidation::warnings).orElse(List.of()),
                state.shouldRefine(),
                state.shouldRefine() ? state.refinementInstruction() : null,
                state.error().isEmpty() ? null : state.error(),
                state.alternatives(),
                state.coordinationLog());
    }

    private void publishOutcome(CoordinationResult result) {
        if (result.phase() == CoordinationPhase.ERROR) {
            eventBus.publish(ArbiterEvent.of(
                    ArbiterEvent.Type.COORDINATION_FAILED, result.coordinationId(), AGENT_ID,
                    Map.of("error", result.error(), "alternatives", result.alternatives().size())));
            return;
        }
        eventBus.publish(ArbiterEvent.of(
                ArbiterEvent.Type.COORDINATION_COMPLETED, result.coordinationId(), AGENT_ID,
                Map.of("phase", result.phase().name(),
                        "aligned", result.aligned(),
                        "shouldRefine", result.shouldRefine())));
    }
}
