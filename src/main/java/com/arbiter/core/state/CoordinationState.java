package com.arbiter.core.state;

import com.arbiter.core.model.Alternative;
import com.arbiter.core.model.ContextBundle;
import com.arbiter.core.model.CoordinationPhase;
import com.arbiter.core.model.Cost;
import com.arbiter.core.model.ExecutionResult;
import com.arbiter.core.model.IntentGoals;
import com.arbiter.core.model.PricedCandidate;
import com.arbiter.core.model.Specification;
import com.arbiter.core.value.ActionValidation;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Graph state for one coordination call.
 * <p>
 * Extends LangGraph4j's {@link AgentState} with typed accessors. The
 * coordination log uses an appender channel so that every node adds its
 * entries in order without replacing earlier ones.
 */
public class CoordinationState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        // ── Scalar channels ──────────────────────────────────────────
        Map.entry("coordinationId",        Channels.base(() -> "")),
        Map.entry("intent",                Channels.base(() -> "")),
        Map.entry("agentId",               Channels.base(() -> "")),
        Map.entry("phase",                 Channels.base(() -> CoordinationPhase.EXTRACT_GOALS.name())),
        Map.entry("goals",                 Channels.base((Reducer<IntentGoals>) null)),
        Map.entry("candidates",            Channels.base((Supplier<List<Specification>>) List::of)),
        Map.entry("pricedCandidates",      Channels.base((Supplier<List<PricedCandidate>>) List::of)),
        Map.entry("selectedSpec",          Channels.base((Reducer<Specification>) null)),
        Map.entry("selectedCost",          Channels.base((Reducer<Cost>) null)),
        Map.entry("selectionScore",        Channels.base(() -> 0.0)),
        Map.entry("context",               Channels.base((Reducer<ContextBundle>) null)),
        Map.entry("execution",             Channels.base((Reducer<ExecutionResult>) null)),
        Map.entry("validation",            Channels.base((Reducer<ActionValidation>) null)),
        Map.entry("shouldRefine",          Channels.base(() -> false)),
        Map.entry("refinementInstruction", Channels.base(() -> "")),
        Map.entry("error",                 Channels.base(() -> "")),
        Map.entry("alternatives",          Channels.base((Supplier<List<Alternative>>) List::of)),

        // ── Appender channels (list accumulation) ────────────────────
        Map.entry("coordinationLog",       Channels.appender(ArrayList::new))
    );

    public CoordinationState(Map<String, Object> initData) {
        super(initData);
    }

    // ── Scalar accessors ─────────────────────────────────────────────

    public String coordinationId() {
        return this.<String>value("coordinationId").orElse("");
    }

    public String intent() {
        return this.<String>value("intent").orElse("");
    }

    /** The registered agent whose actions this coordination validates. */
    public String agentId() {
        return this.<String>value("agentId").orElse("");
    }

    public CoordinationPhase phase() {
        String raw = this.<String>value("phase").orElse(CoordinationPhase.EXTRACT_GOALS.name());
        return CoordinationPhase.valueOf(raw);
    }

    public Optional<IntentGoals> goals() {
        return value("goals");
    }

    public List<Specification> candidates() {
        return this.<List<Specification>>value("candidates").orElse(List.of());
    }

    public List<PricedCandidate> pricedCandidates() {
        return this.<List<PricedCandidate>>value("pricedCandidates").orElse(List.of());
    }

    public Optional<Specification> selectedSpec() {
        return value("selectedSpec");
    }

    public Optional<Cost> selectedCost() {
        return value("selectedCost");
    }

    public double selectionScore() {
        return this.<Double>value("selectionScore").orElse(0.0);
    }

    public Optional<ContextBundle> context() {
        return value("context");
    }

    public Optional<ExecutionResult> execution() {
        return value("execution");
    }

    public Optional<ActionValidation> validation() {
        return value("validation");
    }

    public boolean shouldRefine() {
        return this.<Boolean>value("shouldRefine").orElse(false);
    }

    public String refinementInstruction() {
        return this.<String>value("refinementInstruction").orElse("");
    }

    public String error() {
        return this.<String>value("error").orElse("");
    }

    public List<Alternative> alternatives() {
        return this.<List<Alternative>>value("alternatives").orElse(List.of());
    }

    // ── List accessors (appender channels) ───────────────────────────

    public List<String> coordinationLog() {
        return this.<List<String>>value("coordinationLog").orElse(List.of());
    }
}
