package com.arbiter.core.value;

import com.arbiter.core.model.AgentAction;
import com.arbiter.core.model.GoalType;
import com.arbiter.core.model.OptimizationTarget;
import com.arbiter.core.model.WorkspaceState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Shared alignment context: the global value function, the registered agents'
 * local value functions, and the bounded alignment and drift history.
 * <p>
 * One instance is created by the application and passed to every component
 * that validates agent actions. State is loaded from the {@link ValueMemoryStore}
 * on {@link #initialize()}; a load failure falls back to
 * {@link GlobalValueFunction#defaults()} and never prevents startup. Every
 * mutation writes the entire state back.
 * <p>
 * No internal locking: callers must ensure at most one writer at a time around
 * {@link #updateGlobalGoal} and {@link #validateAgentAction}.
 */
@Service
public class GlobalValueMemory {

    private static final Logger log = LoggerFactory.getLogger(GlobalValueMemory.class);

    /** Alignment scores below this are recorded as drift. */
    public static final double DRIFT_THRESHOLD = 0.5;

    private final ValueMemoryStore store;
    private final int historyLimit;
    private final int driftLimit;

    private GlobalValueFunction globalValueFunction;
    private final Map<String, LocalValueFunction> agents = new LinkedHashMap<>();
    private final Deque<AlignmentRecord> alignmentHistory = new ArrayDeque<>();
    private final Deque<DriftEvent> driftEvents = new ArrayDeque<>();

    @Autowired
    public GlobalValueMemory(ValueMemoryStore store, MemoryProperties properties) {
        this(store, properties.getHistoryLimit(), properties.getDriftLimit());
    }

    public GlobalValueMemory(ValueMemoryStore store) {
        this(store, 100, 50);
    }

    GlobalValueMemory(ValueMemoryStore store, int historyLimit, int driftLimit) {
        if (historyLimit <= 0 || driftLimit <= 0) {
            throw new IllegalArgumentException("History and drift limits must be positive");
        }
        this.store = store;
        this.historyLimit = historyLimit;
        this.driftLimit = driftLimit;
    }

    /**
     * Loads persisted state, or creates and saves the defaults when there is
     * none. Idempotent.
     *
     * @return the active global value function
     */
    public GlobalValueFunction initialize() {
        if (globalValueFunction != null) {
            return globalValueFunction;
        }
        try {
            Optional<ValueMemorySnapshot> snapshot = store.load();
            if (snapshot.isPresent()) {
                restore(snapshot.get());
                log.info("Loaded global value function v{} with {} goals, {} alignment records, {} drift events",
                        globalValueFunction.getVersion(), globalValueFunction.getGoals().size(),
                        alignmentHistory.size(), driftEvents.size());
                return globalValueFunction;
            }
            globalValueFunction = GlobalValueFunction.defaults();
            log.info("No stored value memory; initialized default global value function");
            save();
        } catch (ValueMemoryStoreException e) {
            log.warn("Could not load value memory, falling back to defaults: {}", e.getMessage(), e);
            globalValueFunction = GlobalValueFunction.defaults();
            alignmentHistory.clear();
            driftEvents.clear();
        }
        return globalValueFunction;
    }

    public boolean isInitialized() {
        return globalValueFunction != null;
    }

    /** The active global value function, initializing on first use. */
    public GlobalValueFunction getGlobalValueFunction() {
        return initialize();
    }

    /**
     * Registers an agent, or returns the existing local value function if the
     * id is already registered.
     */
    public LocalValueFunction registerAgent(String agentId, String agentRole, List<String> localGoals) {
        return agents.computeIfAbsent(agentId, id -> {
            log.debug("Registered agent {} with role {}", id, agentRole);
            return new LocalValueFunction(id, agentRole, localGoals);
        });
    }

    public Optional<LocalValueFunction> agent(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    /**
     * Validates an agent's action against the global value function.
     * <p>
     * Unregistered agents are approved with a single "Agent not registered"
     * warning and nothing is recorded. Otherwise an {@link AlignmentRecord} is
     * appended; a score below {@value #DRIFT_THRESHOLD} also appends a
     * {@link DriftEvent} and puts a "DRIFT DETECTED" warning first. State is
     * saved after every recorded validation.
     */
    public ActionValidation validateAgentAction(String agentId, AgentAction action, WorkspaceState state) {
        LocalValueFunction local = agents.get(agentId);
        if (local == null) {
            log.debug("Skipping validation for unregistered agent {}", agentId);
            return ActionValidation.unregistered();
        }

        GlobalValueFunction global = initialize();
        AlignmentOutcome outcome = local.checkAlignment(global, state, action);
        Instant now = Instant.now();

        append(alignmentHistory, new AlignmentRecord(now, agentId, action.type(), outcome.aligned(),
                outcome.alignmentScore(), outcome.warnings()), historyLimit);

        var warnings = new ArrayList<>(outcome.warnings());
        boolean drift = outcome.alignmentScore() < DRIFT_THRESHOLD;
        if (drift) {
            append(driftEvents, new DriftEvent(now, agentId, action.type(), outcome.aligned(),
                    outcome.alignmentScore(), outcome.warnings()), driftLimit);
            warnings.add(0, String.format(Locale.ROOT, "DRIFT DETECTED: Alignment score %.2f < %.1f",
                    outcome.alignmentScore(), DRIFT_THRESHOLD));
            log.warn("Alignment drift for agent {} on {}: score {}", agentId, action.type(),
                    String.format(Locale.ROOT, "%.2f", outcome.alignmentScore()));
        }

        save();
        return new ActionValidation(outcome.aligned(), warnings, outcome.alignmentScore(), drift);
    }

    /**
     * Replaces the weight of one global goal and persists the change.
     * A no-op returning {@code false} before {@link #initialize()} or when no
     * goal of that type exists.
     */
    public boolean updateGlobalGoal(GoalType goalType, double newWeight) {
        if (globalValueFunction == null) {
            log.debug("Ignoring weight update for {}: value function not initialized", goalType);
            return false;
        }
        if (!globalValueFunction.updateGoalWeight(goalType, newWeight)) {
            log.debug("Ignoring weight update for {}: no such global goal", goalType);
            return false;
        }
        log.info("Updated {} weight to {}", goalType.wireValue(), newWeight);
        save();
        return true;
    }

    public void setOptimizationTarget(OptimizationTarget target) {
        GlobalValueFunction global = initialize();
        global.setOptimizationTarget(target);
        log.info("Set optimization target: {}", target.wireValue());
        save();
    }

    /**
     * Discards all stored state and starts over from the defaults.
     */
    public GlobalValueFunction resetToDefaults() {
        globalValueFunction = GlobalValueFunction.defaults();
        alignmentHistory.clear();
        driftEvents.clear();
        log.info("Reset global value function to defaults");
        save();
        return globalValueFunction;
    }

    public AlignmentStatistics getAlignmentStatistics() {
        int total = alignmentHistory.size();
        int aligned = 0;
        double scoreSum = 0.0;
        for (AlignmentRecord record : alignmentHistory) {
            if (record.aligned()) aligned++;
            scoreSum += record.alignmentScore();
        }
        return new AlignmentStatistics(
                total,
                aligned,
                total == 0 ? 0.0 : (double) aligned / total,
                total == 0 ? 0.0 : scoreSum / total,
                driftEvents.size(),
                driftEvents.peekLast());
    }

    public List<AlignmentRecord> alignmentHistory() {
        return List.copyOf(alignmentHistory);
    }

    public List<DriftEvent> driftEvents() {
        return List.copyOf(driftEvents);
    }

    private void restore(ValueMemorySnapshot snapshot) {
        globalValueFunction = snapshot.globalValueFunction();
        alignmentHistory.clear();
        snapshot.alignmentHistory().forEach(r -> append(alignmentHistory, r, historyLimit));
        driftEvents.clear();
        snapshot.driftEvents().forEach(d -> append(driftEvents, d, driftLimit));
    }

    private void save() {
        var snapshot = new ValueMemorySnapshot(
                globalValueFunction.getVersion(),
                Instant.now(),
                globalValueFunction,
                List.copyOf(alignmentHistory),
                List.copyOf(driftEvents));
        try {
            store.save(snapshot);
        } catch (ValueMemoryStoreException e) {
            log.warn("Could not persist value memory; in-memory state remains authoritative: {}",
                    e.getMessage(), e);
        }
    }

    private static <T> void append(Deque<T> buffer, T item, int limit) {
        buffer.addLast(item);
        while (buffer.size() > limit) {
            buffer.removeFirst();
        }
    }
}
