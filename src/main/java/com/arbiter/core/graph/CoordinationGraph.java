package com.arbiter.core.graph;

import com.arbiter.core.model.CoordinationPhase;
import com.arbiter.core.nodes.CheckAlignmentNode;
import com.arbiter.core.nodes.ExecuteNode;
import com.arbiter.core.nodes.ExtractGoalsNode;
import com.arbiter.core.nodes.GatherContextNode;
import com.arbiter.core.nodes.GenerateCandidatesNode;
import com.arbiter.core.nodes.PriceAndSelectNode;
import com.arbiter.core.nodes.RefineNode;
import com.arbiter.core.state.CoordinationState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that drives one
 * coordination call.
 * <p>
 * Graph topology:
 * <pre>
 *   START -> extract_goals -> generate_candidates -> price_and_select
 *         -> [routeAfterPricing]
 *            -> budget_exhausted -> END  (no candidate within budget)
 *            -> gather_context -> execute -> check_alignment
 *               -> [routeAfterAlignment]
 *                  -> refine -> END
 *                  -> done -> END
 * </pre>
 */
@Component
public class CoordinationGraph {

    private static final Logger log = LoggerFactory.getLogger(CoordinationGraph.class);

    private final CompiledGraph<CoordinationState> compiledGraph;

    public CoordinationGraph(
            ExtractGoalsNode extractGoalsNode,
            GenerateCandidatesNode generateCandidatesNode,
            PriceAndSelectNode priceAndSelectNode,
            GatherContextNode gatherContextNode,
            ExecuteNode executeNode,
            CheckAlignmentNode checkAlignmentNode,
            RefineNode refineNode) throws Exception {

        var graph = new StateGraph<>(CoordinationState.SCHEMA, CoordinationState::new)
                .addNode("extract_goals", node_async(extractGoalsNode::apply))
                .addNode("generate_candidates", node_async(generateCandidatesNode::apply))
                .addNode("price_and_select", node_async(priceAndSelectNode::apply))
                .addNode("budget_exhausted", node_async(
                        state -> Map.of("phase", CoordinationPhase.ERROR.name(),
                                "coordinationLog", List.of("Coordination stopped: " + state.error()))))
                .addNode("gather_context", node_async(gatherContextNode::apply))
                .addNode("execute", node_async(executeNode::apply))
                .addNode("check_alignment", node_async(checkAlignmentNode::apply))
                .addNode("refine", node_async(refineNode::apply))
                .addNode("done", node_async(
                        state -> Map.of("phase", CoordinationPhase.DONE.name(),
                                "coordinationLog", List.of("Coordination complete: action aligned with global values"))))
                .addEdge(START, "extract_goals")
                .addEdge("extract_goals", "generate_candidates")
                .addEdge("generate_candidates", "price_and_select")
                .addConditionalEdges("price_and_select",
                        edge_async(this::routeAfterPricing),
                        Map.of("budget_exhausted", "budget_exhausted",
                                "gather_context", "gather_context"))
                .addEdge("budget_exhausted", END)
                .addEdge("gather_context", "execute")
                .addEdge("execute", "check_alignment")
                .addConditionalEdges("check_alignment",
                        edge_async(this::routeAfterAlignment),
                        Map.of("refine", "refine",
                                "done", "done"))
                .addEdge("refine", END)
                .addEdge("done", END);

        this.compiledGraph = graph.compile(CompileConfig.builder().build());
        log.info("Coordination graph compiled");
    }

    /**
     * Routes after price_and_select: an ERROR phase means no candidate was
     * within budget.
     */
    String routeAfterPricing(CoordinationState state) {
        if (state.phase() == CoordinationPhase.ERROR) {
            return "budget_exhausted";
        }
        return "gather_context";
    }

    /**
     * Routes after check_alignment based on the phase it decided.
     */
    String routeAfterAlignment(CoordinationState state) {
        if (state.phase() == CoordinationPhase.REFINE) {
            return "refine";
        }
        return "done";
    }

    public CompiledGraph<CoordinationState> getCompiledGraph() {
        return compiledGraph;
    }
}
