package com.waypoint.core.graph;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.model.MissionPhase;
import com.waypoint.core.nodes.ArbitrateNode;
import com.waypoint.core.nodes.CheckConsistencyNode;
import com.waypoint.core.nodes.CheckTrailNode;
import com.waypoint.core.nodes.FailNode;
import com.waypoint.core.nodes.GenerateLogicNode;
import com.waypoint.core.nodes.GeneratePlanNode;
import com.waypoint.core.nodes.TransmitNode;
import com.waypoint.core.nodes.VerifyMissionNode;
import com.waypoint.core.state.MissionState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} implementing the verification
 * and repair loop.
 * <p>
 * One node per phase. Every phase node writes the next {@code phase}; a single router then
 * picks the node for that phase, or {@code fail} once the retry budget is used up:
 * <pre>
 *   START -> [route] -> generate_plan | generate_logic | check_consistency
 *                     | verify_mission | arbitrate | check_trail
 *         each phase node -> [route]
 *   transmit -> END
 *   fail     -> END
 * </pre>
 */
@Component
public class MissionGraph {

    private static final Logger log = LoggerFactory.getLogger(MissionGraph.class);

    static final String GENERATE_PLAN = "generate_plan";
    static final String GENERATE_LOGIC = "generate_logic";
    static final String CHECK_CONSISTENCY = "check_consistency";
    static final String VERIFY_MISSION = "verify_mission";
    static final String ARBITRATE = "arbitrate";
    static final String CHECK_TRAIL = "check_trail";
    static final String TRANSMIT = "transmit";
    static final String FAIL = "fail";

    private static final Map<String, String> ROUTES = Map.of(
            GENERATE_PLAN, GENERATE_PLAN,
            GENERATE_LOGIC, GENERATE_LOGIC,
            CHECK_CONSISTENCY, CHECK_CONSISTENCY,
            VERIFY_MISSION, VERIFY_MISSION,
            ARBITRATE, ARBITRATE,
            CHECK_TRAIL, CHECK_TRAIL,
            TRANSMIT, TRANSMIT,
            FAIL, FAIL);

    private final CompiledGraph<MissionState> compiledGraph;

    public MissionGraph(GeneratePlanNode generatePlanNode,
                        GenerateLogicNode generateLogicNode,
                        CheckConsistencyNode checkConsistencyNode,
                        VerifyMissionNode verifyMissionNode,
                        ArbitrateNode arbitrateNode,
                        CheckTrailNode checkTrailNode,
                        TransmitNode transmitNode,
                        FailNode failNode,
                        WaypointProperties properties) throws Exception {

        var graph = new StateGraph<>(MissionState.SCHEMA, MissionState::new)
                .addNode(GENERATE_PLAN, node_async(generatePlanNode::apply))
                .addNode(GENERATE_LOGIC, node_async(generateLogicNode::apply))
                .addNode(CHECK_CONSISTENCY, node_async(checkConsistencyNode::apply))
                .addNode(VERIFY_MISSION, node_async(verifyMissionNode::apply))
                .addNode(ARBITRATE, node_async(arbitrateNode::apply))
                .addNode(CHECK_TRAIL, node_async(checkTrailNode::apply))
                .addNode(TRANSMIT, node_async(transmitNode::apply))
                .addNode(FAIL, node_async(failNode::apply))
                .addConditionalEdges(START, edge_async(this::route), ROUTES)
                .addConditionalEdges(GENERATE_PLAN, edge_async(this::route), ROUTES)
                .addConditionalEdges(GENERATE_LOGIC, edge_async(this::route), ROUTES)
                .addConditionalEdges(CHECK_CONSISTENCY, edge_async(this::route), ROUTES)
                .addConditionalEdges(VERIFY_MISSION, edge_async(this::route), ROUTES)
                .addConditionalEdges(ARBITRATE, edge_async(this::route), ROUTES)
                .addConditionalEdges(CHECK_TRAIL, edge_async(this::route), ROUTES)
                .addEdge(TRANSMIT, END)
                .addEdge(FAIL, END);

        // every retry can replay at most the whole loop once
        int recursionLimit = Math.max(100, (properties.getPipeline().getMaxRetries() + 2) * 8);
        this.compiledGraph = graph.compile(CompileConfig.builder()
                .recursionLimit(recursionLimit)
                .build());
        log.info("Mission graph compiled (recursion limit {})", recursionLimit);
    }

    /**
     * Terminal phases go to their terminal node; an exhausted budget goes to {@code fail};
     * otherwise the node handling the current phase runs next.
     */
    String route(MissionState state) {
        MissionPhase phase = state.phase();
        if (phase == MissionPhase.DONE) {
            return TRANSMIT;
        }
        if (phase == MissionPhase.FAILED) {
            return FAIL;
        }
        if (state.retryCount() >= state.maxRetries()) {
            return FAIL;
        }
        return switch (phase) {
            case NEED_PLAN -> GENERATE_PLAN;
            case NEED_LOGIC -> GENERATE_LOGIC;
            case NEED_CONSISTENCY -> CHECK_CONSISTENCY;
            case NEED_VERIFICATION -> VERIFY_MISSION;
            case NEED_ARBITRATION -> ARBITRATE;
            case NEED_TRAIL_CHECK -> CHECK_TRAIL;
            case DONE -> TRANSMIT;
            case FAILED -> FAIL;
        };
    }

    public CompiledGraph<MissionState> getCompiledGraph() {
        return compiledGraph;
    }
}
