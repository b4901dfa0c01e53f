package com.switchboard.core.graph;

import com.switchboard.core.model.OperationStatus;
import com.switchboard.core.nodes.ClassifyOperationNode;
import com.switchboard.core.nodes.ProposeActionNode;
import com.switchboard.core.nodes.RouteOperationNode;
import com.switchboard.core.nodes.VerifyActionNode;
import com.switchboard.core.state.OperationState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.bsc.langgraph4j.action.NodeAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that carries an
 * operation from request to verdict.
 * <pre>
 *   START -> classify -> route -> propose -> verify -> END
 *   START (resumed) ------> route -> ...
 * </pre>
 * A node that throws records the exception in the {@code error} channel and the
 * graph ends there; {@link com.switchboard.core.engine.OperationEngine} rethrows it.
 */
@Component
public class OperationGraph {

    private static final Logger log = LoggerFactory.getLogger(OperationGraph.class);

    static final String CLASSIFY = "classify";
    static final String ROUTE = "route";
    static final String PROPOSE = "propose";
    static final String VERIFY = "verify";

    private final CompiledGraph<OperationState> compiledGraph;

    public OperationGraph(ClassifyOperationNode classifyNode,
                          RouteOperationNode routeNode,
                          ProposeActionNode proposeNode,
                          VerifyActionNode verifyNode) throws Exception {

        var graph = new StateGraph<>(OperationState.SCHEMA, OperationState::new)
                .addNode(CLASSIFY, node_async(guard(CLASSIFY, classifyNode::apply)))
                .addNode(ROUTE, node_async(guard(ROUTE, routeNode::apply)))
                .addNode(PROPOSE, node_async(guard(PROPOSE, proposeNode::apply)))
                .addNode(VERIFY, node_async(guard(VERIFY, verifyNode::apply)))
                .addConditionalEdges(START, edge_async(OperationGraph::entry),
                        Map.of(CLASSIFY, CLASSIFY, ROUTE, ROUTE))
                .addConditionalEdges(CLASSIFY, edge_async((OperationState state) -> next(state, ROUTE)),
                        Map.of(ROUTE, ROUTE, END, END))
                .addConditionalEdges(ROUTE, edge_async((OperationState state) -> next(state, PROPOSE)),
                        Map.of(PROPOSE, PROPOSE, END, END))
                .addConditionalEdges(PROPOSE, edge_async(OperationGraph::afterPropose),
                        Map.of(VERIFY, VERIFY, END, END))
                .addEdge(VERIFY, END);

        this.compiledGraph = graph.compile();
        log.info("Operation graph compiled");
    }

    public CompiledGraph<OperationState> getCompiledGraph() {
        return compiledGraph;
    }

    static String next(OperationState state, String onSuccess) {
        return state.error().isPresent() ? END : onSuccess;
    }

    /** A resumed operation is already classified. */
    static String entry(OperationState state) {
        return state.status() == OperationStatus.CLASSIFIED ? ROUTE : CLASSIFY;
    }

    /** A correction that lands while the agent proposes leaves nothing to verify. */
    static String afterPropose(OperationState state) {
        if (state.status() != OperationStatus.VERIFYING) {
            return END;
        }
        return next(state, VERIFY);
    }

    private static NodeAction<OperationState> guard(String name, NodeAction<OperationState> node) {
        return state -> {
            try {
                return node.apply(state);
            } catch (RuntimeException e) {
                log.warn("Node {} failed for operation {}: {}", name, state.operationId(), e.getMessage());
                return Map.of("error", e);
            }
        };
    }
}
