package com.pipelineparser.graph;

import com.pipelineparser.model.dto.NodeData;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Detects cycles in a directed graph with a three-color depth-first search.
 *
 * The search is iterative: an explicit stack of frames stands in for the call
 * stack, so deep pipelines cannot overflow the thread stack. All traversal
 * state is local to a single {@link #isAcyclic} call.
 */
@Component
public class AcyclicityChecker {

    /**
     * Check whether the graph contains no directed cycle.
     *
     * @param nodes Pipeline nodes, in input order; each unvisited node seeds a traversal
     * @param adjacency Adjacency structure produced by {@link GraphBuilder}
     * @return true if the graph is a DAG
     */
    public boolean isAcyclic(List<NodeData> nodes, Map<String, List<String>> adjacency) {
        if (nodes.isEmpty() || countEdges(adjacency) == 0) {
            return true;
        }

        Map<String, VisitState> states = new HashMap<>();
        for (NodeData node : nodes) {
            states.put(node.getId(), VisitState.UNVISITED);
        }

        for (NodeData node : nodes) {
            if (states.get(node.getId()) == VisitState.UNVISITED && hasCycleFrom(node.getId(), adjacency, states)) {
                return false;
            }
        }
        return true;
    }

    private boolean hasCycleFrom(String root, Map<String, List<String>> adjacency, Map<String, VisitState> states) {
        Deque<Frame> stack = new ArrayDeque<>();
        states.put(root, VisitState.IN_PROGRESS);
        stack.push(new Frame(root, adjacency.get(root)));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (!frame.hasNext()) {
                states.put(frame.nodeId, VisitState.DONE);
                stack.pop();
                continue;
            }

            String neighbor = frame.next();
            VisitState state = states.get(neighbor);
            if (state == VisitState.IN_PROGRESS) {
                // back-edge to a node on the active path
                return true;
            }
            if (state == VisitState.UNVISITED) {
                states.put(neighbor, VisitState.IN_PROGRESS);
                stack.push(new Frame(neighbor, adjacency.get(neighbor)));
            }
        }
        return false;
    }

    private static int countEdges(Map<String, List<String>> adjacency) {
        int count = 0;
        for (List<String> successors : adjacency.values()) {
            count += successors.size();
        }
        return count;
    }

    /**
     * One suspended visit: a node and the position of its next unexplored successor.
     */
    private static final class Frame {
        private final String nodeId;
        private final List<String> successors;
        private int cursor;

        private Frame(String nodeId, List<String> successors) {
            this.nodeId = nodeId;
            this.successors = successors;
        }

        private boolean hasNext() {
            return cursor < successors.size();
        }

        private String next() {
            return successors.get(cursor++);
        }
    }
}
