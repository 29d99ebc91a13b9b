package com.pipelineparser.graph;

import com.pipelineparser.model.dto.EdgeData;
import com.pipelineparser.model.dto.NodeData;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the adjacency structure of a submitted pipeline.
 */
@Slf4j
@Component
public class GraphBuilder {

    /**
     * Map every node ID to its successors, in edge input order.
     * Edges whose source or target is not a known node are dropped.
     *
     * @param nodes Pipeline nodes
     * @param edges Pipeline edges
     * @return Adjacency structure keyed by every node ID
     */
    public Map<String, List<String>> build(List<NodeData> nodes, List<EdgeData> edges) {
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        for (NodeData node : nodes) {
            adjacency.put(node.getId(), new ArrayList<>());
        }

        for (EdgeData edge : edges) {
            List<String> successors = adjacency.get(edge.getSource());
            if (successors == null || !adjacency.containsKey(edge.getTarget())) {
                log.debug("Dropping edge {} with unknown endpoint: {} -> {}",
                        edge.getId(), edge.getSource(), edge.getTarget());
                continue;
            }
            successors.add(edge.getTarget());
        }

        return adjacency;
    }
}
