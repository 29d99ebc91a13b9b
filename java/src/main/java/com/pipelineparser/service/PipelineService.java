package com.pipelineparser.service;

import com.pipelineparser.exception.PipelineProcessingException;
import com.pipelineparser.graph.AcyclicityChecker;
import com.pipelineparser.graph.GraphBuilder;
import com.pipelineparser.model.dto.EdgeData;
import com.pipelineparser.model.dto.NodeData;
import com.pipelineparser.model.dto.PipelineParseResponse;
import com.pipelineparser.model.dto.PipelineRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Service for pipeline analysis.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineService {

    private final GraphBuilder graphBuilder;
    private final AcyclicityChecker acyclicityChecker;

    /**
     * Count the nodes and edges of a pipeline and check that it is a DAG.
     *
     * @param request Pipeline submitted by the editor
     * @return Node count, raw edge count and DAG verdict
     */
    public Mono<PipelineParseResponse> parsePipeline(PipelineRequest request) {
        return Mono.fromCallable(() -> analyze(request))
                .onErrorMap(ex -> !(ex instanceof PipelineProcessingException), ex -> {
                    log.error("Error processing pipeline", ex);
                    return new PipelineProcessingException(ex);
                });
    }

    private PipelineParseResponse analyze(PipelineRequest request) {
        List<NodeData> nodes = request.getNodes();
        List<EdgeData> edges = request.getEdges();
        logPipeline(nodes, edges);

        Map<String, List<String>> adjacency = graphBuilder.build(nodes, edges);
        boolean dag = acyclicityChecker.isAcyclic(nodes, adjacency);

        PipelineParseResponse response = PipelineParseResponse.builder()
                .numNodes(nodes.size())
                .numEdges(edges.size())
                .dag(dag)
                .build();
        log.info("Pipeline result: nodes={}, edges={}, isDag={}",
                response.getNumNodes(), response.getNumEdges(), response.isDag());
        return response;
    }

    private void logPipeline(List<NodeData> nodes, List<EdgeData> edges) {
        log.info("Incoming pipeline: nodes={}, edges={}", nodes.size(), edges.size());
        if (!log.isDebugEnabled()) {
            return;
        }
        for (int i = 0; i < nodes.size(); i++) {
            NodeData node = nodes.get(i);
            log.debug("  node {}: id={}, type={}, data={}", i + 1, node.getId(), node.getType(), node.getData());
        }
        for (int i = 0; i < edges.size(); i++) {
            EdgeData edge = edges.get(i);
            log.debug("  edge {}: {} -> {} (sourceHandle={}, targetHandle={})",
                    i + 1, edge.getSource(), edge.getTarget(), edge.getSourceHandle(), edge.getTargetHandle());
        }
    }
}
