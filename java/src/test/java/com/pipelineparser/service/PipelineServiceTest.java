package com.pipelineparser.service;

import com.pipelineparser.exception.PipelineProcessingException;
import com.pipelineparser.graph.AcyclicityChecker;
import com.pipelineparser.graph.GraphBuilder;
import com.pipelineparser.model.dto.EdgeData;
import com.pipelineparser.model.dto.NodeData;
import com.pipelineparser.model.dto.PipelineParseResponse;
import com.pipelineparser.model.dto.PipelineRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * Unit tests for PipelineService.
 */
@ExtendWith(MockitoExtension.class)
class PipelineServiceTest {

    @Mock
    private GraphBuilder graphBuilder;

    @Mock
    private AcyclicityChecker acyclicityChecker;

    @InjectMocks
    private PipelineService pipelineService;

    private PipelineRequest request;

    @BeforeEach
    void setUp() {
        request = PipelineRequest.builder()
                .nodes(List.of(node("input-1"), node("llm-1"), node("output-1")))
                .edges(List.of(
                        edge("input-1", "llm-1"),
                        edge("llm-1", "output-1"),
                        edge("llm-1", "missing-1")))
                .build();
    }

    @Test
    void parsePipeline_Success() {
        Map<String, List<String>> adjacency = Map.of(
                "input-1", List.of("llm-1"),
                "llm-1", List.of("output-1"),
                "output-1", List.of());
        when(graphBuilder.build(request.getNodes(), request.getEdges())).thenReturn(adjacency);
        when(acyclicityChecker.isAcyclic(request.getNodes(), adjacency)).thenReturn(true);

        Mono<PipelineParseResponse> result = pipelineService.parsePipeline(request);

        StepVerifier.create(result)
                .expectNextMatches(response ->
                        response.getNumNodes() == 3 &&
                        response.getNumEdges() == 3 &&
                        response.isDag())
                .verifyComplete();
    }

    @Test
    void parsePipeline_InternalFailure() {
        when(graphBuilder.build(any(), any())).thenThrow(new IllegalStateException("adjacency corrupted"));

        Mono<PipelineParseResponse> result = pipelineService.parsePipeline(request);

        StepVerifier.create(result)
                .expectErrorMatches(error ->
                        error instanceof PipelineProcessingException &&
                        error.getMessage().equals("Error processing pipeline: adjacency corrupted") &&
                        error.getCause() instanceof IllegalStateException)
                .verify();
    }

    @Test
    void parsePipeline_CyclicPipeline() {
        PipelineService service = new PipelineService(new GraphBuilder(), new AcyclicityChecker());
        PipelineRequest cyclic = PipelineRequest.builder()
                .nodes(List.of(node("a"), node("b"), node("c")))
                .edges(List.of(edge("a", "b"), edge("b", "c"), edge("c", "a")))
                .build();

        StepVerifier.create(service.parsePipeline(cyclic))
                .expectNext(PipelineParseResponse.builder().numNodes(3).numEdges(3).dag(false).build())
                .verifyComplete();
    }

    @Test
    void parsePipeline_DanglingEdgeStillCounted() {
        PipelineService service = new PipelineService(new GraphBuilder(), new AcyclicityChecker());
        PipelineRequest dangling = PipelineRequest.builder()
                .nodes(List.of(node("a"), node("b")))
                .edges(List.of(edge("a", "z")))
                .build();

        StepVerifier.create(service.parsePipeline(dangling))
                .expectNext(PipelineParseResponse.builder().numNodes(2).numEdges(1).dag(true).build())
                .verifyComplete();
    }

    @Test
    void parsePipeline_EmptyPipeline() {
        PipelineService service = new PipelineService(new GraphBuilder(), new AcyclicityChecker());
        PipelineRequest empty = PipelineRequest.builder()
                .nodes(List.of())
                .edges(List.of())
                .build();

        StepVerifier.create(service.parsePipeline(empty))
                .expectNext(PipelineParseResponse.builder().numNodes(0).numEdges(0).dag(true).build())
                .verifyComplete();
    }

    private static NodeData node(String id) {
        return NodeData.builder()
                .id(id)
                .type(id.substring(0, id.indexOf('-') > 0 ? id.indexOf('-') : id.length()))
                .position(Map.of("x", 100.0, "y", 200.0))
                .data(Map.of("label", id))
                .build();
    }

    private static EdgeData edge(String source, String target) {
        return EdgeData.builder()
                .id(source + "->" + target)
                .source(source)
                .target(target)
                .sourceHandle(source + "-output")
                .targetHandle(target + "-input")
                .build();
    }
}
