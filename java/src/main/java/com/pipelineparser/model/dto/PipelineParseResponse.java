package com.pipelineparser.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for pipeline parsing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineParseResponse {

    @JsonProperty("num_nodes")
    private int numNodes;

    @JsonProperty("num_edges")
    private int numEdges;

    @JsonProperty("is_dag")
    private boolean dag;
}
