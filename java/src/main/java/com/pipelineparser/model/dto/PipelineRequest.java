package com.pipelineparser.model.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO for pipeline parsing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineRequest {

    @NotNull(message = "Nodes are required")
    private List<@NotNull(message = "Node must not be null") @Valid NodeData> nodes;

    @NotNull(message = "Edges are required")
    private List<@NotNull(message = "Edge must not be null") @Valid EdgeData> edges;
}
