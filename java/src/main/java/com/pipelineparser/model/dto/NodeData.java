package com.pipelineparser.model.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * A node placed on the pipeline editor canvas.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeData {

    @NotNull(message = "Node ID is required")
    private String id;

    @NotNull(message = "Node type is required")
    private String type;

    @NotNull(message = "Node position is required")
    private Map<String, @NotNull(message = "Position coordinate must not be null") Double> position;

    @Builder.Default
    private Map<String, Object> data = new HashMap<>();
}
