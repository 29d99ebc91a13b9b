package com.pipelineparser.model.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A directed connection between two node handles.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EdgeData {

    @NotNull(message = "Edge ID is required")
    private String id;

    @NotNull(message = "Source node ID is required")
    private String source;

    @NotNull(message = "Target node ID is required")
    private String target;

    private String sourceHandle;

    private String targetHandle;
}
