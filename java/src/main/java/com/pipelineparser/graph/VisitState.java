package com.pipelineparser.graph;

/**
 * Node coloring used by depth-first cycle detection.
 */
enum VisitState {
    UNVISITED,
    IN_PROGRESS,
    DONE
}
