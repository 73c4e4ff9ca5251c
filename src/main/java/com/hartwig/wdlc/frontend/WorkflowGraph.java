package com.hartwig.wdlc.frontend;

import java.util.List;

import org.immutables.value.Value;

/**
 * Analyzed body of a workflow. Scatter and conditional blocks carry their own inner graph.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface WorkflowGraph {
    @Value.Parameter
    List<GraphNode> nodes();

    static WorkflowGraph of(List<GraphNode> nodes) {
        return ImmutableWorkflowGraph.of(nodes);
    }
}
