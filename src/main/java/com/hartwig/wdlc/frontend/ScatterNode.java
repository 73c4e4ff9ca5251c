package com.hartwig.wdlc.frontend;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ScatterNode extends GraphNode {
    @Value.Parameter
    WorkflowGraph innerGraph();

    @Override
    default <T> T accept(final Visitor<T> visitor) {
        return visitor.visitScatter(this);
    }

    static ScatterNode of(WorkflowGraph innerGraph) {
        return ImmutableScatterNode.of(innerGraph);
    }
}
