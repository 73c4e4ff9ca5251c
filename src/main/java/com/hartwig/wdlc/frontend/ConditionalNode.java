package com.hartwig.wdlc.frontend;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ConditionalNode extends GraphNode {
    @Value.Parameter
    WorkflowGraph innerGraph();

    @Override
    default <T> T accept(final Visitor<T> visitor) {
        return visitor.visitConditional(this);
    }

    static ConditionalNode of(WorkflowGraph innerGraph) {
        return ImmutableConditionalNode.of(innerGraph);
    }
}
