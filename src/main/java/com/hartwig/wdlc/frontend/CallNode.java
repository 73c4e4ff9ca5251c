package com.hartwig.wdlc.frontend;

import java.util.Optional;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface CallNode extends GraphNode {
    enum CalleeKind {
        TASK,
        WORKFLOW
    }

    /**
     * Name of the call in its workflow, possibly namespace qualified, e.g. {@code lib.Multiply}.
     */
    String localName();

    CalleeKind calleeKind();

    /**
     * Line of the call statement in the workflow source, 1-based.
     */
    Optional<Integer> sourceLine();

    @Override
    default <T> T accept(final Visitor<T> visitor) {
        return visitor.visitCall(this);
    }

    static ImmutableCallNode.Builder builder() {
        return ImmutableCallNode.builder();
    }
}
