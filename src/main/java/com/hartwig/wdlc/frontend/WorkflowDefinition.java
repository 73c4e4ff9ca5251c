package com.hartwig.wdlc.frontend;

import java.util.Map;

import com.hartwig.wdlc.wdl.WdlType;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface WorkflowDefinition extends SourceCallable {
    @Override
    String name();

    @Override
    Map<String, WdlType> inputs();

    @Override
    Map<String, WdlType> outputs();

    WorkflowGraph graph();

    @Override
    default <T> T accept(final Visitor<T> visitor) {
        return visitor.visitWorkflow(this);
    }

    static ImmutableWorkflowDefinition.Builder builder() {
        return ImmutableWorkflowDefinition.builder();
    }
}
