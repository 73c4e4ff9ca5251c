package com.hartwig.wdlc.frontend;

import java.util.Map;

import com.hartwig.wdlc.wdl.WdlType;

/**
 * A task or workflow as produced by the front-end, before it is compiled into the IR.
 */
public interface SourceCallable {
    String name();

    Map<String, WdlType> inputs();

    Map<String, WdlType> outputs();

    <T> T accept(Visitor<T> visitor);

    interface Visitor<T> {
        T visitTask(TaskDefinition task);

        T visitWorkflow(WorkflowDefinition workflow);
    }
}
