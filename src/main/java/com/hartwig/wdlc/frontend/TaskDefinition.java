package com.hartwig.wdlc.frontend;

import java.util.Map;

import com.hartwig.wdlc.wdl.WdlType;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface TaskDefinition extends SourceCallable {
    @Override
    String name();

    @Override
    Map<String, WdlType> inputs();

    @Override
    Map<String, WdlType> outputs();

    /**
     * Runtime section, attribute name to the unevaluated expression text.
     */
    Map<String, String> runtimeAttributes();

    /**
     * Source file the task was declared in. The task itself can be recovered from it with the structural scanner.
     */
    String sourceCode();

    @Override
    default <T> T accept(final Visitor<T> visitor) {
        return visitor.visitTask(this);
    }

    static ImmutableTaskDefinition.Builder builder() {
        return ImmutableTaskDefinition.builder();
    }
}
