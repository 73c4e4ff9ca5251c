package com.hartwig.wdlc.ir;

import java.util.List;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface Workflow extends Callable {
    @Override
    String name();

    @Override
    List<CVar> inputs();

    @Override
    List<CVar> outputs();

    /**
     * Names of the callables this workflow runs, in the order the calls appear in the source.
     */
    List<String> stages();

    @Override
    default <T> T accept(final Visitor<T> visitor) {
        return visitor.visitWorkflow(this);
    }

    @Value.Check
    default void check() {
        Callables.checkNames(this);
    }

    static ImmutableWorkflow.Builder builder() {
        return ImmutableWorkflow.builder();
    }
}
