package com.hartwig.wdlc.ir;

import org.immutables.value.Value;

@Value.Immutable(singleton = true)
@Value.Style(jdkOnly = true)
public interface RuntimeInstanceType extends InstanceType {
    @Override
    default <T> T accept(final Visitor<T> visitor) {
        return visitor.visitRuntime(this);
    }

    static RuntimeInstanceType instance() {
        return ImmutableRuntimeInstanceType.of();
    }
}
