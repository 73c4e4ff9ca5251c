package com.hartwig.wdlc.ir;

import org.immutables.value.Value;

@Value.Immutable(singleton = true)
@Value.Style(jdkOnly = true)
public interface DefaultInstanceType extends InstanceType {
    @Override
    default <T> T accept(final Visitor<T> visitor) {
        return visitor.visitDefault(this);
    }

    static DefaultInstanceType instance() {
        return ImmutableDefaultInstanceType.of();
    }
}
