package com.hartwig.wdlc.wdl;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface OptionalType extends WdlType {
    @Value.Parameter
    WdlType inner();

    @Override
    default <T> T accept(final WdlTypeVisitor<T> visitor) {
        return visitor.visitOptional(this);
    }

    @Override
    default String typeName() {
        return inner().typeName() + "?";
    }

    static OptionalType of(WdlType inner) {
        return ImmutableOptionalType.of(inner);
    }
}
