package com.hartwig.wdlc.wdl;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface PairType extends WdlType {
    @Value.Parameter
    WdlType left();

    @Value.Parameter
    WdlType right();

    @Override
    default <T> T accept(final WdlTypeVisitor<T> visitor) {
        return visitor.visitPair(this);
    }

    @Override
    default String typeName() {
        return "Pair[" + left().typeName() + "," + right().typeName() + "]";
    }

    static PairType of(WdlType left, WdlType right) {
        return ImmutablePairType.of(left, right);
    }
}
