package com.hartwig.wdlc.wdl;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface MapType extends WdlType {
    @Value.Parameter
    WdlType keyType();

    @Value.Parameter
    WdlType valueType();

    @Override
    default <T> T accept(final WdlTypeVisitor<T> visitor) {
        return visitor.visitMap(this);
    }

    @Override
    default String typeName() {
        return "Map[" + keyType().typeName() + "," + valueType().typeName() + "]";
    }

    static MapType of(WdlType keyType, WdlType valueType) {
        return ImmutableMapType.of(keyType, valueType);
    }
}
