package com.hartwig.wdlc.wdl;

import org.immutables.value.Value;

/**
 * The untyped {@code Object} of older WDL versions.
 */
@Value.Immutable(singleton = true)
@Value.Style(jdkOnly = true)
public interface ObjectType extends WdlType {
    @Override
    default <T> T accept(final WdlTypeVisitor<T> visitor) {
        return visitor.visitObject(this);
    }

    @Override
    default String typeName() {
        return "Object";
    }

    static ObjectType instance() {
        return ImmutableObjectType.of();
    }
}
