package com.hartwig.wdlc.wdl;

import java.util.Map;

import com.google.common.base.Preconditions;

import org.immutables.value.Value;

/**
 * A named record type, declared with {@code struct NAME { ... }}. Fields keep their declaration order.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface StructType extends WdlType {
    String name();

    Map<String, WdlType> fields();

    @Override
    default <T> T accept(final WdlTypeVisitor<T> visitor) {
        return visitor.visitStruct(this);
    }

    @Override
    default String typeName() {
        return name();
    }

    @Value.Check
    default void check() {
        Preconditions.checkArgument(!name().isEmpty(), "Struct name must not be empty");
    }

    static ImmutableStructType.Builder builder() {
        return ImmutableStructType.builder();
    }
}
