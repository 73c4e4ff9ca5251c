package com.hartwig.wdlc.wdl;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ArrayType extends WdlType {
    @Value.Parameter
    WdlType element();

    /**
     * True for {@code Array[T]+}, arrays that must hold at least one element.
     */
    @Value.Parameter
    boolean nonEmpty();

    @Override
    default <T> T accept(final WdlTypeVisitor<T> visitor) {
        return visitor.visitArray(this);
    }

    @Override
    default String typeName() {
        return "Array[" + element().typeName() + "]" + (nonEmpty() ? "+" : "");
    }

    static ArrayType ofMaybeEmpty(WdlType element) {
        return ImmutableArrayType.of(element, false);
    }

    static ArrayType ofNonEmpty(WdlType element) {
        return ImmutableArrayType.of(element, true);
    }
}
