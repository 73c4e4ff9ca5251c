package com.hartwig.wdlc.wdl;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface PrimitiveValue extends WdlValue {
    @Value.Parameter
    PrimitiveType type();

    /**
     * The literal, already quoted for strings and files.
     */
    @Value.Parameter
    String literal();

    @Override
    default String toWdlString() {
        return literal();
    }
}
