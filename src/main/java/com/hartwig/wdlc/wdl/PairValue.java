package com.hartwig.wdlc.wdl;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface PairValue extends WdlValue {
    @Value.Parameter
    WdlValue left();

    @Value.Parameter
    WdlValue right();

    @Override
    default String toWdlString() {
        return "(" + left().toWdlString() + ", " + right().toWdlString() + ")";
    }
}
