package com.hartwig.wdlc.wdl;

import java.util.List;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ArrayValue extends WdlValue {
    @Value.Parameter
    List<WdlValue> elements();

    @Override
    default String toWdlString() {
        return "[" + WdlValues.join(elements()) + "]";
    }
}
