package com.hartwig.wdlc.wdl;

import java.util.Map;
import java.util.stream.Collectors;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface MapValue extends WdlValue {
    @Value.Parameter
    Map<WdlValue, WdlValue> entries();

    @Override
    default String toWdlString() {
        return entries().entrySet()
                .stream()
                .map(entry -> entry.getKey().toWdlString() + ": " + entry.getValue().toWdlString())
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
