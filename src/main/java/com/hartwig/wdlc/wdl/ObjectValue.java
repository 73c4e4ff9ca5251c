package com.hartwig.wdlc.wdl;

import java.util.Map;
import java.util.stream.Collectors;

import org.immutables.value.Value;

/**
 * Field-wise value of a struct, rendered as an {@code object} literal.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ObjectValue extends WdlValue {
    @Value.Parameter
    Map<String, WdlValue> fields();

    @Override
    default String toWdlString() {
        return fields().entrySet()
                .stream()
                .map(entry -> entry.getKey() + ": " + entry.getValue().toWdlString())
                .collect(Collectors.joining(", ", "object {", "}"));
    }
}
