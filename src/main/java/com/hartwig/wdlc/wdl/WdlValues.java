package com.hartwig.wdlc.wdl;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public final class WdlValues {

    private WdlValues() {
    }

    public static WdlValue bool(boolean value) {
        return ImmutablePrimitiveValue.of(PrimitiveType.BOOLEAN, Boolean.toString(value));
    }

    public static WdlValue integer(long value) {
        return ImmutablePrimitiveValue.of(PrimitiveType.INT, Long.toString(value));
    }

    public static WdlValue floatingPoint(double value) {
        return ImmutablePrimitiveValue.of(PrimitiveType.FLOAT, Double.toString(value));
    }

    public static WdlValue string(String value) {
        return ImmutablePrimitiveValue.of(PrimitiveType.STRING, quote(value));
    }

    public static WdlValue file(String path) {
        return ImmutablePrimitiveValue.of(PrimitiveType.FILE, quote(path));
    }

    public static WdlValue array(List<WdlValue> elements) {
        return ImmutableArrayValue.of(elements);
    }

    public static WdlValue map(Map<WdlValue, WdlValue> entries) {
        return ImmutableMapValue.of(entries);
    }

    public static WdlValue pair(WdlValue left, WdlValue right) {
        return ImmutablePairValue.of(left, right);
    }

    public static WdlValue object(Map<String, WdlValue> fields) {
        return ImmutableObjectValue.of(fields);
    }

    static String join(List<WdlValue> values) {
        return values.stream().map(WdlValue::toWdlString).collect(Collectors.joining(", "));
    }

    private static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
