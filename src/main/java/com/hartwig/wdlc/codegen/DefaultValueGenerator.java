package com.hartwig.wdlc.codegen;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.hartwig.wdlc.wdl.ArrayType;
import com.hartwig.wdlc.wdl.MapType;
import com.hartwig.wdlc.wdl.ObjectType;
import com.hartwig.wdlc.wdl.OptionalType;
import com.hartwig.wdlc.wdl.PairType;
import com.hartwig.wdlc.wdl.StructType;
import com.hartwig.wdlc.wdl.WdlType;
import com.hartwig.wdlc.wdl.WdlTypeVisitor;
import com.hartwig.wdlc.wdl.WdlValue;
import com.hartwig.wdlc.wdl.WdlValues;

/**
 * Builds a value for a type, so that declarations in generated stubs type check. Empty when the type, or a type nested
 * in it, has no default; the offending type is kept in {@link #unsupported()}.
 */
class DefaultValueGenerator implements WdlTypeVisitor<Optional<WdlValue>> {
    private final String placeholderFile;
    private WdlType unsupported;

    DefaultValueGenerator(final String placeholderFile) {
        this.placeholderFile = placeholderFile;
    }

    WdlType unsupported() {
        return unsupported;
    }

    @Override
    public Optional<WdlValue> visitBoolean() {
        return Optional.of(WdlValues.bool(true));
    }

    @Override
    public Optional<WdlValue> visitInt() {
        return Optional.of(WdlValues.integer(0));
    }

    @Override
    public Optional<WdlValue> visitFloat() {
        return Optional.of(WdlValues.floatingPoint(0.0));
    }

    @Override
    public Optional<WdlValue> visitString() {
        return Optional.of(WdlValues.string(""));
    }

    @Override
    public Optional<WdlValue> visitFile() {
        return Optional.of(WdlValues.file(placeholderFile));
    }

    // An explicit null would not survive pretty printing, so optionals get the default of the inner type.
    @Override
    public Optional<WdlValue> visitOptional(final OptionalType type) {
        return type.inner().accept(this);
    }

    @Override
    public Optional<WdlValue> visitArray(final ArrayType type) {
        if (!type.nonEmpty()) {
            return Optional.of(WdlValues.array(List.of()));
        }
        return type.element().accept(this).map(element -> WdlValues.array(List.of(element)));
    }

    // An empty map literal does not type check, it needs one key-value pair.
    @Override
    public Optional<WdlValue> visitMap(final MapType type) {
        var key = type.keyType().accept(this);
        var value = type.valueType().accept(this);
        if (key.isEmpty() || value.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(WdlValues.map(Map.of(key.get(), value.get())));
    }

    @Override
    public Optional<WdlValue> visitPair(final PairType type) {
        var left = type.left().accept(this);
        var right = type.right().accept(this);
        if (left.isEmpty() || right.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(WdlValues.pair(left.get(), right.get()));
    }

    @Override
    public Optional<WdlValue> visitStruct(final StructType type) {
        Map<String, WdlValue> fields = new LinkedHashMap<>();
        for (Map.Entry<String, WdlType> field : type.fields().entrySet()) {
            var value = field.getValue().accept(this);
            if (value.isEmpty()) {
                return Optional.empty();
            }
            fields.put(field.getKey(), value.get());
        }
        return Optional.of(WdlValues.object(fields));
    }

    @Override
    public Optional<WdlValue> visitObject(final ObjectType type) {
        unsupported = type;
        return Optional.empty();
    }
}
