package com.hartwig.wdlc.error;

import com.hartwig.wdlc.wdl.WdlType;

public class UnsupportedTypeException extends WdlcException {
    private final WdlType type;

    public UnsupportedTypeException(final WdlType type) {
        super(String.format("No default value can be generated for type '%s'", type.typeName()));
        this.type = type;
    }

    public WdlType getType() {
        return type;
    }
}
