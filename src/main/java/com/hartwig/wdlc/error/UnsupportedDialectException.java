package com.hartwig.wdlc.error;

public class UnsupportedDialectException extends WdlcException {
    public UnsupportedDialectException(final String message) {
        super(message);
    }
}
