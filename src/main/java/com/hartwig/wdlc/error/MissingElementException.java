package com.hartwig.wdlc.error;

public class MissingElementException extends WdlcException {
    public MissingElementException(final String message) {
        super(message);
    }
}
