package com.hartwig.wdlc.error;

/**
 * Base class of all errors that abort a compilation. None of them are recoverable: the caller must not continue
 * with code generation or upload once one has been thrown.
 */
public class WdlcException extends Exception {
    public WdlcException(final String message) {
        super(message);
    }

    public WdlcException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
