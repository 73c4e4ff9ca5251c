package com.hartwig.wdlc.error;

/**
 * A broken assumption inside the compiler, e.g. a front-end graph without source locations. Not caused by user input.
 */
public class InternalConsistencyFault extends IllegalStateException {
    public InternalConsistencyFault(final String message) {
        super(message);
    }
}
