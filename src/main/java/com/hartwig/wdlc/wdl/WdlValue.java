package com.hartwig.wdlc.wdl;

/**
 * A constant WDL value, as produced when synthesizing default values for declarations.
 */
public interface WdlValue {
    /**
     * Renders the value as a WDL literal.
     */
    String toWdlString();
}
