package com.hartwig.wdlc.wdl;

/**
 * Type of a WDL declaration. The set of types is closed, consumers handle every variant through {@link WdlTypeVisitor}.
 */
public interface WdlType {
    <T> T accept(WdlTypeVisitor<T> visitor);

    /**
     * Name of the type as written in WDL source, e.g. {@code Array[File]+} or {@code Map[String,Int]}.
     */
    String typeName();
}
