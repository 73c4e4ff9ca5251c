package com.hartwig.wdlc.codegen;

import java.util.List;
import java.util.Map;

import com.hartwig.wdlc.wdl.StructType;

/**
 * Orders type alias names so that every struct definition comes after the structs it refers to.
 */
public interface TypeAliasOrdering {
    List<String> order(Map<String, StructType> typeAliases);
}
