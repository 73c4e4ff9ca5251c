package com.hartwig.wdlc.frontend;

import java.util.Map;
import java.util.Optional;

import com.hartwig.wdlc.wdl.StructType;

import org.immutables.value.Value;

/**
 * Result of analyzing one source file: the primary callable, all callables and the type aliases (structs).
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface SourceBundle {
    Optional<SourceCallable> primaryCallable();

    Map<String, SourceCallable> allCallables();

    Map<String, StructType> typeAliases();

    static ImmutableSourceBundle.Builder builder() {
        return ImmutableSourceBundle.builder();
    }
}
