package com.hartwig.wdlc.config;

import java.util.List;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonDeserialize(as = ImmutableCompilerOptions.class)
@JsonSerialize(as = ImmutableCompilerOptions.class)
public interface CompilerOptions {
    /**
     * Directories searched for imports, after the directory of the main file.
     */
    List<String> importDirs();

    /**
     * Allow imports over http(s). The http resolver is the last one tried.
     */
    @Value.Default
    default boolean networkImports() {
        return true;
    }

    @Value.Default
    default int httpTimeoutSeconds() {
        return 30;
    }

    /**
     * File name used as the default value of {@code File} declarations in generated stubs.
     */
    @Value.Default
    default String placeholderFile() {
        return "dummy.txt";
    }

    @Value.Check
    default void check() {
        if (httpTimeoutSeconds() <= 0) {
            throw new IllegalArgumentException("httpTimeoutSeconds should be positive, but was " + httpTimeoutSeconds());
        }
    }

    static CompilerOptions defaults() {
        return builder().build();
    }

    static ImmutableCompilerOptions.Builder builder() {
        return ImmutableCompilerOptions.builder();
    }
}
