package com.hartwig.wdlc.codegen;

import org.immutables.value.Value;

/**
 * A bunch of generated WDL source lines.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface WdlCodeSnippet {
    @Value.Parameter
    String value();

    static WdlCodeSnippet of(String value) {
        return ImmutableWdlCodeSnippet.of(value);
    }
}
