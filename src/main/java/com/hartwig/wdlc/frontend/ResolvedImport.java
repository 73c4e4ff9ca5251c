package com.hartwig.wdlc.frontend;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ResolvedImport {
    @Value.Parameter
    String canonicalPath();

    @Value.Parameter
    String source();

    static ResolvedImport of(String canonicalPath, String source) {
        return ImmutableResolvedImport.of(canonicalPath, source);
    }
}
