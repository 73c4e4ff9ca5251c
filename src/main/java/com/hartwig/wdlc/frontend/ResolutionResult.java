package com.hartwig.wdlc.frontend;

import java.util.List;
import java.util.Optional;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ResolutionResult {
    Optional<ResolvedImport> resolved();

    List<String> errors();

    default boolean isResolved() {
        return resolved().isPresent();
    }

    static ResolutionResult found(String canonicalPath, String source) {
        return ImmutableResolutionResult.builder().resolved(ResolvedImport.of(canonicalPath, source)).build();
    }

    static ResolutionResult failed(String error) {
        return ImmutableResolutionResult.builder().addErrors(error).build();
    }
}
