package com.hartwig.wdlc.frontend;

import java.util.List;
import java.util.Optional;

import org.immutables.value.Value;

/**
 * Either the bundle of an accepted source, or the list of errors that made the front-end reject it.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface AnalysisResult {
    Optional<SourceBundle> bundle();

    List<String> errors();

    default boolean isValid() {
        return bundle().isPresent();
    }

    @Value.Check
    default void check() {
        if (bundle().isPresent() == !errors().isEmpty()) {
            throw new IllegalStateException("An analysis result holds either a bundle or errors");
        }
    }

    static AnalysisResult valid(SourceBundle bundle) {
        return ImmutableAnalysisResult.builder().bundle(bundle).build();
    }

    static AnalysisResult invalid(List<String> errors) {
        return ImmutableAnalysisResult.builder().errors(errors).build();
    }
}
