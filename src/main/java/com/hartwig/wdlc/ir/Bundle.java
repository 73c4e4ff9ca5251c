package com.hartwig.wdlc.ir;

import java.util.Map;
import java.util.Optional;

import org.immutables.value.Value;

/**
 * The compiled contents of one source file: the primary callable, if any, and every callable by name.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface Bundle {
    Optional<Callable> primaryCallable();

    Map<String, Callable> allCallables();

    @Value.Check
    default void check() {
        allCallables().forEach((name, callable) -> {
            if (!name.equals(callable.name())) {
                throw new IllegalArgumentException(String.format("Callable '%s' is registered under name '%s'",
                        callable.name(),
                        name));
            }
        });
    }

    static ImmutableBundle.Builder builder() {
        return ImmutableBundle.builder();
    }
}
