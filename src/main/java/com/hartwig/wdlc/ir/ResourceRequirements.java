package com.hartwig.wdlc.ir;

import java.util.Optional;

import org.immutables.value.Value;

/**
 * Resource requirements of a task as seen by the upstream IR builder. A requirement is either absent, a constant, or
 * an expression that can only be evaluated at runtime.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ResourceRequirements {
    Optional<String> instanceClass();

    Optional<Integer> memoryMB();

    Optional<Integer> diskGB();

    Optional<Integer> cpu();

    @Value.Default
    default boolean hasRuntimeExpressions() {
        return false;
    }

    static ImmutableResourceRequirements.Builder builder() {
        return ImmutableResourceRequirements.builder();
    }
}
