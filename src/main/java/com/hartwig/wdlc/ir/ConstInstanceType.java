package com.hartwig.wdlc.ir;

import java.util.Optional;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ConstInstanceType extends InstanceType {
    /**
     * Platform instance class, e.g. {@code mem1_ssd1_x4}.
     */
    Optional<String> instanceClass();

    Optional<Integer> memoryMB();

    Optional<Integer> diskGB();

    Optional<Integer> cpu();

    @Override
    default <T> T accept(final Visitor<T> visitor) {
        return visitor.visitConst(this);
    }

    static ImmutableConstInstanceType.Builder builder() {
        return ImmutableConstInstanceType.builder();
    }
}
