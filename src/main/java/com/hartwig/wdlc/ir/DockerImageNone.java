package com.hartwig.wdlc.ir;

import org.immutables.value.Value;

@Value.Immutable(singleton = true)
@Value.Style(jdkOnly = true)
public interface DockerImageNone extends DockerImage {
    @Override
    default <T> T accept(final Visitor<T> visitor) {
        return visitor.visitNone(this);
    }

    static DockerImageNone instance() {
        return ImmutableDockerImageNone.of();
    }
}
