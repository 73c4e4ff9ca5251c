package com.hartwig.wdlc.ir;

import org.immutables.value.Value;

/**
 * The image is pulled at runtime, its name comes from the {@code docker} runtime attribute of the task.
 */
@Value.Immutable(singleton = true)
@Value.Style(jdkOnly = true)
public interface DockerImageNetwork extends DockerImage {
    @Override
    default <T> T accept(final Visitor<T> visitor) {
        return visitor.visitNetwork(this);
    }

    static DockerImageNetwork instance() {
        return ImmutableDockerImageNetwork.of();
    }
}
