package com.hartwig.wdlc.ir;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface DockerImagePlatformAsset extends DockerImage {
    /**
     * Reference to the record holding the pre-staged image.
     */
    @Value.Parameter
    String asset();

    @Override
    default <T> T accept(final Visitor<T> visitor) {
        return visitor.visitPlatformAsset(this);
    }

    static DockerImagePlatformAsset of(String asset) {
        return ImmutableDockerImagePlatformAsset.of(asset);
    }
}
