package com.hartwig.wdlc.ir;

/**
 * A task may run inside a docker image. There are three options: no image, an image that is downloaded from a
 * network registry, or an image stored as a platform asset.
 */
public interface DockerImage {
    <T> T accept(Visitor<T> visitor);

    interface Visitor<T> {
        T visitNone(DockerImageNone image);

        T visitNetwork(DockerImageNetwork image);

        T visitPlatformAsset(DockerImagePlatformAsset image);
    }
}
