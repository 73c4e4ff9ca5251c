package com.hartwig.wdlc.frontend;

/**
 * Locates the source of an import statement. The front-end tries its resolvers in order, until one succeeds.
 */
public interface ImportResolver {
    String name();

    ResolutionResult resolve(String path);
}
