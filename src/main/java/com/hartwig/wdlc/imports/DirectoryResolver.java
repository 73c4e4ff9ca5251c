package com.hartwig.wdlc.imports;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

import com.hartwig.wdlc.frontend.ImportResolver;
import com.hartwig.wdlc.frontend.ResolutionResult;

/**
 * Resolves imports relative to a local directory.
 */
public class DirectoryResolver implements ImportResolver {
    private final Path directory;

    public DirectoryResolver(final Path directory) {
        this.directory = directory.toAbsolutePath().normalize();
    }

    @Override
    public String name() {
        return "directory " + directory;
    }

    @Override
    public ResolutionResult resolve(String path) {
        if (HttpResolver.isUrl(path)) {
            return ResolutionResult.failed(String.format("'%s' is not a local path", path));
        }
        Path candidate;
        try {
            candidate = directory.resolve(path).normalize();
        } catch (InvalidPathException e) {
            return ResolutionResult.failed(String.format("'%s' is not a valid path: %s", path, e.getMessage()));
        }
        if (!Files.isRegularFile(candidate)) {
            return ResolutionResult.failed(String.format("'%s' not found in %s", path, directory));
        }
        try {
            return ResolutionResult.found(candidate.toString(), Files.readString(candidate));
        } catch (IOException e) {
            return ResolutionResult.failed(String.format("Could not read '%s': %s", candidate, e.getMessage()));
        }
    }
}
