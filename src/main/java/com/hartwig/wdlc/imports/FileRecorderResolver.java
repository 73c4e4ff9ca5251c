package com.hartwig.wdlc.imports;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import com.hartwig.wdlc.frontend.ImportResolver;
import com.hartwig.wdlc.frontend.ResolutionResult;

/**
 * Wraps a resolver, and writes down every file it resolves in the session, together with the adjuncts next to it.
 */
class FileRecorderResolver implements ImportResolver {
    private final ResolutionSession session;
    private final AdjunctFinder adjunctFinder;
    private final Path rootDir;
    private final ImportResolver lower;

    FileRecorderResolver(final ResolutionSession session, final AdjunctFinder adjunctFinder, final Path rootDir,
            final ImportResolver lower) {
        this.session = session;
        this.adjunctFinder = adjunctFinder;
        this.rootDir = rootDir;
        this.lower = lower;
    }

    @Override
    public String name() {
        return lower.name();
    }

    @Override
    public ResolutionResult resolve(String path) {
        var result = lower.resolve(path);
        if (result.resolved().isEmpty()) {
            return result;
        }
        var resolved = result.resolved().get();
        Map<String, List<AdjunctFile>> adjuncts = Map.of();
        // TODO: look for adjuncts of remote imports as well
        if (!HttpResolver.isUrl(resolved.canonicalPath())) {
            var localPath = Path.of(resolved.canonicalPath());
            if (!localPath.isAbsolute()) {
                localPath = rootDir.resolve(localPath);
            }
            try {
                adjuncts = adjunctFinder.findAdjuncts(localPath);
            } catch (UncheckedIOException e) {
                return ResolutionResult.failed(String.format("Could not read adjuncts of '%s': %s", localPath, e.getMessage()));
            }
        }
        if (!session.record(resolved.canonicalPath(), resolved.source())) {
            return ResolutionResult.failed(String.format("'%s' has been imported twice, with different content",
                    resolved.canonicalPath()));
        }
        session.addAdjuncts(adjuncts);
        return result;
    }
}
