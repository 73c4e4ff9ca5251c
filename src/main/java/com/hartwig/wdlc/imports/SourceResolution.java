package com.hartwig.wdlc.imports;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import com.hartwig.wdlc.config.CompilerOptions;
import com.hartwig.wdlc.error.FrontEndRejectionException;
import com.hartwig.wdlc.error.UnsupportedDialectException;
import com.hartwig.wdlc.error.WdlcException;
import com.hartwig.wdlc.frontend.ImportResolver;
import com.hartwig.wdlc.frontend.LanguageFrontEnd;
import com.hartwig.wdlc.frontend.LanguageFrontEnds;
import com.hartwig.wdlc.frontend.SourceBundle;
import com.hartwig.wdlc.wdl.Dialect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a main source file and all files it imports, directly or indirectly, and analyzes each of them.
 * <p>
 * Imports are located by a chain of resolvers: the directory of the main file, the import directories, and finally
 * http. Every resolver is wrapped so that each file it reads ends up in the {@link ResolutionSession}. Analyzing an
 * imported file can reveal further imports, so files are analyzed until a round finds nothing new.
 * <p>
 * The dialect is detected once, from the main file. All imports are assumed to be written in the same dialect.
 */
public class SourceResolution {
    private static final Logger LOGGER = LoggerFactory.getLogger(SourceResolution.class);

    private final LanguageFrontEnds frontEnds;
    private final AdjunctFinder adjunctFinder;
    private final CompilerOptions options;
    private final ImportResolver networkResolver;

    public SourceResolution(final LanguageFrontEnds frontEnds, final CompilerOptions options) {
        this(frontEnds, new ReadmeAdjunctFinder(), options, new HttpResolver(Duration.ofSeconds(options.httpTimeoutSeconds())));
    }

    public SourceResolution(final LanguageFrontEnds frontEnds, final AdjunctFinder adjunctFinder, final CompilerOptions options,
            final ImportResolver networkResolver) {
        this.frontEnds = frontEnds;
        this.adjunctFinder = adjunctFinder;
        this.options = options;
        this.networkResolver = networkResolver;
    }

    public ResolvedProject resolve(Path mainFile) throws WdlcException, IOException {
        return resolve(mainFile, options.importDirs().stream().map(Path::of).collect(Collectors.toList()));
    }

    public ResolvedProject resolve(Path mainFile, List<Path> importDirs) throws WdlcException, IOException {
        var absPath = mainFile.toAbsolutePath().normalize();
        var rootDir = absPath.getParent();
        var mainSource = Files.readString(absPath);
        LOGGER.info("Resolving imports of '{}'", absPath);

        var session = new ResolutionSession();
        var resolvers = resolverChain(rootDir, importDirs).stream()
                .map(resolver -> (ImportResolver) new FileRecorderResolver(session, adjunctFinder, rootDir, resolver))
                .collect(Collectors.toList());

        var dialect = frontEnds.detect(mainSource);
        var frontEnd = frontEnds.forDialect(dialect);
        var primaryBundle = analyze(frontEnd, absPath.toString(), mainSource, resolvers, session);

        Map<String, SourceBundle> subBundles = new LinkedHashMap<>();
        var discoveredNewSources = true;
        while (discoveredNewSources) {
            Map<String, SourceBundle> newSubBundles = new LinkedHashMap<>();
            for (String path : session.paths()) {
                if (!subBundles.containsKey(path)) {
                    newSubBundles.put(path, analyze(frontEnd, path, session.source(path), resolvers, session));
                }
            }
            subBundles.putAll(newSubBundles);
            discoveredNewSources = !newSubBundles.isEmpty();
            if (discoveredNewSources) {
                LOGGER.info("Found {} new source files", newSubBundles.size());
            }
        }

        Map<String, List<AdjunctFile>> mainAdjuncts;
        try {
            mainAdjuncts = adjunctFinder.findAdjuncts(absPath);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        session.record(absPath.toString(), mainSource);
        session.throwIfInconsistent();
        session.addAdjuncts(mainAdjuncts);

        if (dialect == Dialect.CWL_1_0) {
            throw new UnsupportedDialectException("CWL is not handled at the moment, only WDL is supported");
        }
        LOGGER.info("Resolved '{}' as {}, {} imported files", absPath, dialect, subBundles.size());
        return ResolvedProject.builder()
                .mainFile(absPath.toString())
                .dialect(dialect)
                .primaryBundle(primaryBundle)
                .sources(session.sources())
                .adjuncts(session.adjuncts())
                .subBundles(subBundles.values())
                .build();
    }

    private List<ImportResolver> resolverChain(Path rootDir, List<Path> importDirs) {
        var resolvers = new ArrayList<ImportResolver>();
        resolvers.add(new DirectoryResolver(rootDir));
        for (Path importDir : importDirs) {
            resolvers.add(new DirectoryResolver(importDir));
        }
        Optional.ofNullable(networkResolver).filter(resolver -> options.networkImports()).ifPresent(resolvers::add);
        return resolvers;
    }

    private static SourceBundle analyze(LanguageFrontEnd frontEnd, String path, String source, List<ImportResolver> resolvers,
            ResolutionSession session) throws WdlcException {
        var result = frontEnd.analyze(source, resolvers);
        session.throwIfInconsistent();
        if (!result.isValid()) {
            LOGGER.error("Front-end rejected '{}'", path);
            throw new FrontEndRejectionException(String.format("Source '%s' is not valid", path), result.errors());
        }
        return result.bundle().orElseThrow();
    }
}
