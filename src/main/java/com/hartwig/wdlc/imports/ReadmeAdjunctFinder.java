package com.hartwig.wdlc.imports;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the readme files next to a source file. {@code readme.<name>.md} documents the task or workflow
 * {@code <name>} for users, {@code readme.developer.<name>.md} holds its developer notes. Names are matched
 * case-insensitively.
 */
public class ReadmeAdjunctFinder implements AdjunctFinder {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReadmeAdjunctFinder.class);

    private static final Pattern DEVELOPER_NOTES = Pattern.compile("(?i)^readme\\.developer\\.(\\w+)\\.md$");
    private static final Pattern README = Pattern.compile("(?i)^readme\\.(\\w+)\\.md$");

    @Override
    public Map<String, List<AdjunctFile>> findAdjuncts(Path sourceFile) {
        var directory = sourceFile.toAbsolutePath().getParent();
        if (directory == null || !Files.isDirectory(directory)) {
            return Map.of();
        }
        List<Path> candidates;
        try (var files = Files.list(directory)) {
            candidates = files.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException(String.format("Could not list directory '%s'", directory), e);
        }
        var adjuncts = new ArrayList<AdjunctFile>();
        for (Path candidate : candidates) {
            var fileName = candidate.getFileName().toString();
            var developerNotes = DEVELOPER_NOTES.matcher(fileName);
            var readme = README.matcher(fileName);
            if (developerNotes.matches()) {
                adjuncts.add(AdjunctFile.developerNotes(developerNotes.group(1), read(candidate)));
            } else if (readme.matches()) {
                adjuncts.add(AdjunctFile.readme(readme.group(1), read(candidate)));
            }
        }
        if (adjuncts.isEmpty()) {
            return Map.of();
        }
        LOGGER.debug("Found {} adjunct files for '{}'", adjuncts.size(), sourceFile);
        return Map.of(sourceFile.toString(), List.copyOf(adjuncts));
    }

    private static String read(Path file) {
        try {
            return Files.readString(file);
        } catch (IOException e) {
            throw new UncheckedIOException(String.format("Could not read adjunct file '%s'", file), e);
        }
    }
}
