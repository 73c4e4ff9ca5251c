package com.hartwig.wdlc.imports;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.hartwig.wdlc.error.ImportConsistencyException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mutable state of one import resolution: every source file read so far and the adjuncts found next to them.
 * A session belongs to a single resolution run and must not be shared between compilations.
 */
public class ResolutionSession {
    private static final Logger LOGGER = LoggerFactory.getLogger(ResolutionSession.class);

    private final Map<String, String> sourceByPath = new LinkedHashMap<>();
    private final Map<String, List<AdjunctFile>> adjunctsByPath = new LinkedHashMap<>();
    private final List<ImportConsistencyException> inconsistencies = new ArrayList<>();

    /**
     * Records the content of a path. A path is never rebound to different content.
     *
     * @return false if the path was recorded before with different content.
     */
    public boolean record(String path, String content) {
        var existing = sourceByPath.get(path);
        if (existing == null) {
            LOGGER.debug("Recorded source '{}'", path);
            sourceByPath.put(path, content);
            return true;
        }
        if (!existing.equals(content)) {
            inconsistencies.add(new ImportConsistencyException(path));
            return false;
        }
        return true;
    }

    public void addAdjuncts(Map<String, List<AdjunctFile>> adjuncts) {
        adjunctsByPath.putAll(adjuncts);
    }

    public boolean contains(String path) {
        return sourceByPath.containsKey(path);
    }

    public String source(String path) {
        return sourceByPath.get(path);
    }

    /**
     * Snapshot of the recorded paths, in the order they were first seen.
     */
    public List<String> paths() {
        return List.copyOf(sourceByPath.keySet());
    }

    /**
     * Throws the first inconsistent re-import recorded in this session, if any.
     */
    public void throwIfInconsistent() throws ImportConsistencyException {
        if (!inconsistencies.isEmpty()) {
            throw inconsistencies.get(0);
        }
    }

    public Map<String, String> sources() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(sourceByPath));
    }

    public Map<String, List<AdjunctFile>> adjuncts() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(adjunctsByPath));
    }
}
