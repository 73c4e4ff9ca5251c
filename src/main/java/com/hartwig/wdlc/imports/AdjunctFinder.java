package com.hartwig.wdlc.imports;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public interface AdjunctFinder {
    /**
     * Looks for the side files of a local source file, keyed by the path of that source file.
     */
    Map<String, List<AdjunctFile>> findAdjuncts(Path sourceFile);
}
