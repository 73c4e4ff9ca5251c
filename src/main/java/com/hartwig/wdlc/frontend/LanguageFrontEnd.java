package com.hartwig.wdlc.frontend;

import java.util.List;

import com.hartwig.wdlc.wdl.Dialect;

/**
 * Parser and type checker for one dialect. Lives outside this project, the compiler only drives it.
 */
public interface LanguageFrontEnd {
    Dialect dialect();

    /**
     * Cheap check whether the source is written in this front-end's dialect, without analyzing it.
     */
    boolean looksParsable(String source);

    /**
     * Analyzes a source and everything it imports. Imports are located with the resolvers, in order.
     */
    AnalysisResult analyze(String source, List<ImportResolver> resolvers);
}
