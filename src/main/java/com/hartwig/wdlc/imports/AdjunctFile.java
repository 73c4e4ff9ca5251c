package com.hartwig.wdlc.imports;

import org.immutables.value.Value;

/**
 * A file that accompanies a source file, carried along for packaging. It is not analyzed.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface AdjunctFile {
    enum Kind {
        README,
        DEVELOPER_NOTES
    }

    Kind kind();

    /**
     * Name of the task or workflow the file documents.
     */
    String subject();

    String text();

    static AdjunctFile readme(String subject, String text) {
        return ImmutableAdjunctFile.builder().kind(Kind.README).subject(subject).text(text).build();
    }

    static AdjunctFile developerNotes(String subject, String text) {
        return ImmutableAdjunctFile.builder().kind(Kind.DEVELOPER_NOTES).subject(subject).text(text).build();
    }
}
