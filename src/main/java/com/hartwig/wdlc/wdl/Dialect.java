package com.hartwig.wdlc.wdl;

import com.hartwig.wdlc.error.UnsupportedDialectException;

/**
 * Mutually incompatible versions of the workflow language. Detected once per compilation unit.
 */
public enum Dialect {
    DRAFT_2("wdl", "draft-2", ""),
    V1_0("wdl", "1.0", "version 1.0"),
    DEVELOPMENT("wdl", "development", "version development"),
    CWL_1_0("cwl", "1.0", null);

    private final String language;
    private final String version;
    private final String versionStatement;

    Dialect(final String language, final String version, final String versionStatement) {
        this.language = language;
        this.version = version;
        this.versionStatement = versionStatement;
    }

    public String version() {
        return version;
    }

    /**
     * The line that has to open a standalone source file of this dialect. Empty for draft-2, which has none.
     */
    public String versionString() throws UnsupportedDialectException {
        if (versionStatement == null) {
            throw new UnsupportedDialectException(String.format("Unsupported language version %s", this));
        }
        return versionStatement;
    }

    /**
     * Draft-2 declares task inputs directly in the task body, without an {@code input} section.
     */
    public boolean hasInputSection() {
        return this != DRAFT_2;
    }

    @Override
    public String toString() {
        return language + " " + version;
    }
}
