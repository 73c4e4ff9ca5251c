package com.hartwig.wdlc.error;

public class ImportConsistencyException extends WdlcException {
    private final String path;

    public ImportConsistencyException(final String path) {
        super(String.format("'%s' has been imported twice, with different content", path));
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
